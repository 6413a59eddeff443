package com.ryuqq.remoteexec.testkit.contract;

import com.ryuqq.remoteexec.core.exception.ErrorKind;
import com.ryuqq.remoteexec.core.exception.RemoteExecutionException;
import com.ryuqq.remoteexec.core.model.CommandExecution;
import com.ryuqq.remoteexec.core.model.ExecutionContext;
import com.ryuqq.remoteexec.core.model.Language;
import com.ryuqq.remoteexec.core.model.OperationKind;
import com.ryuqq.remoteexec.core.request.StatementRequest;
import com.ryuqq.remoteexec.core.spi.FailureType;
import com.ryuqq.remoteexec.core.spi.GatewayException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: submit failures surface as engine errors.
 *
 * <p>A failed submit never leaks the gateway exception. It is classified the same way a failed
 * status call is: transient failures become {@code POLL_FAILED}, permanent ones {@code POLL_ABORTED},
 * and the gateway exception stays available as the cause.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SubmitFailureContractTest extends AbstractEngineContractTest {

    @Test
    void testCommandSubmit_TransientFailure_PollFailed() {
        // Given
        ExecutionContext context = createContext();
        gateway.failNextSubmit(OperationKind.COMMAND, FailureType.TRANSIENT);

        // When
        RemoteExecutionException e = assertErrorKind(ErrorKind.POLL_FAILED,
                () -> engine.commands().submit(context, "print(1)", Language.PYTHON));

        // Then
        assertEquals(context.handle(), e.getHandle());
        GatewayException cause = assertInstanceOf(GatewayException.class, e.getCause());
        assertTrue(cause.isTransient());
        assertTrue(gateway.handles(OperationKind.COMMAND).isEmpty());
    }

    @Test
    void testCommandSubmit_AfterTransientFailure_ContextStillUsable() {
        // Given
        ExecutionContext context = createContext();
        gateway.failNextSubmit(OperationKind.COMMAND, FailureType.TRANSIENT);
        assertErrorKind(ErrorKind.POLL_FAILED, () -> engine.commands().submit(context, "print(1)", Language.PYTHON));

        // When
        CommandExecution submitted = engine.commands().submit(context, "print(1)", Language.PYTHON);

        // Then
        assertOk(engine.commands().awaitCompletion(submitted.handle()).result());
        assertTrue(engine.contexts().isLive(context));
    }

    @Test
    void testRunOnce_TransientSubmitFailure_PollFailedAndContextDestroyedOnce() {
        // Given
        gateway.failNextSubmit(OperationKind.COMMAND, FailureType.TRANSIENT);

        // When
        assertErrorKind(ErrorKind.POLL_FAILED,
                () -> engine.commands().runOnceAndWait(CLUSTER_ID, "print(1)", Language.PYTHON));

        // Then
        assertEveryContextDestroyedOnce();
    }

    @Test
    void testStatementSubmit_TransientFailure_PollFailed() {
        // Given
        gateway.failNextSubmit(OperationKind.STATEMENT, FailureType.TRANSIENT);

        // When
        RemoteExecutionException e = assertErrorKind(ErrorKind.POLL_FAILED,
                () -> engine.statements().submit(StatementRequest.of("SELECT 1", null)));

        // Then
        assertNull(e.getHandle());
        assertTrue(e.getMessage().contains(WAREHOUSE_ID), e.getMessage());
        assertTrue(gateway.handles(OperationKind.STATEMENT).isEmpty());
    }

    @Test
    void testStatementSubmit_PermanentFailure_PollAborted() {
        // Given
        gateway.failNextSubmit(OperationKind.STATEMENT, FailureType.PERMANENT);

        // When & Then
        assertErrorKind(ErrorKind.POLL_ABORTED,
                () -> engine.statements().submit(StatementRequest.of("SELEC 1", "wh-other")));
    }
}

package com.ryuqq.remoteexec.testkit.contract;

import com.ryuqq.remoteexec.core.model.CommandExecution;
import com.ryuqq.remoteexec.core.model.CommandOutput;
import com.ryuqq.remoteexec.core.model.CommandState;
import com.ryuqq.remoteexec.core.model.ExecutionContext;
import com.ryuqq.remoteexec.core.model.Language;
import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.model.ResultPage;
import com.ryuqq.remoteexec.core.model.StatementExecution;
import com.ryuqq.remoteexec.core.model.StatementState;
import com.ryuqq.remoteexec.core.poll.PollConfig;
import com.ryuqq.remoteexec.core.request.StatementRequest;
import com.ryuqq.remoteexec.core.snapshot.CommandSnapshot;
import com.ryuqq.remoteexec.core.snapshot.StatementSnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: terminal results are write-once.
 *
 * <p>Once a terminal result is recorded for a handle, later awaits return that same result
 * without polling again, and a cancel request never overwrites it.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Second await of a finished command returns the identical result</li>
 *   <li>Cancel after completion is ignored and never reaches the gateway</li>
 *   <li>Second await of a finished statement returns the identical result</li>
 *   <li>Concurrent awaiters of one handle all observe one result</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WriteOnceContractTest extends AbstractEngineContractTest {

    private static final PollConfig POLL = new PollConfig(1_000, 60_000);

    @Test
    void testAwait_AfterTerminal_ReturnsSameResultWithoutPolling() {
        // Given
        ExecutionContext context = createContext();
        OperationHandle handle = engine.commands().submit(context, "print(1)", Language.PYTHON).handle();
        CommandExecution first = engine.commands().awaitCompletion(handle, POLL);
        int fetchesAfterFirst = gateway.fetchCount(handle);

        // When
        CommandExecution second = engine.commands().awaitCompletion(handle, POLL);

        // Then
        assertSame(first, second, "Recorded result must be returned as-is");
        assertEquals(fetchesAfterFirst, gateway.fetchCount(handle), "No status call after the result was recorded");
    }

    @Test
    void testCancel_AfterTerminal_DoesNotOverwriteResult() {
        // Given
        ExecutionContext context = createContext();
        OperationHandle handle = engine.commands().submit(context, "print(1)", Language.PYTHON).handle();
        CommandExecution finished = engine.commands().awaitCompletion(handle, POLL);

        // When
        boolean cancelled = engine.commands().cancel(handle);

        // Then
        assertFalse(cancelled, "Cancel of a finished command must be a no-op");
        assertEquals(0, gateway.cancelCount(handle));
        CommandExecution again = engine.commands().awaitCompletion(handle, POLL);
        assertSame(finished, again);
        assertEquals(CommandState.FINISHED, again.state());
        assertOk(again.result());
    }

    @Test
    void testStatementAwait_AfterTerminal_ReturnsSameResult() {
        // Given
        gateway.enqueueStatementScript(
                StatementSnapshot.of("template", StatementState.RUNNING),
                StatementSnapshot.succeeded("template", ResultPage.empty()));
        OperationHandle handle = engine.statements().submit(StatementRequest.of("SELECT 1", null)).handle();

        // When
        StatementExecution first = engine.statements().awaitCompletion(handle, POLL);
        StatementExecution second = engine.statements().awaitCompletion(handle, POLL);

        // Then
        assertSame(first, second);
        assertFalse(engine.statements().cancel(handle), "Cancel of a finished statement must be a no-op");
        assertEquals(0, gateway.cancelCount(handle));
    }

    @Test
    void testConcurrentAwaiters_SameHandle_ObserveOneResult() throws Exception {
        // Given
        ExecutionContext context = createContext();
        gateway.enqueueCommandScript(
                CommandSnapshot.of("template", CommandState.RUNNING),
                CommandSnapshot.of("template", CommandState.RUNNING),
                CommandSnapshot.of("template", CommandState.RUNNING),
                new CommandSnapshot("template", CommandState.FINISHED, CommandOutput.text("done")));
        OperationHandle handle = engine.commands().submit(context, "print(1)", Language.PYTHON).handle();

        int awaiters = 4;
        ExecutorService executor = Executors.newFixedThreadPool(awaiters);
        try {
            List<Future<CommandExecution>> futures = new ArrayList<>();
            Callable<CommandExecution> await = () -> engine.commands().awaitCompletion(handle, POLL);

            // When
            for (int i = 0; i < awaiters; i++) {
                futures.add(executor.submit(await));
            }

            // Then
            CommandExecution expected = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<CommandExecution> future : futures) {
                assertSame(expected, future.get(10, TimeUnit.SECONDS), "All awaiters must see the recorded result");
            }
            assertEquals("done", assertOk(expected.result()).data());
        } finally {
            executor.shutdownNow();
        }
    }
}

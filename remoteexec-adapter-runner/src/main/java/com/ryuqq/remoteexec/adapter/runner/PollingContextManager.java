package com.ryuqq.remoteexec.adapter.runner;

import com.ryuqq.remoteexec.application.context.ContextValidity;
import com.ryuqq.remoteexec.application.context.ExecutionContextManager;
import com.ryuqq.remoteexec.application.poll.PollLoop;
import com.ryuqq.remoteexec.core.exception.ErrorKind;
import com.ryuqq.remoteexec.core.exception.RemoteExecutionException;
import com.ryuqq.remoteexec.core.model.ContextState;
import com.ryuqq.remoteexec.core.model.ExecutionContext;
import com.ryuqq.remoteexec.core.model.Language;
import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.model.OperationKind;
import com.ryuqq.remoteexec.core.poll.CancellationSignal;
import com.ryuqq.remoteexec.core.poll.PollConfig;
import com.ryuqq.remoteexec.core.poll.PollResult;
import com.ryuqq.remoteexec.core.request.ContextRequest;
import com.ryuqq.remoteexec.core.snapshot.ContextSnapshot;
import com.ryuqq.remoteexec.core.snapshot.StatusSnapshot;
import com.ryuqq.remoteexec.core.spi.GatewayException;
import com.ryuqq.remoteexec.core.spi.RemoteOperationGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 폴링 기반 {@link ExecutionContextManager} 구현체.
 *
 * <p><strong>생성 흐름:</strong></p>
 * <ol>
 *   <li>컨텍스트 생성 요청 제출</li>
 *   <li>PENDING이 아닐 때까지 폴링</li>
 *   <li>RUNNING: 살아있는 컨텍스트로 등록 후 반환</li>
 *   <li>그 외 (ERROR, 타임아웃, 폴링 실패): 생성 중이던 컨텍스트 폐기 후 CONTEXT_CREATION_FAILED</li>
 * </ol>
 *
 * <p>폐기는 {@link HandleLedger}를 통해 정확히 한 번만 Gateway로 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PollingContextManager implements ExecutionContextManager {

    private static final Logger log = LoggerFactory.getLogger(PollingContextManager.class);

    private final RemoteOperationGateway gateway;
    private final PollLoop pollLoop;
    private final HandleLedger<Void> ledger;
    private final HandleLedger<?> commandLedger;
    private final PollConfig creationPoll;
    private final ConcurrentMap<OperationHandle, ExecutionContext> live = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param gateway Remote Operation Gateway
     * @param pollLoop Poll Loop
     * @param ledger 컨텍스트 핸들 저장소
     * @param commandLedger 커맨드 핸들 저장소 (컨텍스트 파괴 시 소속 커맨드 항목 해제)
     * @param creationPoll 생성 대기 폴링 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public PollingContextManager(
        RemoteOperationGateway gateway,
        PollLoop pollLoop,
        HandleLedger<Void> ledger,
        HandleLedger<?> commandLedger,
        PollConfig creationPoll
    ) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        if (pollLoop == null) {
            throw new IllegalArgumentException("pollLoop cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (commandLedger == null) {
            throw new IllegalArgumentException("commandLedger cannot be null");
        }
        if (creationPoll == null) {
            throw new IllegalArgumentException("creationPoll cannot be null");
        }
        this.gateway = gateway;
        this.pollLoop = pollLoop;
        this.ledger = ledger;
        this.commandLedger = commandLedger;
        this.creationPoll = creationPoll;
    }

    @Override
    public ExecutionContext create(String clusterId, Language language) {
        ContextRequest request = new ContextRequest(clusterId, language);

        OperationHandle handle;
        try {
            handle = gateway.submit(request);
        } catch (GatewayException e) {
            throw new RemoteExecutionException(
                ErrorKind.CONTEXT_CREATION_FAILED, null,
                "Failed to request execution context on cluster " + clusterId + ": " + e.getMessage(), e
            );
        }
        ledger.register(handle);
        log.debug("Execution context {} requested on cluster {} ({})", handle.getOperationId(), clusterId, language);

        PollResult<ContextSnapshot> result = pollLoop.await(
            handle, ContextSnapshot.class, ContextSnapshot::isTerminal, creationPoll, CancellationSignal.none());

        if (result instanceof PollResult.Terminal<ContextSnapshot> terminal
            && terminal.snapshot().state() == ContextState.RUNNING) {
            ExecutionContext context = new ExecutionContext(handle.getOperationId(), clusterId, language, ContextState.RUNNING);
            live.put(handle, context);
            log.info("Execution context {} created on cluster {} ({}) in {} ms",
                context.contextId(), clusterId, language.wireName(), result.elapsedMs());
            return context;
        }

        String reason = describeCreationFailure(result);
        log.warn("Execution context {} on cluster {} could not be created: {}", handle.getOperationId(), clusterId, reason);
        disposeQuietly(handle);
        throw new RemoteExecutionException(
            ErrorKind.CONTEXT_CREATION_FAILED, handle,
            "Execution context on cluster " + clusterId + " could not be created: " + reason,
            failureCause(result)
        );
    }

    @Override
    public ContextValidity validate(ExecutionContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        OperationHandle handle = context.handle();
        if (ledger.isDisposed(handle)) {
            return ContextValidity.invalid("Execution context " + context.contextId() + " has been destroyed");
        }
        if (!context.isRunning()) {
            return ContextValidity.invalid("Execution context " + context.contextId() + " is not running (state: " + context.state() + ")");
        }

        StatusSnapshot snapshot;
        try {
            snapshot = gateway.fetchStatus(handle);
        } catch (GatewayException e) {
            if (e.isNotFound()) {
                return markLost(handle, "Execution context " + context.contextId() + " no longer exists", false);
            }
            if (e.isTransient()) {
                throw new RemoteExecutionException(
                    ErrorKind.POLL_FAILED, handle,
                    "Could not verify execution context " + context.contextId() + ": " + e.getMessage(), e
                );
            }
            return markLost(handle, "Execution context " + context.contextId() + " status check failed: " + e.getMessage(), true);
        }

        if (!(snapshot instanceof ContextSnapshot contextSnapshot)) {
            return markLost(handle, "Unexpected status for execution context " + context.contextId() + ": " + snapshot, true);
        }
        if (contextSnapshot.state() == ContextState.RUNNING) {
            return ContextValidity.valid();
        }
        String detail = contextSnapshot.errorMessage() == null ? "" : " (" + contextSnapshot.errorMessage() + ")";
        return markLost(handle, "Execution context " + context.contextId() + " is " + contextSnapshot.state() + detail, true);
    }

    @Override
    public void destroy(ExecutionContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        OperationHandle handle = context.handle();
        live.remove(handle);
        releaseCommands(handle);
        if (!ledger.dispose(handle)) {
            log.debug("Execution context {} already destroyed", context.contextId());
            return;
        }
        if (sendDispose(handle)) {
            log.info("Execution context {} destroyed on cluster {}", context.contextId(), context.clusterId());
        }
    }

    @Override
    public boolean isLive(ExecutionContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        OperationHandle handle = context.handle();
        return live.containsKey(handle) && !ledger.isDisposed(handle);
    }

    /**
     * 컨텍스트를 잃은 것으로 표시. 대기 중인 커맨드는 CONTEXT_LOST로 끝나고 새 제출은 거부됩니다.
     *
     * @param releaseRemote 플랫폼에 남아 있을 수 있으면 true (폐기 요청을 한 번 보냄)
     */
    private ContextValidity markLost(OperationHandle handle, String reason, boolean releaseRemote) {
        live.remove(handle);
        if (ledger.dispose(handle)) {
            log.info("Execution context {} on cluster {} marked as lost: {}",
                handle.getOperationId(), handle.getResourceScope(), reason);
            if (releaseRemote) {
                sendDispose(handle);
            }
        }
        return ContextValidity.invalid(reason);
    }

    private void releaseCommands(OperationHandle contextHandle) {
        int released = commandLedger.release(
            command -> command.getKind() == OperationKind.COMMAND && contextHandle.equals(command.contextHandle()));
        if (released > 0) {
            log.debug("Released {} command entries of execution context {}", released, contextHandle.getOperationId());
        }
    }

    private void disposeQuietly(OperationHandle handle) {
        if (ledger.dispose(handle)) {
            sendDispose(handle);
        }
    }

    /**
     * Gateway 폐기 요청. 실패는 로그만 남깁니다.
     *
     * @return 폐기 요청이 성공했으면 true
     */
    private boolean sendDispose(OperationHandle handle) {
        try {
            gateway.dispose(handle);
            return true;
        } catch (GatewayException e) {
            if (e.isNotFound()) {
                log.debug("Execution context {} already gone on cluster {}", handle.getOperationId(), handle.getResourceScope());
                return true;
            }
            log.warn("Failed to destroy execution context {} on cluster {}: {}",
                handle.getOperationId(), handle.getResourceScope(), e.toString());
            return false;
        } catch (RuntimeException e) {
            log.warn("Failed to destroy execution context {} on cluster {}",
                handle.getOperationId(), handle.getResourceScope(), e);
            return false;
        }
    }

    private String describeCreationFailure(PollResult<ContextSnapshot> result) {
        if (result instanceof PollResult.Terminal<ContextSnapshot> terminal) {
            ContextSnapshot snapshot = terminal.snapshot();
            return "context entered " + snapshot.state()
                + (snapshot.errorMessage() == null ? "" : ": " + snapshot.errorMessage());
        }
        if (result instanceof PollResult.TimedOut<ContextSnapshot>) {
            return "not ready within " + creationPoll.maxWaitMs() + " ms";
        }
        if (result instanceof PollResult.Cancelled<ContextSnapshot>) {
            return "interrupted while waiting for readiness";
        }
        if (result instanceof PollResult.Aborted<ContextSnapshot> aborted) {
            return "status check aborted: " + aborted.cause().getMessage();
        }
        if (result instanceof PollResult.Failed<ContextSnapshot> failed) {
            return "status check failed " + failed.polls() + " times: " + failed.lastFailure().getMessage();
        }
        return String.valueOf(result);
    }

    private Throwable failureCause(PollResult<ContextSnapshot> result) {
        if (result instanceof PollResult.Aborted<ContextSnapshot> aborted) {
            return aborted.cause();
        }
        if (result instanceof PollResult.Failed<ContextSnapshot> failed) {
            return failed.lastFailure();
        }
        return null;
    }
}

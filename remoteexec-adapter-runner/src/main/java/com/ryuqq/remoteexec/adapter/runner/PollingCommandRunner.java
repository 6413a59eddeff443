package com.ryuqq.remoteexec.adapter.runner;

import com.ryuqq.remoteexec.application.command.CommandRunner;
import com.ryuqq.remoteexec.application.context.ExecutionContextManager;
import com.ryuqq.remoteexec.application.poll.PollLoop;
import com.ryuqq.remoteexec.core.exception.ErrorKind;
import com.ryuqq.remoteexec.core.exception.RemoteExecutionException;
import com.ryuqq.remoteexec.core.model.CommandExecution;
import com.ryuqq.remoteexec.core.model.CommandOutput;
import com.ryuqq.remoteexec.core.model.CommandState;
import com.ryuqq.remoteexec.core.model.ExecutionContext;
import com.ryuqq.remoteexec.core.model.Language;
import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.model.OperationKind;
import com.ryuqq.remoteexec.core.outcome.Cancelled;
import com.ryuqq.remoteexec.core.outcome.Fail;
import com.ryuqq.remoteexec.core.outcome.Ok;
import com.ryuqq.remoteexec.core.outcome.Outcome;
import com.ryuqq.remoteexec.core.poll.CancellationSignal;
import com.ryuqq.remoteexec.core.poll.PollConfig;
import com.ryuqq.remoteexec.core.poll.PollResult;
import com.ryuqq.remoteexec.core.request.CommandRequest;
import com.ryuqq.remoteexec.core.snapshot.CommandSnapshot;
import com.ryuqq.remoteexec.core.spi.GatewayException;
import com.ryuqq.remoteexec.core.spi.RemoteOperationGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 폴링 기반 {@link CommandRunner} 구현체.
 *
 * <p><strong>대기 흐름:</strong></p>
 * <ol>
 *   <li>기록된 종료 결과가 있으면 그대로 반환</li>
 *   <li>소유 컨텍스트가 파괴되었거나 잃은 것으로 표시되었으면 Fail(CONTEXT_LOST)</li>
 *   <li>FINISHED / ERROR / CANCELLED까지 폴링 (대기 중 컨텍스트를 잃으면 Fail(CONTEXT_LOST))</li>
 *   <li>상태 조회가 NOT_FOUND면 Fail(CONTEXT_LOST)</li>
 *   <li>결과를 한 번만 기록하고 반환</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PollingCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(PollingCommandRunner.class);

    private final RemoteOperationGateway gateway;
    private final PollLoop pollLoop;
    private final HandleLedger<CommandExecution> ledger;
    private final HandleLedger<?> contextLedger;
    private final ExecutionContextManager contexts;
    private final PollConfig defaultPoll;
    private final PollConfig runOncePoll;

    /**
     * 생성자.
     *
     * @param gateway Remote Operation Gateway
     * @param pollLoop Poll Loop
     * @param ledger 커맨드 핸들 저장소
     * @param contextLedger 컨텍스트 핸들 저장소 (컨텍스트 관리자와 공유)
     * @param contexts 컨텍스트 관리자
     * @param defaultPoll 기본 커맨드 폴링 설정
     * @param runOncePoll runOnceAndWait 기본 폴링 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public PollingCommandRunner(
        RemoteOperationGateway gateway,
        PollLoop pollLoop,
        HandleLedger<CommandExecution> ledger,
        HandleLedger<?> contextLedger,
        ExecutionContextManager contexts,
        PollConfig defaultPoll,
        PollConfig runOncePoll
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
        if (contextLedger == null) {
            throw new IllegalArgumentException("contextLedger cannot be null");
        }
        if (contexts == null) {
            throw new IllegalArgumentException("contexts cannot be null");
        }
        if (defaultPoll == null) {
            throw new IllegalArgumentException("defaultPoll cannot be null");
        }
        if (runOncePoll == null) {
            throw new IllegalArgumentException("runOncePoll cannot be null");
        }
        this.gateway = gateway;
        this.pollLoop = pollLoop;
        this.ledger = ledger;
        this.contextLedger = contextLedger;
        this.contexts = contexts;
        this.defaultPoll = defaultPoll;
        this.runOncePoll = runOncePoll;
    }

    @Override
    public CommandExecution submit(ExecutionContext context, String code, Language language) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (!context.isRunning()) {
            throw new RemoteExecutionException(
                ErrorKind.INVALID_CONTEXT, context.handle(),
                "Execution context " + context.contextId() + " is not running (state: " + context.state() + ")"
            );
        }
        if (contextLedger.isDisposed(context.handle())) {
            throw new RemoteExecutionException(
                ErrorKind.INVALID_CONTEXT, context.handle(),
                "Execution context " + context.contextId() + " has been destroyed or lost"
            );
        }

        Language effective = language == null ? context.language() : language;
        CommandRequest request = CommandRequest.of(context, code, effective);

        OperationHandle handle;
        try {
            handle = gateway.submit(request);
        } catch (GatewayException e) {
            if (e.isNotFound()) {
                throw new RemoteExecutionException(
                    ErrorKind.INVALID_CONTEXT, context.handle(),
                    "Execution context " + context.contextId() + " no longer exists", e
                );
            }
            throw new RemoteExecutionException(
                e.isTransient() ? ErrorKind.POLL_FAILED : ErrorKind.POLL_ABORTED, context.handle(),
                "Failed to submit command to context " + context.contextId() + ": " + e.getMessage(), e
            );
        }
        ledger.register(handle);
        log.info("Command {} submitted to context {} ({}): {}",
            handle.getOperationId(), context.contextId(), effective.wireName(), LogText.truncate(code));
        return CommandExecution.pending(handle);
    }

    @Override
    public CommandExecution awaitCompletion(OperationHandle handle, PollConfig config, CancellationSignal signal) {
        requireCommandHandle(handle);
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }
        ledger.requireUsable(handle);

        CommandExecution recorded = ledger.terminalOrNull(handle);
        if (recorded != null) {
            return recorded;
        }
        OperationHandle contextHandle = handle.contextHandle();
        if (contextLedger.isDisposed(contextHandle)) {
            return record(contextLost(handle, "Execution context " + handle.getParentId() + " has been destroyed or lost"));
        }
        ledger.register(handle);

        PollResult<CommandSnapshot> result = pollLoop.await(
            handle, CommandSnapshot.class,
            snapshot -> snapshot.isTerminal() || contextLedger.isDisposed(contextHandle),
            config, signal);

        if (result instanceof PollResult.Terminal<CommandSnapshot> terminal && terminal.snapshot().isTerminal()) {
            return record(toExecution(handle, terminal.snapshot()));
        }
        if (contextLedger.isDisposed(contextHandle)) {
            return record(contextLost(handle, "Execution context " + handle.getParentId() + " was lost while waiting"));
        }
        if (result instanceof PollResult.Aborted<CommandSnapshot> aborted && aborted.isNotFound()) {
            return record(contextLost(handle, "Execution context " + handle.getParentId() + " is gone: "
                + aborted.cause().getMessage()));
        }
        throw PollFailures.toException(result, handle, config, ErrorKind.CONTEXT_LOST);
    }

    @Override
    public CommandExecution awaitCompletion(OperationHandle handle) {
        return awaitCompletion(handle, defaultPoll, CancellationSignal.none());
    }

    @Override
    public boolean cancel(OperationHandle handle) {
        requireCommandHandle(handle);
        if (ledger.terminalOrNull(handle) != null) {
            log.debug("Command {} already finished, cancel ignored", handle.getOperationId());
            return false;
        }
        try {
            gateway.cancel(handle);
            log.info("Cancel requested for command {}", handle.getOperationId());
            return true;
        } catch (GatewayException e) {
            if (e.isNotFound()) {
                log.debug("Command {} not found, nothing to cancel", handle.getOperationId());
            } else {
                log.warn("Failed to cancel command {}: {}", handle.getOperationId(), e.toString());
            }
            return false;
        }
    }

    @Override
    public CommandExecution runOnceAndWait(String clusterId, String code, Language language, PollConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        ExecutionContext context = contexts.create(clusterId, language);
        try {
            CommandExecution submitted = submit(context, code, language);
            return awaitCompletion(submitted.handle(), config, CancellationSignal.none());
        } finally {
            contexts.destroy(context);
        }
    }

    @Override
    public CommandExecution runOnceAndWait(String clusterId, String code, Language language) {
        return runOnceAndWait(clusterId, code, language, runOncePoll);
    }

    private CommandExecution toExecution(OperationHandle handle, CommandSnapshot snapshot) {
        CommandOutput output = snapshot.output();
        Outcome<CommandOutput> outcome;
        switch (snapshot.state()) {
            case FINISHED:
                if (output != null && output.isError()) {
                    outcome = Fail.of(COMMAND_ERROR, messageOf(output, "Command raised an error"), output.cause());
                } else {
                    outcome = Ok.of(output != null ? output : CommandOutput.text(""));
                }
                break;
            case ERROR:
                outcome = Fail.of(COMMAND_FAILED, messageOf(output, "Command failed"), output == null ? null : output.cause());
                break;
            case CANCELLED:
                outcome = Cancelled.of("Command cancelled");
                break;
            default:
                throw new IllegalStateException("Not a terminal command state: " + snapshot.state());
        }
        return new CommandExecution(handle, snapshot.state(), outcome);
    }

    private CommandExecution contextLost(OperationHandle handle, String message) {
        return new CommandExecution(handle, CommandState.ERROR, Fail.of(CONTEXT_LOST, message));
    }

    private CommandExecution record(CommandExecution execution) {
        CommandExecution recorded = ledger.recordTerminal(execution.handle(), execution);
        if (recorded == execution) {
            log.info("Command {} finished: {} {}", execution.commandId(), execution.state(), describe(execution.result()));
        }
        return recorded;
    }

    private String messageOf(CommandOutput output, String fallback) {
        if (output == null || output.summary() == null || output.summary().isBlank()) {
            return fallback;
        }
        return output.summary();
    }

    private String describe(Outcome<CommandOutput> outcome) {
        if (outcome instanceof Fail<CommandOutput> fail) {
            return fail.errorCode() + " (" + fail.message() + ")";
        }
        return outcome.isOk() ? "OK" : "CANCELLED";
    }

    private void requireCommandHandle(OperationHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (handle.getKind() != OperationKind.COMMAND) {
            throw new IllegalArgumentException("handle must be a command handle (kind: " + handle.getKind() + ")");
        }
    }
}

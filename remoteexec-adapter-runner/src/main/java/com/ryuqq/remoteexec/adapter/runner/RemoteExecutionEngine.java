package com.ryuqq.remoteexec.adapter.runner;

import com.ryuqq.remoteexec.application.command.CommandRunner;
import com.ryuqq.remoteexec.application.context.ExecutionContextManager;
import com.ryuqq.remoteexec.application.poll.PollLoop;
import com.ryuqq.remoteexec.application.run.RunWaiter;
import com.ryuqq.remoteexec.application.statement.StatementRunner;
import com.ryuqq.remoteexec.core.model.CommandExecution;
import com.ryuqq.remoteexec.core.spi.RemoteOperationGateway;

/**
 * 엔진 조립 진입점.
 *
 * <p>하나의 Gateway 인스턴스를 명시적으로 받아 Poll Loop, 작업 종류별 핸들 저장소, 각 Runner를 연결합니다.
 * 전역 싱글턴은 없으며, 엔진마다 독립된 핸들 저장소를 가집니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RemoteExecutionEngine engine = RemoteExecutionEngine.create(gateway);
 * CommandExecution execution = engine.commands()
 *     .runOnceAndWait("cluster-1", "print(42)", Language.PYTHON);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RemoteExecutionEngine {

    private final EngineConfig config;
    private final PollLoop pollLoop;
    private final ExecutionContextManager contexts;
    private final CommandRunner commands;
    private final StatementRunner statements;
    private final RunWaiter runs;

    private RemoteExecutionEngine(RemoteOperationGateway gateway, EngineConfig config, PollTimer timer) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (timer == null) {
            throw new IllegalArgumentException("timer cannot be null");
        }
        int retained = config.maxRetainedResults();
        HandleLedger<Void> contextLedger = new HandleLedger<>(retained);
        HandleLedger<CommandExecution> commandLedger = new HandleLedger<>(retained);
        this.config = config;
        this.pollLoop = new GatewayPollLoop(gateway, timer);
        this.contexts = new PollingContextManager(gateway, pollLoop, contextLedger, commandLedger, config.contextPoll());
        this.commands = new PollingCommandRunner(
            gateway, pollLoop, commandLedger, contextLedger, contexts, config.commandPoll(), config.runOncePoll());
        this.statements = new PollingStatementRunner(
            gateway, pollLoop, new HandleLedger<>(retained), config.defaultWarehouseId());
        this.runs = new PollingRunWaiter(pollLoop, new HandleLedger<>(retained));
    }

    public static RemoteExecutionEngine create(RemoteOperationGateway gateway) {
        return new RemoteExecutionEngine(gateway, new EngineConfig(), SystemPollTimer.INSTANCE);
    }

    public static RemoteExecutionEngine create(RemoteOperationGateway gateway, EngineConfig config) {
        return new RemoteExecutionEngine(gateway, config, SystemPollTimer.INSTANCE);
    }

    /**
     * 시계를 지정하여 엔진 생성 (테스트용 가상 시계 등).
     */
    public static RemoteExecutionEngine create(RemoteOperationGateway gateway, EngineConfig config, PollTimer timer) {
        return new RemoteExecutionEngine(gateway, config, timer);
    }

    public EngineConfig config() {
        return config;
    }

    public PollLoop pollLoop() {
        return pollLoop;
    }

    public ExecutionContextManager contexts() {
        return contexts;
    }

    public CommandRunner commands() {
        return commands;
    }

    public StatementRunner statements() {
        return statements;
    }

    public RunWaiter runs() {
        return runs;
    }
}

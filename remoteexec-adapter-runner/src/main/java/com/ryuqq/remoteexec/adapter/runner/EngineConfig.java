package com.ryuqq.remoteexec.adapter.runner;

import com.ryuqq.remoteexec.core.poll.PollConfig;

import java.util.Map;

/**
 * 엔진 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>contextPoll: 컨텍스트 생성 대기 (기본 1초 / 2분)</li>
 *   <li>commandPoll: 커맨드 대기 (기본 2초 / 5분)</li>
 *   <li>runOncePoll: runOnceAndWait 커맨드 대기 (기본 2초 / 60초)</li>
 *   <li>statementPoll: Statement 대기 (기본 1초 / 5분)</li>
 *   <li>runPoll: Job Run 대기 (기본 10초 / 60분)</li>
 *   <li>defaultWarehouseId: 웨어하우스가 지정되지 않은 Statement에 사용 (기본 없음)</li>
 *   <li>maxRetainedResults: 작업 종류별로 보존할 종료/폐기 핸들 수 (기본 10,000)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param contextPoll 컨텍스트 폴링 설정
 * @param commandPoll 커맨드 폴링 설정
 * @param runOncePoll runOnceAndWait 폴링 설정
 * @param statementPoll Statement 폴링 설정
 * @param runPoll Job Run 폴링 설정
 * @param defaultWarehouseId 기본 웨어하우스 ID (null 가능)
 * @param maxRetainedResults 종료/폐기 핸들 보존 개수 (양수)
 */
public record EngineConfig(
    PollConfig contextPoll,
    PollConfig commandPoll,
    PollConfig runOncePoll,
    PollConfig statementPoll,
    PollConfig runPoll,
    String defaultWarehouseId,
    int maxRetainedResults
) {

    public static final String WAREHOUSE_ENV = "DATABRICKS_WAREHOUSE_ID";

    /**
     * 기본 설정 생성자.
     */
    public EngineConfig() {
        this(PollConfig.forContexts(), PollConfig.forCommands(), PollConfig.forRunOnce(),
            PollConfig.forStatements(), PollConfig.forRuns(), null, HandleLedger.DEFAULT_MAX_RETAINED);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 폴링 설정이 null이거나 maxRetainedResults가 양수가 아닌 경우
     */
    public EngineConfig {
        if (contextPoll == null) {
            throw new IllegalArgumentException("contextPoll cannot be null");
        }
        if (commandPoll == null) {
            throw new IllegalArgumentException("commandPoll cannot be null");
        }
        if (runOncePoll == null) {
            throw new IllegalArgumentException("runOncePoll cannot be null");
        }
        if (statementPoll == null) {
            throw new IllegalArgumentException("statementPoll cannot be null");
        }
        if (runPoll == null) {
            throw new IllegalArgumentException("runPoll cannot be null");
        }
        if (maxRetainedResults <= 0) {
            throw new IllegalArgumentException("maxRetainedResults must be positive (current: " + maxRetainedResults + ")");
        }
        if (defaultWarehouseId != null && defaultWarehouseId.isBlank()) {
            defaultWarehouseId = null;
        }
    }

    /**
     * 환경 변수에서 기본 웨어하우스를 읽은 기본 설정.
     *
     * @param environment 환경 변수 (보통 {@code System.getenv()})
     * @return 설정
     */
    public static EngineConfig fromEnvironment(Map<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        return new EngineConfig().withDefaultWarehouseId(environment.get(WAREHOUSE_ENV));
    }

    public EngineConfig withContextPoll(PollConfig contextPoll) {
        return new EngineConfig(contextPoll, commandPoll, runOncePoll, statementPoll, runPoll, defaultWarehouseId, maxRetainedResults);
    }

    public EngineConfig withCommandPoll(PollConfig commandPoll) {
        return new EngineConfig(contextPoll, commandPoll, runOncePoll, statementPoll, runPoll, defaultWarehouseId, maxRetainedResults);
    }

    public EngineConfig withRunOncePoll(PollConfig runOncePoll) {
        return new EngineConfig(contextPoll, commandPoll, runOncePoll, statementPoll, runPoll, defaultWarehouseId, maxRetainedResults);
    }

    public EngineConfig withStatementPoll(PollConfig statementPoll) {
        return new EngineConfig(contextPoll, commandPoll, runOncePoll, statementPoll, runPoll, defaultWarehouseId, maxRetainedResults);
    }

    public EngineConfig withRunPoll(PollConfig runPoll) {
        return new EngineConfig(contextPoll, commandPoll, runOncePoll, statementPoll, runPoll, defaultWarehouseId, maxRetainedResults);
    }

    public EngineConfig withDefaultWarehouseId(String defaultWarehouseId) {
        return new EngineConfig(contextPoll, commandPoll, runOncePoll, statementPoll, runPoll, defaultWarehouseId, maxRetainedResults);
    }

    public EngineConfig withMaxRetainedResults(int maxRetainedResults) {
        return new EngineConfig(contextPoll, commandPoll, runOncePoll, statementPoll, runPoll, defaultWarehouseId, maxRetainedResults);
    }
}

package com.ryuqq.remoteexec.core.model;

/**
 * Job Run 관찰 결과.
 *
 * <p>Run은 전적으로 외부 플랫폼이 소유하며, RunWaiter는 폴링으로 관찰만 합니다.</p>
 *
 * @param runId Run ID
 * @param lifeCycleState 생명주기 상태
 * @param resultState 결과 상태 (종료 전에는 null)
 * @param stateMessage 플랫폼이 제공한 상태 메시지 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobRun(
    String runId,
    RunLifeCycleState lifeCycleState,
    RunResultState resultState,
    String stateMessage
) {

    public JobRun {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId cannot be null or blank");
        }
        if (lifeCycleState == null) {
            throw new IllegalArgumentException("lifeCycleState cannot be null");
        }
    }

    public boolean isTerminal() {
        return lifeCycleState.isTerminal();
    }

    public boolean isSuccess() {
        return resultState == RunResultState.SUCCESS;
    }
}

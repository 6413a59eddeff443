package com.ryuqq.remoteexec.application.run;

import com.ryuqq.remoteexec.core.model.JobRun;
import com.ryuqq.remoteexec.core.outcome.Outcome;
import com.ryuqq.remoteexec.core.poll.CancellationSignal;
import com.ryuqq.remoteexec.core.poll.PollConfig;

/**
 * 이미 시작된 Job Run의 종료를 기다리는 Waiter.
 *
 * <p>Run을 생성하지 않습니다. resultState가 SUCCESS인 경우에만 Ok이며,
 * 그 외 종료는 Fail(resultState 또는 lifeCycleState, stateMessage)입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RunWaiter {

    /**
     * Run 종료까지 대기.
     *
     * @param runId Run ID
     * @param config 폴링 설정
     * @param signal 취소 신호
     * @return Ok(run) 또는 Fail
     * @throws com.ryuqq.remoteexec.core.exception.RemoteExecutionException
     *         TIMED_OUT, CANCELLED, NOT_FOUND, POLL_FAILED, POLL_ABORTED
     */
    Outcome<JobRun> waitForCompletion(String runId, PollConfig config, CancellationSignal signal);

    /**
     * Run 종료까지 대기 (간격 / 최대 대기 시간 지정).
     */
    default Outcome<JobRun> waitForCompletion(String runId, long pollIntervalMs, long maxWaitMs) {
        return waitForCompletion(runId, new PollConfig(pollIntervalMs, maxWaitMs), CancellationSignal.none());
    }
}

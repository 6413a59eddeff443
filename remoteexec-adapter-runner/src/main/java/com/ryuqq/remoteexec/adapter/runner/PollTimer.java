package com.ryuqq.remoteexec.adapter.runner;

import com.ryuqq.remoteexec.core.poll.CancellationSignal;

/**
 * Poll Loop가 사용하는 시계 및 대기 추상화.
 *
 * <p>테스트에서는 가상 시계로 교체하여 실제 시간을 소비하지 않고
 * 마감 시각 및 간격 규칙을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface PollTimer {

    /**
     * 단조 증가 시각 (나노초).
     *
     * @return 현재 시각
     */
    long nanoTime();

    /**
     * 주어진 시간 동안 대기. 취소 신호가 오면 즉시 깨어납니다.
     *
     * @param nanos 대기 시간 (나노초)
     * @param signal 취소 신호
     * @return 취소로 깨어난 경우 true
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    boolean sleep(long nanos, CancellationSignal signal) throws InterruptedException;
}

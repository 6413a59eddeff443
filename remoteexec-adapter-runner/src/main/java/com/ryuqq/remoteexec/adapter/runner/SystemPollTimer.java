package com.ryuqq.remoteexec.adapter.runner;

import com.ryuqq.remoteexec.core.poll.CancellationSignal;

/**
 * 시스템 시계 기반 {@link PollTimer}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SystemPollTimer implements PollTimer {

    public static final SystemPollTimer INSTANCE = new SystemPollTimer();

    private SystemPollTimer() {
    }

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    @Override
    public boolean sleep(long nanos, CancellationSignal signal) throws InterruptedException {
        return signal.await(nanos);
    }
}

package com.ryuqq.remoteexec.testkit.contract;

import com.ryuqq.remoteexec.adapter.runner.PollTimer;
import com.ryuqq.remoteexec.core.poll.CancellationSignal;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;

/**
 * Virtual-time {@link PollTimer} for deterministic contract tests.
 *
 * <p>Sleeping never blocks: the clock jumps forward by the requested amount. A sleep on a
 * cancelled signal returns immediately without moving the clock, which is how a real timer
 * behaves when the cancel arrives mid-sleep.</p>
 *
 * <p><strong>Hooks:</strong> {@link #onSleep(LongConsumer)} runs at the start of every sleep with
 * the requested duration in milliseconds. Use it to cancel a waiter between poll iterations.</p>
 *
 * <p><strong>Thread Safety:</strong> the clock is shared by all loops using this timer and is
 * guarded by this instance's monitor. Hooks run outside the monitor.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ManualPollTimer implements PollTimer {

    private long nowNanos;
    private final List<Long> sleepsMs = new ArrayList<>();
    private volatile LongConsumer sleepHook = millis -> { };

    @Override
    public synchronized long nanoTime() {
        return nowNanos;
    }

    @Override
    public boolean sleep(long nanos, CancellationSignal signal) {
        long millis = TimeUnit.NANOSECONDS.toMillis(nanos);
        sleepHook.accept(millis);
        synchronized (this) {
            sleepsMs.add(millis);
            if (signal.isCancelled()) {
                return true;
            }
            nowNanos += Math.max(0, nanos);
            return false;
        }
    }

    /**
     * Moves the clock forward, e.g. to simulate status-call latency.
     *
     * @param millis milliseconds to advance
     */
    public synchronized void advanceMs(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis must be non-negative (current: " + millis + ")");
        }
        nowNanos += TimeUnit.MILLISECONDS.toNanos(millis);
    }

    public synchronized long nowMs() {
        return TimeUnit.NANOSECONDS.toMillis(nowNanos);
    }

    /**
     * Durations of all sleeps requested so far, in milliseconds.
     */
    public synchronized List<Long> sleepsMs() {
        return new ArrayList<>(sleepsMs);
    }

    public ManualPollTimer onSleep(LongConsumer hook) {
        if (hook == null) {
            throw new IllegalArgumentException("hook cannot be null");
        }
        this.sleepHook = hook;
        return this;
    }
}

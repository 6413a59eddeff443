package com.ryuqq.remoteexec.adapter.runner;

import com.ryuqq.remoteexec.application.poll.PollLoop;
import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.poll.CancellationSignal;
import com.ryuqq.remoteexec.core.poll.PollConfig;
import com.ryuqq.remoteexec.core.poll.PollResult;
import com.ryuqq.remoteexec.core.snapshot.StatusSnapshot;
import com.ryuqq.remoteexec.core.spi.FailureType;
import com.ryuqq.remoteexec.core.spi.GatewayException;
import com.ryuqq.remoteexec.core.spi.RemoteOperationGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Gateway 기반 {@link PollLoop} 구현체.
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>진입 시각 기록</li>
 *   <li>반복 시작 시 취소 신호 확인 → Cancelled</li>
 *   <li>fetchStatus() 호출</li>
 *   <li>  - 종료 상태: 즉시 Terminal</li>
 *   <li>  - 일시적 실패: 연속 실패 횟수 증가, 허용 횟수 초과 시 Failed</li>
 *   <li>  - 영구 실패 / NOT_FOUND: 즉시 Aborted</li>
 *   <li>마지막 조회였다면 TimedOut</li>
 *   <li>남은 시간 ≤ 간격: 마감 시각까지만 대기 후 마지막 조회</li>
 *   <li>그 외: 간격만큼 대기 (취소 시 즉시 깨어남)</li>
 * </ol>
 *
 * <p><strong>시간 보장:</strong></p>
 * <ul>
 *   <li>대기는 마감 시각을 넘지 않음</li>
 *   <li>총 소요 시간 ≤ maxWait + 상태 조회 1회 지연</li>
 *   <li>진행 중인 상태 조회는 취소되지 않으며, 그 결과가 우선함</li>
 * </ul>
 *
 * <p>인스턴스 간 / 호출 간 공유 상태가 없으므로 thread-safe합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class GatewayPollLoop implements PollLoop {

    private static final Logger log = LoggerFactory.getLogger(GatewayPollLoop.class);

    private final RemoteOperationGateway gateway;
    private final PollTimer timer;

    /**
     * 생성자 (시스템 시계).
     *
     * @param gateway Remote Operation Gateway
     * @throws IllegalArgumentException gateway가 null인 경우
     */
    public GatewayPollLoop(RemoteOperationGateway gateway) {
        this(gateway, SystemPollTimer.INSTANCE);
    }

    /**
     * 생성자.
     *
     * @param gateway Remote Operation Gateway
     * @param timer 시계 및 대기
     * @throws IllegalArgumentException gateway 또는 timer가 null인 경우
     */
    public GatewayPollLoop(RemoteOperationGateway gateway, PollTimer timer) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        if (timer == null) {
            throw new IllegalArgumentException("timer cannot be null");
        }
        this.gateway = gateway;
        this.timer = timer;
    }

    @Override
    public <S extends StatusSnapshot> PollResult<S> await(
        OperationHandle handle,
        Class<S> snapshotType,
        Predicate<? super S> isTerminal,
        PollConfig config,
        CancellationSignal signal
    ) {
        validateInput(handle, snapshotType, isTerminal, config, signal);

        long startNanos = timer.nanoTime();
        long maxWaitNanos = TimeUnit.MILLISECONDS.toNanos(config.maxWaitMs());
        long intervalNanos = TimeUnit.MILLISECONDS.toNanos(config.pollIntervalMs());

        S lastSnapshot = null;
        int polls = 0;
        int consecutiveFailures = 0;
        boolean finalPoll = false;

        while (true) {
            if (signal.isCancelled()) {
                log.debug("Polling {} cancelled after {} polls", handle, polls);
                return new PollResult.Cancelled<>(lastSnapshot, polls, elapsedMs(startNanos));
            }

            polls++;
            try {
                S snapshot = fetch(handle, snapshotType);
                consecutiveFailures = 0;
                lastSnapshot = snapshot;
                if (isTerminal.test(snapshot)) {
                    log.debug("Polling {} reached terminal after {} polls: {}", handle, polls, snapshot);
                    return new PollResult.Terminal<>(snapshot, polls, elapsedMs(startNanos));
                }
                log.debug("Poll #{} for {}: {}", polls, handle, snapshot);
            } catch (GatewayException e) {
                if (!e.isTransient()) {
                    log.error("Polling {} aborted on poll #{}: {}", handle, polls, e.toString());
                    return new PollResult.Aborted<>(e, polls, elapsedMs(startNanos));
                }
                consecutiveFailures++;
                if (consecutiveFailures > config.maxTransientRetries()) {
                    log.warn("Polling {} gave up after {} consecutive transient failures", handle, consecutiveFailures);
                    return new PollResult.Failed<>(e, polls, elapsedMs(startNanos));
                }
                log.warn("Transient failure polling {} ({}/{}): {}",
                    handle, consecutiveFailures, config.maxTransientRetries(), e.getMessage());
            }

            if (finalPoll) {
                return timedOut(handle, lastSnapshot, polls, startNanos);
            }

            long remainingNanos = maxWaitNanos - (timer.nanoTime() - startNanos);
            if (remainingNanos <= 0) {
                return timedOut(handle, lastSnapshot, polls, startNanos);
            }

            long sleepNanos = intervalNanos;
            if (remainingNanos <= intervalNanos) {
                // 마감 시각에 맞춰 한 번 더 조회
                sleepNanos = remainingNanos;
                finalPoll = true;
            }

            try {
                timer.sleep(sleepNanos, signal);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Polling {} interrupted after {} polls", handle, polls);
                return new PollResult.Cancelled<>(lastSnapshot, polls, elapsedMs(startNanos));
            }
        }
    }

    private <S extends StatusSnapshot> S fetch(OperationHandle handle, Class<S> snapshotType) {
        StatusSnapshot snapshot = gateway.fetchStatus(handle);
        if (!snapshotType.isInstance(snapshot)) {
            throw new GatewayException(
                FailureType.PERMANENT,
                "Unexpected snapshot for " + handle + ": expected " + snapshotType.getSimpleName()
                    + " but was " + (snapshot == null ? "null" : snapshot.getClass().getSimpleName())
            );
        }
        return snapshotType.cast(snapshot);
    }

    private <S extends StatusSnapshot> PollResult<S> timedOut(OperationHandle handle, S lastSnapshot, int polls, long startNanos) {
        long elapsedMs = elapsedMs(startNanos);
        log.debug("Polling {} timed out after {} polls ({} ms)", handle, polls, elapsedMs);
        return new PollResult.TimedOut<>(lastSnapshot, polls, elapsedMs);
    }

    private long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(timer.nanoTime() - startNanos);
    }

    private void validateInput(
        OperationHandle handle,
        Class<?> snapshotType,
        Predicate<?> isTerminal,
        PollConfig config,
        CancellationSignal signal
    ) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (snapshotType == null) {
            throw new IllegalArgumentException("snapshotType cannot be null");
        }
        if (isTerminal == null) {
            throw new IllegalArgumentException("isTerminal cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }
    }
}

package com.ryuqq.remoteexec.core.poll;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 대기 취소 신호.
 *
 * <p>호출자가 다른 스레드에서 {@link #cancel()}을 호출하면, 이 신호를 받은 Poll Loop는
 * 다음 반복 시작 시점에 멈추고 대기 중인 sleep도 즉시 깨어납니다.
 * 진행 중인 상태 조회는 중단하지 않습니다.</p>
 *
 * <p>한 번 취소된 신호는 되돌릴 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    private CancellationSignal() {
    }

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * 취소되지 않는 신호.
     *
     * <p>호출마다 새 인스턴스를 반환하므로, 공유된 신호가 우연히 취소되는 일은 없습니다.</p>
     *
     * @return 새 신호
     */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    /**
     * 취소 요청. 여러 번 호출해도 안전합니다.
     */
    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * 주어진 시간 동안 대기하되, 취소되면 즉시 반환.
     *
     * @param nanos 대기 시간 (나노초)
     * @return 취소로 깨어난 경우 true, 시간이 다 된 경우 false
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public boolean await(long nanos) throws InterruptedException {
        if (nanos <= 0) {
            return isCancelled();
        }
        return latch.await(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public String toString() {
        return "CancellationSignal{cancelled=" + isCancelled() + "}";
    }
}

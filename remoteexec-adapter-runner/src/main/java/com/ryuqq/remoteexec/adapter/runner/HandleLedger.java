package com.ryuqq.remoteexec.adapter.runner;

import com.ryuqq.remoteexec.core.exception.ErrorKind;
import com.ryuqq.remoteexec.core.exception.RemoteExecutionException;
import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.statemachine.HandleState;
import com.ryuqq.remoteexec.core.statemachine.HandleTransition;

import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * 핸들별 로컬 상태 및 종료 결과 저장소.
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>종료 결과는 한 번만 기록됨 (이후 기록 시도는 기존 결과 반환)</li>
 *   <li>폐기는 한 번만 성공 (두 번째 이후 호출은 false)</li>
 *   <li>핸들 단위 연산은 원자적 ({@link ConcurrentMap#compute})</li>
 * </ul>
 *
 * <p><strong>보존 정책:</strong></p>
 * <ul>
 *   <li>폐기된 핸들은 결과를 버리고 DISPOSED 표식만 남김</li>
 *   <li>등록되지 않았거나 해제된 핸들에는 결과를 기록하지 않음</li>
 *   <li>ACTIVE를 벗어난 항목은 최대 {@code maxRetained}개까지 보존, 초과 시 오래된 것부터 제거</li>
 * </ul>
 *
 * <p>작업 종류마다 하나의 인스턴스를 사용합니다 (컨텍스트, 커맨드, Statement, Run).</p>
 *
 * @param <R> 종료 결과 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HandleLedger<R> {

    public static final int DEFAULT_MAX_RETAINED = 10_000;

    private final ConcurrentMap<OperationHandle, Entry<R>> entries = new ConcurrentHashMap<>();
    private final Queue<OperationHandle> retired = new ConcurrentLinkedQueue<>();
    private final AtomicInteger retiredCount = new AtomicInteger();
    private final int maxRetained;

    public HandleLedger() {
        this(DEFAULT_MAX_RETAINED);
    }

    /**
     * 생성자.
     *
     * @param maxRetained 종료 또는 폐기된 항목의 최대 보존 개수 (양수)
     * @throws IllegalArgumentException maxRetained가 양수가 아닌 경우
     */
    public HandleLedger(int maxRetained) {
        if (maxRetained <= 0) {
            throw new IllegalArgumentException("maxRetained must be positive (current: " + maxRetained + ")");
        }
        this.maxRetained = maxRetained;
    }

    /**
     * 핸들 등록 (ACTIVE). 이미 등록된 핸들은 그대로 둡니다.
     *
     * @param handle 핸들
     */
    public void register(OperationHandle handle) {
        requireHandle(handle);
        entries.putIfAbsent(handle, new Entry<>(HandleState.ACTIVE, null));
    }

    /**
     * 종료 결과 기록 (write-once).
     *
     * <p>이미 결과가 있으면 새 결과를 버리고 기존 결과를 반환합니다.
     * 폐기되었거나 등록되지 않은 핸들에는 기록하지 않고 받은 결과를 그대로 반환합니다.</p>
     *
     * @param handle 핸들
     * @param result 종료 결과
     * @return 실제로 기록되어 있는 결과
     */
    public R recordTerminal(OperationHandle handle, R result) {
        requireHandle(handle);
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        boolean[] retiredNow = new boolean[1];
        Entry<R> entry = entries.computeIfPresent(handle, (key, current) -> {
            if (current.result != null || current.state == HandleState.DISPOSED) {
                return current;
            }
            retiredNow[0] = true;
            return new Entry<>(HandleTransition.transition(current.state, HandleState.TERMINAL), result);
        });
        if (retiredNow[0]) {
            retire(handle);
        }
        return entry != null && entry.result != null ? entry.result : result;
    }

    /**
     * 기록된 종료 결과 조회.
     *
     * @param handle 핸들
     * @return 종료 결과, 없으면 null
     */
    public R terminalOrNull(OperationHandle handle) {
        requireHandle(handle);
        Entry<R> entry = entries.get(handle);
        return entry == null ? null : entry.result;
    }

    /**
     * 핸들 폐기. 기록된 결과는 버리고 DISPOSED 표식만 남깁니다.
     *
     * @param handle 핸들
     * @return 이번 호출로 폐기되었으면 true, 이미 폐기된 핸들이면 false
     */
    public boolean dispose(OperationHandle handle) {
        requireHandle(handle);
        boolean[] transitioned = new boolean[1];
        boolean[] wasActive = new boolean[1];
        entries.compute(handle, (key, current) -> {
            if (current != null && current.state == HandleState.DISPOSED) {
                return current;
            }
            transitioned[0] = true;
            wasActive[0] = current == null || current.state == HandleState.ACTIVE;
            HandleState from = current == null ? HandleState.ACTIVE : current.state;
            return new Entry<>(HandleTransition.transition(from, HandleState.DISPOSED), null);
        });
        if (wasActive[0]) {
            retire(handle);
        }
        return transitioned[0];
    }

    /**
     * 조건에 맞는 핸들의 항목을 모두 제거.
     *
     * @param filter 제거 대상 조건
     * @return 제거된 항목 수
     */
    public int release(Predicate<OperationHandle> filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        int released = 0;
        for (OperationHandle handle : entries.keySet()) {
            if (filter.test(handle) && entries.remove(handle) != null) {
                released++;
            }
        }
        return released;
    }

    /**
     * 아직 종료 결과가 없는 핸들의 항목 제거. 기록된 결과나 폐기 표식은 그대로 둡니다.
     *
     * @param handle 핸들
     */
    public void forgetActive(OperationHandle handle) {
        requireHandle(handle);
        entries.computeIfPresent(handle, (key, current) -> current.state == HandleState.ACTIVE ? null : current);
    }

    public boolean isDisposed(OperationHandle handle) {
        requireHandle(handle);
        Entry<R> entry = entries.get(handle);
        return entry != null && entry.state == HandleState.DISPOSED;
    }

    /**
     * 핸들 상태 조회.
     *
     * @param handle 핸들
     * @return 상태, 등록되지 않은 핸들이면 null
     */
    public HandleState stateOf(OperationHandle handle) {
        requireHandle(handle);
        Entry<R> entry = entries.get(handle);
        return entry == null ? null : entry.state;
    }

    public int size() {
        return entries.size();
    }

    /**
     * 폐기되지 않은 핸들인지 확인.
     *
     * @param handle 핸들
     * @throws RemoteExecutionException 폐기된 핸들이면 INVALID_HANDLE
     */
    public void requireUsable(OperationHandle handle) {
        if (isDisposed(handle)) {
            throw new RemoteExecutionException(ErrorKind.INVALID_HANDLE, handle, "Handle already disposed: " + handle);
        }
    }

    private void retire(OperationHandle handle) {
        retired.add(handle);
        if (retiredCount.incrementAndGet() <= maxRetained) {
            return;
        }
        while (retiredCount.get() > maxRetained) {
            OperationHandle oldest = retired.poll();
            if (oldest == null) {
                return;
            }
            retiredCount.decrementAndGet();
            entries.computeIfPresent(oldest, (key, current) -> current.state == HandleState.ACTIVE ? current : null);
        }
    }

    private void requireHandle(OperationHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
    }

    private static final class Entry<R> {

        private final HandleState state;
        private final R result;

        private Entry(HandleState state, R result) {
            this.state = state;
            this.result = result;
        }
    }
}

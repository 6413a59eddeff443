package com.ryuqq.remoteexec.core.statemachine;

/**
 * 핸들 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>ACTIVE → TERMINAL</li>
 *   <li>ACTIVE → DISPOSED</li>
 *   <li>TERMINAL → DISPOSED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HandleTransition {

    private HandleTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 허용 여부.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(HandleState from, HandleState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        switch (from) {
            case ACTIVE:
                return to == HandleState.TERMINAL || to == HandleState.DISPOSED;
            case TERMINAL:
                return to == HandleState.DISPOSED;
            default:
                return false;
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static HandleState transition(HandleState current, HandleState next) {
        if (!isAllowed(current, next)) {
            throw new IllegalStateException(
                String.format("Invalid handle transition: %s → %s", current, next)
            );
        }
        return next;
    }
}

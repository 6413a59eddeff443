package com.ryuqq.remoteexec.core.statemachine;

/**
 * 핸들의 로컬 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * ACTIVE
 *    │
 *    ├─► TERMINAL (종료 결과 기록)
 *    │      │
 *    │      └─► DISPOSED
 *    │
 *    └─► DISPOSED (종료 전 폐기)
 *
 * 금지된 전이:
 * - DISPOSED → ACTIVE ❌
 * - DISPOSED → TERMINAL ❌
 * - TERMINAL → ACTIVE ❌
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum HandleState {

    /**
     * 사용 가능, 아직 종료 결과 없음.
     */
    ACTIVE,

    /**
     * 종료 결과가 기록됨 (이후 변경 불가).
     */
    TERMINAL,

    /**
     * 폐기됨. 이후 사용은 INVALID_HANDLE.
     */
    DISPOSED;

    public boolean isUsable() {
        return this != DISPOSED;
    }
}

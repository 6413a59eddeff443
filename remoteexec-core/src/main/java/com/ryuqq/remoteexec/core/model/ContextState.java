package com.ryuqq.remoteexec.core.model;

/**
 * 실행 컨텍스트 상태.
 *
 * <pre>
 * PENDING ──(생성 완료)──► RUNNING ──(destroy)──► (제거)
 *    │
 *    └──(생성 실패)──► ERROR
 * </pre>
 *
 * <p>ERROR 상태의 컨텍스트는 커맨드 실행에 사용할 수 없으며,
 * 재시도 전에 destroy 되어야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ContextState {

    PENDING("Pending"),

    RUNNING("Running"),

    ERROR("Error");

    private final String wireName;

    ContextState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 플랫폼 상태 문자열로 조회.
     *
     * @param value 상태 문자열 (Pending, Running, Error)
     * @return ContextState
     * @throws IllegalArgumentException 알 수 없는 상태인 경우
     */
    public static ContextState fromWire(String value) {
        for (ContextState state : values()) {
            if (state.wireName.equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown context state: " + value);
    }
}

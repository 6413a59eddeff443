package com.ryuqq.remoteexec.core.model;

/**
 * 커맨드 실행 상태.
 *
 * <pre>
 * PENDING(Queued) ──► RUNNING ──┬─► FINISHED
 *                               ├─► ERROR
 *                               └─► CANCELLING ──► CANCELLED
 * </pre>
 *
 * <p>FINISHED, ERROR, CANCELLED는 종료 상태이며 이후 어떤 조회로도 바뀌지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CommandState {

    PENDING("Queued"),

    RUNNING("Running"),

    CANCELLING("Cancelling"),

    FINISHED("Finished"),

    CANCELLED("Cancelled"),

    ERROR("Error");

    private final String wireName;

    CommandState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return FINISHED, ERROR, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == FINISHED || this == ERROR || this == CANCELLED;
    }

    /**
     * 플랫폼 상태 문자열로 조회.
     *
     * @param value 상태 문자열 (Queued, Running, Cancelling, Finished, Cancelled, Error)
     * @return CommandState
     * @throws IllegalArgumentException 알 수 없는 상태인 경우
     */
    public static CommandState fromWire(String value) {
        for (CommandState state : values()) {
            if (state.wireName.equalsIgnoreCase(value)) {
                return state;
            }
        }
        // 일부 응답은 Pending을 사용
        if ("Pending".equalsIgnoreCase(value)) {
            return PENDING;
        }
        throw new IllegalArgumentException("Unknown command state: " + value);
    }
}

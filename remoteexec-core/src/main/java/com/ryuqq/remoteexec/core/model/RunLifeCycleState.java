package com.ryuqq.remoteexec.core.model;

import java.util.Locale;

/**
 * Job Run 생명주기 상태.
 *
 * <p>TERMINATED, SKIPPED, INTERNAL_ERROR가 종료 상태입니다.
 * 알 수 없는 값은 {@link #UNKNOWN}으로 매핑되어 폴링을 계속합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RunLifeCycleState {

    PENDING,

    QUEUED,

    BLOCKED,

    WAITING_FOR_RETRY,

    RUNNING,

    TERMINATING,

    TERMINATED,

    SKIPPED,

    INTERNAL_ERROR,

    UNKNOWN;

    public boolean isTerminal() {
        return this == TERMINATED || this == SKIPPED || this == INTERNAL_ERROR;
    }

    public static RunLifeCycleState fromWire(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}

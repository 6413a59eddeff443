package com.ryuqq.remoteexec.core.model;

import java.util.Locale;

/**
 * Job Run 결과 상태.
 *
 * <p>생명주기가 종료된 뒤에만 의미가 있으며, SUCCESS만 성공으로 간주합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RunResultState {

    SUCCESS,

    SUCCESS_WITH_FAILURES,

    FAILED,

    TIMEDOUT,

    CANCELED,

    MAXIMUM_CONCURRENT_RUNS_REACHED,

    EXCLUDED,

    UPSTREAM_FAILED,

    UPSTREAM_CANCELED,

    DISABLED,

    UNKNOWN;

    /**
     * 결과 상태 문자열로 조회.
     *
     * @param value 결과 상태 문자열 (null 가능)
     * @return RunResultState, value가 null이거나 비어 있으면 null
     */
    public static RunResultState fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}

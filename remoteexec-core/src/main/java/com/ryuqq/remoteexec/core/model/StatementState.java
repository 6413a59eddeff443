package com.ryuqq.remoteexec.core.model;

import java.util.Locale;

/**
 * SQL Statement 실행 상태.
 *
 * <p>SUCCEEDED, FAILED, CANCELED, CLOSED는 종료 상태입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StatementState {

    PENDING,

    RUNNING,

    SUCCEEDED,

    FAILED,

    CANCELED,

    CLOSED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    /**
     * 플랫폼 상태 문자열로 조회 (대소문자 무시).
     *
     * @param value 상태 문자열
     * @return StatementState
     * @throws IllegalArgumentException 알 수 없는 상태인 경우
     */
    public static StatementState fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("statement state cannot be null or blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package com.ryuqq.remoteexec.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 결과 값 (non-null)
 * @param <T> 결과 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public Ok {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    public static <T> Ok<T> of(T value) {
        return new Ok<>(value);
    }
}

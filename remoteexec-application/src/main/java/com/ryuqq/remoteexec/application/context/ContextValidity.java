package com.ryuqq.remoteexec.application.context;

/**
 * 컨텍스트 유효성 검사 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ContextValidity permits ContextValidity.Valid, ContextValidity.Invalid {

    static ContextValidity valid() {
        return Valid.INSTANCE;
    }

    static ContextValidity invalid(String reason) {
        return new Invalid(reason);
    }

    default boolean isValid() {
        return this instanceof Valid;
    }

    /**
     * 유효함 (RUNNING).
     */
    final class Valid implements ContextValidity {

        private static final Valid INSTANCE = new Valid();

        private Valid() {
        }

        @Override
        public String toString() {
            return "Valid";
        }
    }

    /**
     * 유효하지 않음.
     *
     * @param reason 사유
     */
    record Invalid(String reason) implements ContextValidity {

        public Invalid {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }
    }
}

package com.ryuqq.remoteexec.core.spi;

/**
 * Gateway 호출 실패.
 *
 * <p>모든 Gateway 실패는 {@link FailureType}으로 분류되어 던져집니다.
 * 재시도 정책은 Gateway가 아니라 Poll Loop에 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class GatewayException extends RuntimeException {

    private final FailureType failureType;
    private final int statusCode;

    /**
     * 생성자.
     *
     * @param failureType 실패 분류
     * @param message 오류 메시지
     * @throws IllegalArgumentException failureType이 null인 경우
     */
    public GatewayException(FailureType failureType, String message) {
        this(failureType, message, 0, null);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param failureType 실패 분류
     * @param message 오류 메시지
     * @param cause 원인
     */
    public GatewayException(FailureType failureType, String message, Throwable cause) {
        this(failureType, message, 0, cause);
    }

    /**
     * 생성자 (HTTP 상태 코드 포함).
     *
     * @param failureType 실패 분류
     * @param message 오류 메시지
     * @param statusCode 응답 상태 코드 (없으면 0)
     * @param cause 원인 (null 가능)
     */
    public GatewayException(FailureType failureType, String message, int statusCode, Throwable cause) {
        super(message, cause);
        if (failureType == null) {
            throw new IllegalArgumentException("failureType cannot be null");
        }
        this.failureType = failureType;
        this.statusCode = statusCode;
    }

    public static GatewayException transientFailure(String message) {
        return new GatewayException(FailureType.TRANSIENT, message);
    }

    public static GatewayException permanentFailure(String message) {
        return new GatewayException(FailureType.PERMANENT, message);
    }

    public static GatewayException notFound(String message) {
        return new GatewayException(FailureType.NOT_FOUND, message);
    }

    public FailureType getFailureType() {
        return failureType;
    }

    /**
     * 응답 상태 코드 조회.
     *
     * @return 상태 코드, 응답을 받지 못한 경우 0
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return failureType == FailureType.TRANSIENT;
    }

    public boolean isNotFound() {
        return failureType == FailureType.NOT_FOUND;
    }

    @Override
    public String toString() {
        if (statusCode > 0) {
            return "GatewayException{" + failureType + " [" + statusCode + "] " + getMessage() + "}";
        }
        return "GatewayException{" + failureType + " " + getMessage() + "}";
    }
}

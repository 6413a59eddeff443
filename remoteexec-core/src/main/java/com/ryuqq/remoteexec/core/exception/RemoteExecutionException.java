package com.ryuqq.remoteexec.core.exception;

import com.ryuqq.remoteexec.core.model.OperationHandle;

/**
 * 엔진 공개 연산의 실패.
 *
 * <p>모든 공개 연산은 구체적인 결과를 반환하거나, 하나의 {@link ErrorKind}를 가진
 * 이 예외를 던집니다. 일반적인 실패로 뭉뚱그리지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RemoteExecutionException extends RuntimeException {

    private final ErrorKind kind;
    private final OperationHandle handle;

    public RemoteExecutionException(ErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public RemoteExecutionException(ErrorKind kind, OperationHandle handle, String message) {
        this(kind, handle, message, null);
    }

    /**
     * 생성자.
     *
     * @param kind 오류 분류
     * @param handle 관련 핸들 (null 가능)
     * @param message 오류 메시지
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public RemoteExecutionException(ErrorKind kind, OperationHandle handle, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
        this.handle = handle;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * 관련 핸들 조회.
     *
     * @return 핸들 (null 가능)
     */
    public OperationHandle getHandle() {
        return handle;
    }

    @Override
    public String getMessage() {
        return "[" + kind + "] " + super.getMessage();
    }
}

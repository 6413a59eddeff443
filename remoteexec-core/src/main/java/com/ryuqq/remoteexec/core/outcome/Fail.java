package com.ryuqq.remoteexec.core.outcome;

/**
 * 원격 실패.
 *
 * <p>원격 작업이 종료되었으나 성공하지 못한 경우를 나타냅니다.
 * 전송 계층 오류가 아니라 플랫폼이 보고한 결과입니다.</p>
 *
 * <p><strong>오류 코드 예시:</strong></p>
 * <ul>
 *   <li>COMMAND_ERROR: 커맨드는 실행되었으나 스크립트가 예외를 던짐</li>
 *   <li>COMMAND_FAILED: 커맨드 자체가 Error 상태로 종료됨</li>
 *   <li>CONTEXT_LOST: 소속 컨텍스트가 사라짐</li>
 *   <li>FAILED, TIMEDOUT, INTERNAL_ERROR: Statement / Run 결과 상태</li>
 * </ul>
 *
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 * @param <T> 성공 시 결과 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail<T>(
    String errorCode,
    String message,
    String cause
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    public static <T> Fail<T> of(String errorCode, String message, String cause) {
        return new Fail<>(errorCode, message, cause);
    }

    public static <T> Fail<T> of(String errorCode, String message) {
        return new Fail<>(errorCode, message, null);
    }
}

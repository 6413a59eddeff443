package com.ryuqq.remoteexec.core.model;

/**
 * 완료된 커맨드의 결과 페이로드.
 *
 * <p>플랫폼은 "커맨드가 실행되었다"와 "커맨드 결과가 오류다"를 별도 신호로 보고합니다.
 * FINISHED 상태라도 resultType이 {@code error}이면 스크립트 내부에서 예외가 발생한 것입니다.</p>
 *
 * @param resultType 결과 종류 (text, table, image, images, error)
 * @param data 결과 데이터 (직렬화된 문자열, null 가능)
 * @param summary 오류 요약 (null 가능)
 * @param cause 오류 원인 (스택 트레이스 등, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CommandOutput(
    String resultType,
    String data,
    String summary,
    String cause
) {

    public static final String RESULT_TYPE_ERROR = "error";
    public static final String RESULT_TYPE_TEXT = "text";

    public CommandOutput {
        if (resultType == null || resultType.isBlank()) {
            throw new IllegalArgumentException("resultType cannot be null or blank");
        }
    }

    /**
     * 텍스트 결과 생성.
     *
     * @param data 결과 데이터
     * @return CommandOutput (resultType=text)
     */
    public static CommandOutput text(String data) {
        return new CommandOutput(RESULT_TYPE_TEXT, data, null, null);
    }

    /**
     * 언어 수준 오류 결과 생성.
     *
     * @param summary 오류 요약
     * @param cause 오류 원인
     * @return CommandOutput (resultType=error)
     */
    public static CommandOutput error(String summary, String cause) {
        return new CommandOutput(RESULT_TYPE_ERROR, null, summary, cause);
    }

    /**
     * 결과가 언어 수준 오류인지 확인.
     *
     * @return resultType이 error이면 true
     */
    public boolean isError() {
        return RESULT_TYPE_ERROR.equalsIgnoreCase(resultType);
    }
}

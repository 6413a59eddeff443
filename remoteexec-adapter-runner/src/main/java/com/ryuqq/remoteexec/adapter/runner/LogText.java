package com.ryuqq.remoteexec.adapter.runner;

/**
 * 로그 출력용 문자열 축약.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class LogText {

    static final int MAX_LENGTH = 100;

    private LogText() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 코드 / SQL을 최대 100자로 축약하고 줄바꿈을 공백으로 바꿉니다.
     */
    static String truncate(String text) {
        if (text == null) {
            return "null";
        }
        String singleLine = text.replace('\n', ' ').replace('\r', ' ');
        if (singleLine.length() <= MAX_LENGTH) {
            return singleLine;
        }
        return singleLine.substring(0, MAX_LENGTH) + "...";
    }
}

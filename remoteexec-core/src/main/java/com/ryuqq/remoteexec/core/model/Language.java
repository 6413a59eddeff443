package com.ryuqq.remoteexec.core.model;

/**
 * 실행 컨텍스트와 커맨드의 언어.
 *
 * <p>컨텍스트 생성 시 고정되며 이후 변경할 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Language {

    PYTHON("python"),

    SCALA("scala"),

    SQL("sql"),

    R("r");

    private final String wireName;

    Language(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 플랫폼 API에서 사용하는 이름.
     *
     * @return 소문자 언어 이름 (예: python)
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 언어 이름으로 조회 (대소문자 무시).
     *
     * @param value 언어 이름 (python, scala, sql, r)
     * @return Language
     * @throws IllegalArgumentException 지원하지 않는 언어인 경우
     */
    public static Language from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("language cannot be null or blank");
        }
        for (Language language : values()) {
            if (language.wireName.equalsIgnoreCase(value.trim())) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unsupported language: " + value + " (expected python, scala, sql or r)");
    }
}

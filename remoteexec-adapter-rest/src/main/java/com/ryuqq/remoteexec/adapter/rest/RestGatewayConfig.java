package com.ryuqq.remoteexec.adapter.rest;

import java.util.Map;

/**
 * REST Gateway 설정.
 *
 * <p>host는 {@code http://} 또는 {@code https://}로 시작해야 하며 끝의 슬래시는 제거됩니다.
 * token은 로그나 {@link #toString()}에 노출되지 않습니다.</p>
 *
 * @param host 워크스페이스 URL (예: https://example.cloud.databricks.com)
 * @param token Bearer 토큰 (최소 10자)
 * @param requestTimeoutMs 요청 하나의 타임아웃 (밀리초)
 * @param connectTimeoutMs 연결 타임아웃 (밀리초)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RestGatewayConfig(
    String host,
    String token,
    long requestTimeoutMs,
    long connectTimeoutMs
) {

    public static final String HOST_ENV = "DATABRICKS_HOST";
    public static final String TOKEN_ENV = "DATABRICKS_TOKEN";

    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000;
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000;

    private static final int MIN_TOKEN_LENGTH = 10;

    public RestGatewayConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be null or blank");
        }
        host = host.trim();
        if (!host.startsWith("http://") && !host.startsWith("https://")) {
            throw new IllegalArgumentException("host must start with http:// or https:// (current: " + host + ")");
        }
        while (host.endsWith("/")) {
            host = host.substring(0, host.length() - 1);
        }
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token cannot be null or blank");
        }
        if (token.length() < MIN_TOKEN_LENGTH) {
            throw new IllegalArgumentException("token must be at least " + MIN_TOKEN_LENGTH + " characters");
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException("requestTimeoutMs must be positive (current: " + requestTimeoutMs + ")");
        }
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("connectTimeoutMs must be positive (current: " + connectTimeoutMs + ")");
        }
    }

    /**
     * 기본 타임아웃으로 설정 생성.
     *
     * @param host 워크스페이스 URL
     * @param token Bearer 토큰
     * @return RestGatewayConfig
     */
    public static RestGatewayConfig of(String host, String token) {
        return new RestGatewayConfig(host, token, DEFAULT_REQUEST_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT_MS);
    }

    /**
     * 환경 변수에서 설정 생성.
     *
     * <p>{@code DATABRICKS_HOST}, {@code DATABRICKS_TOKEN}을 읽습니다.</p>
     *
     * @param environment 환경 변수 (보통 {@code System.getenv()})
     * @return RestGatewayConfig
     * @throws IllegalArgumentException 필수 값이 없거나 형식이 잘못된 경우
     */
    public static RestGatewayConfig fromEnvironment(Map<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        String host = environment.get(HOST_ENV);
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException(HOST_ENV + " is not set");
        }
        String token = environment.get(TOKEN_ENV);
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException(TOKEN_ENV + " is not set");
        }
        return of(host, token);
    }

    public RestGatewayConfig withRequestTimeoutMs(long requestTimeoutMs) {
        return new RestGatewayConfig(host, token, requestTimeoutMs, connectTimeoutMs);
    }

    public RestGatewayConfig withConnectTimeoutMs(long connectTimeoutMs) {
        return new RestGatewayConfig(host, token, requestTimeoutMs, connectTimeoutMs);
    }

    @Override
    public String toString() {
        return "RestGatewayConfig{host=" + host + ", token=****, requestTimeoutMs=" + requestTimeoutMs
            + ", connectTimeoutMs=" + connectTimeoutMs + "}";
    }
}

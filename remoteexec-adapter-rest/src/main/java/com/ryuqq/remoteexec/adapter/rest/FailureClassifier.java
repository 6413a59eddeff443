package com.ryuqq.remoteexec.adapter.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.remoteexec.core.spi.FailureType;
import com.ryuqq.remoteexec.core.spi.GatewayException;

import java.io.IOException;

/**
 * 실패 응답을 {@link GatewayException}으로 분류.
 *
 * <ul>
 *   <li>404, {@code RESOURCE_DOES_NOT_EXIST}, {@code ContextNotFound} → NOT_FOUND</li>
 *   <li>408, 429, 5xx, I/O 오류 → TRANSIENT</li>
 *   <li>그 밖의 4xx, 해석할 수 없는 응답 → PERMANENT</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class FailureClassifier {

    static final String RESOURCE_DOES_NOT_EXIST = "RESOURCE_DOES_NOT_EXIST";
    static final String CONTEXT_NOT_FOUND = "ContextNotFound";

    private static final int MAX_BODY_IN_MESSAGE = 500;

    private final ObjectMapper mapper;

    FailureClassifier(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * 2xx가 아닌 응답 분류.
     *
     * @param operation 요청 설명 (예: "GET /api/1.2/contexts/status")
     * @param statusCode HTTP 상태 코드
     * @param body 응답 본문 (null 가능)
     * @return 분류된 예외
     */
    GatewayException fromResponse(String operation, int statusCode, String body) {
        String errorCode = errorCode(body);
        String message = operation + " failed: HTTP " + statusCode + " " + abbreviate(body);
        return new GatewayException(classify(statusCode, errorCode, body), message, statusCode, null);
    }

    FailureType classify(int statusCode, String errorCode, String body) {
        if (statusCode == 404 || isNotFoundCode(errorCode) || mentionsNotFound(body)) {
            return FailureType.NOT_FOUND;
        }
        if (statusCode == 408 || statusCode == 429 || statusCode >= 500) {
            return FailureType.TRANSIENT;
        }
        return FailureType.PERMANENT;
    }

    GatewayException fromIoFailure(String operation, IOException e) {
        return new GatewayException(FailureType.TRANSIENT, operation + " failed: " + e, e);
    }

    GatewayException fromInterrupt(String operation, InterruptedException e) {
        return new GatewayException(FailureType.TRANSIENT, operation + " interrupted", e);
    }

    GatewayException fromUndecodable(String operation, String body, Exception e) {
        return new GatewayException(FailureType.PERMANENT,
            operation + " returned an undecodable body: " + abbreviate(body), e);
    }

    private String errorCode(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode root = mapper.readTree(body);
            if (root.hasNonNull("error_code")) {
                return root.get("error_code").asText();
            }
            return null;
        } catch (IOException e) {
            return null;
        }
    }

    private boolean isNotFoundCode(String errorCode) {
        return RESOURCE_DOES_NOT_EXIST.equals(errorCode) || CONTEXT_NOT_FOUND.equals(errorCode);
    }

    private boolean mentionsNotFound(String body) {
        return body != null && (body.contains(CONTEXT_NOT_FOUND) || body.contains(RESOURCE_DOES_NOT_EXIST));
    }

    private String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}

package com.ryuqq.remoteexec.core.request;

import com.ryuqq.remoteexec.core.model.Language;
import com.ryuqq.remoteexec.core.model.OperationKind;

/**
 * 실행 컨텍스트 생성 요청.
 *
 * @param clusterId 대상 클러스터 ID
 * @param language 컨텍스트 언어
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ContextRequest(String clusterId, Language language) implements SubmitRequest {

    public ContextRequest {
        if (clusterId == null || clusterId.isBlank()) {
            throw new IllegalArgumentException("clusterId cannot be null or blank");
        }
        if (language == null) {
            throw new IllegalArgumentException("language cannot be null");
        }
    }

    @Override
    public OperationKind kind() {
        return OperationKind.CONTEXT;
    }
}

package com.ryuqq.remoteexec.core.request;

import com.ryuqq.remoteexec.core.model.ExecutionContext;
import com.ryuqq.remoteexec.core.model.Language;
import com.ryuqq.remoteexec.core.model.OperationKind;

/**
 * 실행 컨텍스트 안에서 코드를 실행하는 요청.
 *
 * @param clusterId 클러스터 ID
 * @param contextId 컨텍스트 ID
 * @param code 실행할 코드
 * @param language 코드 언어
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CommandRequest(
    String clusterId,
    String contextId,
    String code,
    Language language
) implements SubmitRequest {

    public CommandRequest {
        if (clusterId == null || clusterId.isBlank()) {
            throw new IllegalArgumentException("clusterId cannot be null or blank");
        }
        if (contextId == null || contextId.isBlank()) {
            throw new IllegalArgumentException("contextId cannot be null or blank");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (language == null) {
            throw new IllegalArgumentException("language cannot be null");
        }
    }

    public static CommandRequest of(ExecutionContext context, String code, Language language) {
        return new CommandRequest(context.clusterId(), context.contextId(), code, language);
    }

    @Override
    public OperationKind kind() {
        return OperationKind.COMMAND;
    }
}

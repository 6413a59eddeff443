package com.ryuqq.remoteexec.core.model;

/**
 * 실행 컨텍스트 (원격 세션).
 *
 * <p>여러 커맨드 사이에서 변수 바인딩을 유지하는 원격 세션입니다.
 * 컨텍스트의 생성과 파괴는 ExecutionContextManager만 수행하며,
 * CommandRunner는 참조(contextId + clusterId)로 빌려 쓰기만 합니다.</p>
 *
 * @param contextId 컨텍스트 ID
 * @param clusterId 클러스터 ID
 * @param language 생성 시 고정된 언어
 * @param state 컨텍스트 상태
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExecutionContext(
    String contextId,
    String clusterId,
    Language language,
    ContextState state
) {

    public ExecutionContext {
        if (contextId == null || contextId.isBlank()) {
            throw new IllegalArgumentException("contextId cannot be null or blank");
        }
        if (clusterId == null || clusterId.isBlank()) {
            throw new IllegalArgumentException("clusterId cannot be null or blank");
        }
        if (language == null) {
            throw new IllegalArgumentException("language cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    /**
     * 이 컨텍스트의 핸들.
     *
     * @return CONTEXT 핸들
     */
    public OperationHandle handle() {
        return OperationHandle.context(clusterId, contextId);
    }

    /**
     * 커맨드를 받을 수 있는 상태인지 확인.
     *
     * @return RUNNING이면 true
     */
    public boolean isRunning() {
        return state == ContextState.RUNNING;
    }
}

package com.ryuqq.remoteexec.core.snapshot;

import com.ryuqq.remoteexec.core.model.ContextState;

/**
 * 실행 컨텍스트 상태 스냅샷.
 *
 * @param contextId 컨텍스트 ID
 * @param state 컨텍스트 상태
 * @param errorMessage ERROR 상태일 때의 메시지 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ContextSnapshot(String contextId, ContextState state, String errorMessage) implements StatusSnapshot {

    public ContextSnapshot {
        if (contextId == null || contextId.isBlank()) {
            throw new IllegalArgumentException("contextId cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    public static ContextSnapshot of(String contextId, ContextState state) {
        return new ContextSnapshot(contextId, state, null);
    }

    /**
     * 생성 대기가 끝난 상태인지 확인.
     *
     * <p>컨텍스트는 PENDING을 벗어나면 (RUNNING 또는 ERROR) 더 이상 기다릴 필요가 없습니다.</p>
     *
     * @return PENDING이 아니면 true
     */
    @Override
    public boolean isTerminal() {
        return state != ContextState.PENDING;
    }
}

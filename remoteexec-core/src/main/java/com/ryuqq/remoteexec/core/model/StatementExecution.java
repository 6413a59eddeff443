package com.ryuqq.remoteexec.core.model;

import com.ryuqq.remoteexec.core.outcome.Ok;
import com.ryuqq.remoteexec.core.outcome.Outcome;

/**
 * SQL Statement 실행 정보.
 *
 * <p>성공 시 result는 첫 페이지만 담고 있으며, 나머지 페이지는
 * nextPageToken으로 별도 조회합니다 (자동으로 따라가지 않음).</p>
 *
 * @param handle STATEMENT 핸들
 * @param state Statement 상태
 * @param result 최종 결과 (종료 상태가 아니면 null)
 * @param nextPageToken 다음 페이지 토큰 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StatementExecution(
    OperationHandle handle,
    StatementState state,
    Outcome<ResultPage> result,
    String nextPageToken
) {

    public StatementExecution {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (handle.getKind() != OperationKind.STATEMENT) {
            throw new IllegalArgumentException("handle must be a statement handle (kind: " + handle.getKind() + ")");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (result != null && !state.isTerminal()) {
            throw new IllegalArgumentException("result is only allowed in terminal state (state: " + state + ")");
        }
        if (nextPageToken != null && !(result instanceof Ok)) {
            throw new IllegalArgumentException("nextPageToken is only allowed with a successful result");
        }
    }

    public static StatementExecution pending(OperationHandle handle) {
        return new StatementExecution(handle, StatementState.PENDING, null, null);
    }

    public String statementId() {
        return handle.getOperationId();
    }

    public boolean hasMorePages() {
        return nextPageToken != null;
    }
}

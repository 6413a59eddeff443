package com.ryuqq.remoteexec.core.snapshot;

import com.ryuqq.remoteexec.core.model.ResultPage;
import com.ryuqq.remoteexec.core.model.StatementState;

/**
 * SQL Statement 상태 스냅샷.
 *
 * @param statementId Statement ID
 * @param state Statement 상태
 * @param firstPage 첫 결과 페이지 (SUCCEEDED일 때만, null 가능)
 * @param errorCode 실패 코드 (null 가능)
 * @param errorMessage 실패 메시지 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StatementSnapshot(
    String statementId,
    StatementState state,
    ResultPage firstPage,
    String errorCode,
    String errorMessage
) implements StatusSnapshot {

    public StatementSnapshot {
        if (statementId == null || statementId.isBlank()) {
            throw new IllegalArgumentException("statementId cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    public static StatementSnapshot of(String statementId, StatementState state) {
        return new StatementSnapshot(statementId, state, null, null, null);
    }

    public static StatementSnapshot succeeded(String statementId, ResultPage firstPage) {
        return new StatementSnapshot(statementId, StatementState.SUCCEEDED, firstPage, null, null);
    }

    public static StatementSnapshot failed(String statementId, String errorCode, String errorMessage) {
        return new StatementSnapshot(statementId, StatementState.FAILED, null, errorCode, errorMessage);
    }

    @Override
    public boolean isTerminal() {
        return state.isTerminal();
    }
}

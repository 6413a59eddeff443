package com.ryuqq.remoteexec.core.model;

import com.ryuqq.remoteexec.core.outcome.Outcome;

/**
 * 커맨드 실행 정보.
 *
 * <p>result는 종료 상태에서만 존재합니다 (그 외에는 null).</p>
 *
 * @param handle COMMAND 핸들
 * @param state 커맨드 상태
 * @param result 최종 결과 (Ok, Fail, Cancelled 또는 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CommandExecution(
    OperationHandle handle,
    CommandState state,
    Outcome<CommandOutput> result
) {

    public CommandExecution {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (handle.getKind() != OperationKind.COMMAND) {
            throw new IllegalArgumentException("handle must be a command handle (kind: " + handle.getKind() + ")");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (result != null && !state.isTerminal()) {
            throw new IllegalArgumentException("result is only allowed in terminal state (state: " + state + ")");
        }
        if (result == null && state.isTerminal()) {
            throw new IllegalArgumentException("result cannot be null in terminal state (state: " + state + ")");
        }
    }

    /**
     * 제출 직후의 PENDING 실행 생성.
     *
     * @param handle COMMAND 핸들
     * @return PENDING 상태의 CommandExecution
     */
    public static CommandExecution pending(OperationHandle handle) {
        return new CommandExecution(handle, CommandState.PENDING, null);
    }

    public String contextId() {
        return handle.getParentId();
    }

    public String commandId() {
        return handle.getOperationId();
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}

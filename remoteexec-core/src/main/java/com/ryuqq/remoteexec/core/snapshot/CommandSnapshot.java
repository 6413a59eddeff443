package com.ryuqq.remoteexec.core.snapshot;

import com.ryuqq.remoteexec.core.model.CommandOutput;
import com.ryuqq.remoteexec.core.model.CommandState;

/**
 * 커맨드 상태 스냅샷.
 *
 * @param commandId 커맨드 ID
 * @param state 커맨드 상태
 * @param output 결과 페이로드 (종료 상태에서만 존재할 수 있음, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CommandSnapshot(String commandId, CommandState state, CommandOutput output) implements StatusSnapshot {

    public CommandSnapshot {
        if (commandId == null || commandId.isBlank()) {
            throw new IllegalArgumentException("commandId cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    public static CommandSnapshot of(String commandId, CommandState state) {
        return new CommandSnapshot(commandId, state, null);
    }

    @Override
    public boolean isTerminal() {
        return state.isTerminal();
    }
}

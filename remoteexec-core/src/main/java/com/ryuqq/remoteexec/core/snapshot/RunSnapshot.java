package com.ryuqq.remoteexec.core.snapshot;

import com.ryuqq.remoteexec.core.model.JobRun;

/**
 * Job Run 상태 스냅샷.
 *
 * @param run 관찰된 Run
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunSnapshot(JobRun run) implements StatusSnapshot {

    public RunSnapshot {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
    }

    @Override
    public boolean isTerminal() {
        return run.isTerminal();
    }
}

package com.ryuqq.remoteexec.adapter.runner;

import com.ryuqq.remoteexec.application.poll.PollLoop;
import com.ryuqq.remoteexec.application.run.RunWaiter;
import com.ryuqq.remoteexec.core.exception.ErrorKind;
import com.ryuqq.remoteexec.core.model.JobRun;
import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.outcome.Fail;
import com.ryuqq.remoteexec.core.outcome.Ok;
import com.ryuqq.remoteexec.core.outcome.Outcome;
import com.ryuqq.remoteexec.core.poll.CancellationSignal;
import com.ryuqq.remoteexec.core.poll.PollConfig;
import com.ryuqq.remoteexec.core.poll.PollResult;
import com.ryuqq.remoteexec.core.snapshot.RunSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 폴링 기반 {@link RunWaiter} 구현체.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PollingRunWaiter implements RunWaiter {

    private static final Logger log = LoggerFactory.getLogger(PollingRunWaiter.class);

    private final PollLoop pollLoop;
    private final HandleLedger<Outcome<JobRun>> ledger;

    public PollingRunWaiter(PollLoop pollLoop, HandleLedger<Outcome<JobRun>> ledger) {
        if (pollLoop == null) {
            throw new IllegalArgumentException("pollLoop cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        this.pollLoop = pollLoop;
        this.ledger = ledger;
    }

    @Override
    public Outcome<JobRun> waitForCompletion(String runId, PollConfig config, CancellationSignal signal) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }

        OperationHandle handle = OperationHandle.run(runId);
        Outcome<JobRun> recorded = ledger.terminalOrNull(handle);
        if (recorded != null) {
            return recorded;
        }
        ledger.register(handle);

        PollResult<RunSnapshot> result = pollLoop.await(
            handle, RunSnapshot.class, RunSnapshot::isTerminal, config, signal);

        if (result instanceof PollResult.Terminal<RunSnapshot> terminal) {
            Outcome<JobRun> outcome = toOutcome(terminal.snapshot().run());
            Outcome<JobRun> stored = ledger.recordTerminal(handle, outcome);
            if (stored == outcome) {
                JobRun run = terminal.snapshot().run();
                log.info("Run {} finished: {} / {} after {} polls",
                    runId, run.lifeCycleState(), run.resultState(), result.polls());
            }
            return stored;
        }
        ledger.forgetActive(handle);
        throw PollFailures.toException(result, handle, config, ErrorKind.NOT_FOUND);
    }

    private Outcome<JobRun> toOutcome(JobRun run) {
        if (run.isSuccess()) {
            return Ok.of(run);
        }
        String code = run.resultState() != null ? run.resultState().name() : run.lifeCycleState().name();
        String message = run.stateMessage() == null || run.stateMessage().isBlank()
            ? "Run " + run.runId() + " ended in " + code
            : run.stateMessage();
        return Fail.of(code, message);
    }
}

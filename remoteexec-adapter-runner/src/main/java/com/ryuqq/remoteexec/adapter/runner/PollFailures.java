package com.ryuqq.remoteexec.adapter.runner;

import com.ryuqq.remoteexec.core.exception.ErrorKind;
import com.ryuqq.remoteexec.core.exception.RemoteExecutionException;
import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.poll.PollConfig;
import com.ryuqq.remoteexec.core.poll.PollResult;
import com.ryuqq.remoteexec.core.spi.GatewayException;

/**
 * 비종료 {@link PollResult}를 {@link RemoteExecutionException}으로 변환.
 *
 * <p><strong>매핑:</strong></p>
 * <ul>
 *   <li>TimedOut → TIMED_OUT</li>
 *   <li>Cancelled → CANCELLED</li>
 *   <li>Aborted (NOT_FOUND) → 호출자가 지정한 ErrorKind</li>
 *   <li>Aborted → POLL_ABORTED</li>
 *   <li>Failed → POLL_FAILED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class PollFailures {

    private PollFailures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static RemoteExecutionException toException(
        PollResult<?> result,
        OperationHandle handle,
        PollConfig config,
        ErrorKind notFoundKind
    ) {
        if (result instanceof PollResult.TimedOut<?> timedOut) {
            return new RemoteExecutionException(
                ErrorKind.TIMED_OUT, handle,
                String.format("%s did not reach a terminal state within %d ms (polls: %d, last: %s)",
                    handle, config.maxWaitMs(), timedOut.polls(), timedOut.lastSnapshot())
            );
        }
        if (result instanceof PollResult.Cancelled<?> cancelled) {
            return new RemoteExecutionException(
                ErrorKind.CANCELLED, handle,
                "Waiting for " + handle + " was cancelled after " + cancelled.polls() + " polls"
            );
        }
        if (result instanceof PollResult.Aborted<?> aborted) {
            GatewayException cause = aborted.cause();
            ErrorKind kind = aborted.isNotFound() ? notFoundKind : ErrorKind.POLL_ABORTED;
            return new RemoteExecutionException(kind, handle,
                "Polling " + handle + " aborted: " + cause.getMessage(), cause);
        }
        if (result instanceof PollResult.Failed<?> failed) {
            return new RemoteExecutionException(
                ErrorKind.POLL_FAILED, handle,
                String.format("Polling %s failed after %d polls: %s",
                    handle, failed.polls(), failed.lastFailure().getMessage()),
                failed.lastFailure()
            );
        }
        throw new IllegalArgumentException("Not a failure result: " + result);
    }
}

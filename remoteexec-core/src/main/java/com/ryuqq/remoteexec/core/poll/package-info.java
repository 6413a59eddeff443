/**
 * Polling primitives package.
 *
 * <p>Configuration ({@link com.ryuqq.remoteexec.core.poll.PollConfig}), cooperative cancellation
 * ({@link com.ryuqq.remoteexec.core.poll.CancellationSignal}) and the closed set of loop results
 * ({@link com.ryuqq.remoteexec.core.poll.PollResult}) shared by every waiting operation.</p>
 *
 * <h2>Timing Rules</h2>
 * <ul>
 *   <li>Elapsed time is measured from loop entry</li>
 *   <li>No sleep ever extends past the deadline</li>
 *   <li>A terminal status returns with zero extra delay</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.remoteexec.core.poll;

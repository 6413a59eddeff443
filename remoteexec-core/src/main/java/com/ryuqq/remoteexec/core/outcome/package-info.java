/**
 * Terminal outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for the terminal result of a
 * remote unit of work. Raw platform responses are decoded into these types once, so callers
 * never inspect untyped structures.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.remoteexec.core.outcome.Ok} - Completed successfully, carries the value</li>
 *   <li>{@link com.ryuqq.remoteexec.core.outcome.Fail} - Completed unsuccessfully on the platform</li>
 *   <li>{@link com.ryuqq.remoteexec.core.outcome.Cancelled} - Cancelled on the platform</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.remoteexec.core.outcome;

/**
 * Handle lifecycle package.
 *
 * <p>Local bookkeeping states of an {@link com.ryuqq.remoteexec.core.model.OperationHandle}.
 * Transitions are forward only; a disposed handle never becomes usable again.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.remoteexec.core.statemachine;

/**
 * Domain model package.
 *
 * <p>Immutable value types describing the remote units of work the engine orchestrates.</p>
 *
 * <h2>Identifiers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.remoteexec.core.model.OperationHandle} - Platform-issued operation identifier</li>
 *   <li>{@link com.ryuqq.remoteexec.core.model.OperationKind} - CONTEXT, COMMAND, STATEMENT, RUN</li>
 * </ul>
 *
 * <h2>Executions</h2>
 * <ul>
 *   <li>{@link com.ryuqq.remoteexec.core.model.ExecutionContext} - Stateful remote session on a cluster</li>
 *   <li>{@link com.ryuqq.remoteexec.core.model.CommandExecution} - Code fragment run inside a context</li>
 *   <li>{@link com.ryuqq.remoteexec.core.model.StatementExecution} - SQL statement run on a warehouse</li>
 *   <li>{@link com.ryuqq.remoteexec.core.model.JobRun} - Externally created job run, observed only</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.remoteexec.core.model;

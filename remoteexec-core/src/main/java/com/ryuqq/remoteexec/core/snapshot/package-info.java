/**
 * Status snapshot package.
 *
 * <p>Typed point-in-time views of a remote operation, produced by the gateway from raw
 * platform responses. One record per {@link com.ryuqq.remoteexec.core.model.OperationKind}.</p>
 *
 * <pre>
 * StatusSnapshot (sealed)
 *   ├─ ContextSnapshot   - terminal once it leaves PENDING
 *   ├─ CommandSnapshot   - terminal in FINISHED, ERROR, CANCELLED
 *   ├─ StatementSnapshot - terminal in SUCCEEDED, FAILED, CANCELED, CLOSED
 *   └─ RunSnapshot       - terminal in TERMINATED, SKIPPED, INTERNAL_ERROR
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.remoteexec.core.snapshot;

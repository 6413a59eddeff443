/**
 * Error taxonomy package.
 *
 * <p>{@link com.ryuqq.remoteexec.core.exception.RemoteExecutionException} carries exactly one
 * {@link com.ryuqq.remoteexec.core.exception.ErrorKind} so that callers can branch on the cause
 * (retry, give up, recreate the context) instead of parsing messages.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.remoteexec.core.exception;

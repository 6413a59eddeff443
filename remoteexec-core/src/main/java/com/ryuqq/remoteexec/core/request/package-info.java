/**
 * Submit request package.
 *
 * <p>Typed payloads accepted by
 * {@link com.ryuqq.remoteexec.core.spi.RemoteOperationGateway#submit(com.ryuqq.remoteexec.core.request.SubmitRequest)}.
 * Each request knows the {@link com.ryuqq.remoteexec.core.model.OperationKind} it creates.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.remoteexec.core.request;

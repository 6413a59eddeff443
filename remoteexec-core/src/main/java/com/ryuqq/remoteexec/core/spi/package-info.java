/**
 * Service Provider Interface package.
 *
 * <p>The single outbound port of the engine. Adapters (in-memory simulation, REST) implement
 * {@link com.ryuqq.remoteexec.core.spi.RemoteOperationGateway}; everything above it is
 * transport agnostic.</p>
 *
 * <h2>Failure Classification</h2>
 * <ul>
 *   <li>{@link com.ryuqq.remoteexec.core.spi.FailureType#TRANSIENT} - retried by the poll loop</li>
 *   <li>{@link com.ryuqq.remoteexec.core.spi.FailureType#PERMANENT} - aborts immediately</li>
 *   <li>{@link com.ryuqq.remoteexec.core.spi.FailureType#NOT_FOUND} - aborts immediately</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.remoteexec.core.spi;

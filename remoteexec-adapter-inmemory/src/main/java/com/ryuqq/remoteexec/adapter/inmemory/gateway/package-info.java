/**
 * In-memory gateway implementation for testing.
 *
 * <p>This package provides a scripted, thread-safe simulation of the compute platform behind
 * {@link com.ryuqq.remoteexec.core.spi.RemoteOperationGateway}.</p>
 *
 * <h2>Main Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.remoteexec.adapter.inmemory.gateway.InMemoryGateway} - scripted status replay
 *       with fault injection and call counters</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.remoteexec.adapter.inmemory.gateway;

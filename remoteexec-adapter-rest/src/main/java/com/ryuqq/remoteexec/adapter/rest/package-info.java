/**
 * REST Adapter - Databricks REST API Gateway.
 *
 * <p>{@link com.ryuqq.remoteexec.core.spi.RemoteOperationGateway}를 JDK {@code HttpClient}와
 * Jackson으로 구현합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.remoteexec.adapter.rest.RestOperationGateway} - 요청 전송과 응답 해석</li>
 *   <li>{@link com.ryuqq.remoteexec.adapter.rest.RestGatewayConfig} - host, token, 타임아웃</li>
 *   <li>SnapshotDecoder - JSON → StatusSnapshot 변환</li>
 *   <li>FailureClassifier - HTTP 실패 → FailureType 분류</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.remoteexec.adapter.rest;

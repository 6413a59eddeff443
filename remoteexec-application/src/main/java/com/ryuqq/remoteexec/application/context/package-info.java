/**
 * 실행 컨텍스트 관리 포트.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.remoteexec.application.context.ExecutionContextManager} - 생성 / 검증 / 파괴</li>
 *   <li>{@link com.ryuqq.remoteexec.application.context.ContextValidity} - 검증 결과</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.remoteexec.application.context;

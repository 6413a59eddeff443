/**
 * 상태 폴링 포트.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.remoteexec.application.poll.PollLoop} - 종료 조건 기반 폴링 루프</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code GatewayPollLoop}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.remoteexec.application.poll;

/**
 * Runner Adapter Layer - 폴링 기반 엔진 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.remoteexec.adapter.runner.GatewayPollLoop} - 마감 시각 / 재시도 / 취소를 지키는 폴링 루프</li>
 *   <li>{@link com.ryuqq.remoteexec.adapter.runner.PollingContextManager} - 실행 컨텍스트 생명주기</li>
 *   <li>{@link com.ryuqq.remoteexec.adapter.runner.PollingCommandRunner} - 컨텍스트 내 커맨드 실행</li>
 *   <li>{@link com.ryuqq.remoteexec.adapter.runner.PollingStatementRunner} - SQL Statement 실행</li>
 *   <li>{@link com.ryuqq.remoteexec.adapter.runner.PollingRunWaiter} - Job Run 종료 대기</li>
 *   <li>{@link com.ryuqq.remoteexec.adapter.runner.RemoteExecutionEngine} - 조립 진입점</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (Polling* Runner, GatewayPollLoop)
 *   ↓ implements
 * application (PollLoop, ExecutionContextManager, CommandRunner, StatementRunner, RunWaiter)
 *   ↓ depends on
 * core (OperationHandle, Outcome, PollConfig, StatusSnapshot)
 *   ↓ depends on
 * core/spi (RemoteOperationGateway)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.remoteexec.adapter.runner;

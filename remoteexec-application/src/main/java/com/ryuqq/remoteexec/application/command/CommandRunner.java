package com.ryuqq.remoteexec.application.command;

import com.ryuqq.remoteexec.core.model.CommandExecution;
import com.ryuqq.remoteexec.core.model.ExecutionContext;
import com.ryuqq.remoteexec.core.model.Language;
import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.poll.CancellationSignal;
import com.ryuqq.remoteexec.core.poll.PollConfig;

/**
 * 실행 컨텍스트 안에서 코드를 실행하는 Runner.
 *
 * <p><strong>결과 매핑:</strong></p>
 * <ul>
 *   <li>FINISHED + resultType=error → Fail(COMMAND_ERROR)</li>
 *   <li>FINISHED → Ok(output)</li>
 *   <li>ERROR → Fail(COMMAND_FAILED)</li>
 *   <li>CANCELLED → Cancelled</li>
 *   <li>컨텍스트 소실 → Fail(CONTEXT_LOST)</li>
 * </ul>
 *
 * <p>종료 결과는 한 번만 기록되며 이후 대기는 같은 결과를 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CommandRunner {

    /**
     * FINISHED 상태이지만 결과 타입이 error인 경우의 오류 코드.
     */
    String COMMAND_ERROR = "COMMAND_ERROR";

    /**
     * ERROR 상태로 종료된 경우의 오류 코드.
     */
    String COMMAND_FAILED = "COMMAND_FAILED";

    /**
     * 실행 중 컨텍스트가 사라진 경우의 오류 코드.
     */
    String CONTEXT_LOST = "CONTEXT_LOST";

    /**
     * 커맨드 제출.
     *
     * @param context RUNNING 상태이고 파괴되지 않은 컨텍스트
     * @param code 실행할 코드
     * @param language 실행 언어 (null이면 컨텍스트 언어)
     * @return PENDING 상태의 실행 정보
     * @throws com.ryuqq.remoteexec.core.exception.RemoteExecutionException
     *         INVALID_CONTEXT, 제출 실패 시 POLL_FAILED (일시적) 또는 POLL_ABORTED (영구)
     */
    CommandExecution submit(ExecutionContext context, String code, Language language);

    /**
     * 종료 상태까지 대기.
     *
     * @param handle 커맨드 핸들
     * @param config 폴링 설정
     * @param signal 취소 신호
     * @return 종료된 실행 정보
     * @throws com.ryuqq.remoteexec.core.exception.RemoteExecutionException
     *         TIMED_OUT, CANCELLED, POLL_FAILED, POLL_ABORTED, INVALID_HANDLE
     */
    CommandExecution awaitCompletion(OperationHandle handle, PollConfig config, CancellationSignal signal);

    /**
     * 종료 상태까지 대기 (취소 신호 없음).
     */
    default CommandExecution awaitCompletion(OperationHandle handle, PollConfig config) {
        return awaitCompletion(handle, config, CancellationSignal.none());
    }

    /**
     * 설정된 기본 커맨드 폴링 설정으로 대기.
     */
    CommandExecution awaitCompletion(OperationHandle handle);

    /**
     * 종료 상태까지 대기 (간격 / 최대 대기 시간 지정).
     */
    default CommandExecution awaitCompletion(OperationHandle handle, long pollIntervalMs, long maxWaitMs) {
        return awaitCompletion(handle, new PollConfig(pollIntervalMs, maxWaitMs), CancellationSignal.none());
    }

    /**
     * 취소 요청 (최선 노력).
     *
     * @param handle 커맨드 핸들
     * @return 취소 요청을 보냈으면 true, 이미 종료 결과가 있거나 요청이 실패하면 false
     */
    boolean cancel(OperationHandle handle);

    /**
     * 컨텍스트 생성, 제출, 대기, 파괴를 한 번에 수행.
     *
     * <p>컨텍스트가 생성된 이후에는 어떤 경로로 끝나든 파괴를 정확히 한 번 시도합니다.</p>
     *
     * @param clusterId 클러스터 ID
     * @param code 실행할 코드
     * @param language 실행 언어
     * @param config 커맨드 폴링 설정
     * @return 종료된 실행 정보
     */
    CommandExecution runOnceAndWait(String clusterId, String code, Language language, PollConfig config);

    /**
     * 설정된 runOnce 기본값(2초 간격 / 60초)으로 {@link #runOnceAndWait(String, String, Language, PollConfig)} 수행.
     */
    CommandExecution runOnceAndWait(String clusterId, String code, Language language);
}

package com.ryuqq.remoteexec.application.statement;

import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.model.ResultPage;
import com.ryuqq.remoteexec.core.model.StatementExecution;
import com.ryuqq.remoteexec.core.poll.CancellationSignal;
import com.ryuqq.remoteexec.core.poll.PollConfig;
import com.ryuqq.remoteexec.core.request.StatementRequest;

/**
 * SQL Statement를 웨어하우스에서 실행하는 Runner.
 *
 * <p>결과는 첫 페이지와 다음 페이지 토큰으로 반환하며, 페이지 이동은 자동으로 따라가지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StatementRunner {

    /**
     * 플랫폼이 오류 코드 없이 FAILED를 보고한 경우의 오류 코드.
     */
    String STATEMENT_FAILED = "STATEMENT_FAILED";

    /**
     * 결과를 읽기 전에 CLOSED가 된 경우의 오류 코드.
     */
    String STATEMENT_CLOSED = "STATEMENT_CLOSED";

    /**
     * Statement 제출.
     *
     * @param request 요청 (웨어하우스가 없으면 설정된 기본 웨어하우스 사용)
     * @return PENDING 상태의 실행 정보
     * @throws IllegalArgumentException 웨어하우스를 결정할 수 없는 경우
     * @throws com.ryuqq.remoteexec.core.exception.RemoteExecutionException
     *         제출 실패 시 NOT_FOUND, POLL_FAILED (일시적) 또는 POLL_ABORTED (영구)
     */
    StatementExecution submit(StatementRequest request);

    /**
     * Statement 제출 (간단한 형태).
     *
     * @param statement SQL
     * @param warehouseId 웨어하우스 ID (null 가능)
     * @param catalog 카탈로그 (null 가능)
     * @param schema 스키마 (null 가능)
     * @return PENDING 상태의 실행 정보
     */
    default StatementExecution submit(String statement, String warehouseId, String catalog, String schema) {
        return submit(StatementRequest.of(statement, warehouseId).withCatalog(catalog).withSchema(schema));
    }

    /**
     * 종료 상태까지 대기.
     *
     * @param handle Statement 핸들
     * @param config 폴링 설정
     * @param signal 취소 신호
     * @return 종료된 실행 정보 (첫 페이지 + 다음 페이지 토큰)
     */
    StatementExecution awaitCompletion(OperationHandle handle, PollConfig config, CancellationSignal signal);

    default StatementExecution awaitCompletion(OperationHandle handle, PollConfig config) {
        return awaitCompletion(handle, config, CancellationSignal.none());
    }

    /**
     * 다음 결과 페이지 조회.
     *
     * @param handle Statement 핸들
     * @param pageToken 이전 페이지의 토큰
     * @return 결과 페이지
     * @throws com.ryuqq.remoteexec.core.exception.RemoteExecutionException
     *         INVALID_HANDLE, NOT_FOUND, POLL_FAILED, POLL_ABORTED
     */
    ResultPage fetchNextPage(OperationHandle handle, String pageToken);

    /**
     * 취소 요청 (최선 노력).
     *
     * @return 취소 요청을 보냈으면 true
     */
    boolean cancel(OperationHandle handle);

    /**
     * 핸들을 로컬에서 해제. 이후 사용은 INVALID_HANDLE.
     */
    void close(OperationHandle handle);

    /**
     * 제출 후 종료까지 대기.
     *
     * @param request 요청
     * @param config 폴링 설정
     * @return 종료된 실행 정보
     */
    StatementExecution execute(StatementRequest request, PollConfig config);
}

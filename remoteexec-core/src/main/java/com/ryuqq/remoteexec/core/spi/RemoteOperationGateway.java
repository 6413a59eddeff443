package com.ryuqq.remoteexec.core.spi;

import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.model.ResultPage;
import com.ryuqq.remoteexec.core.request.SubmitRequest;
import com.ryuqq.remoteexec.core.snapshot.StatusSnapshot;

/**
 * Remote Operation Gateway SPI.
 *
 * <p>외부 컴퓨팅 플랫폼과 통신하는 유일한 추상화입니다.
 * 모든 상위 컴포넌트(Poll Loop, Context Manager, Runner)는 이 인터페이스만 사용합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>각 호출은 정확히 하나의 외부 요청이며, 구현체의 요청 타임아웃으로 제한됩니다.</li>
 *   <li>실패는 {@link GatewayException}({@link FailureType})으로 분류되어 던져집니다.</li>
 *   <li>재시도하지 않습니다. 재시도 정책은 Poll Loop의 책임입니다.</li>
 *   <li>호출 사이에 로컬 상태를 유지하지 않습니다.</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>구현체는 thread-safe해야 합니다.</li>
 *   <li>서로 다른 핸들에 대한 여러 Poll Loop가 동시에 호출할 수 있습니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OperationHandle handle = gateway.submit(new ContextRequest("cluster-1", Language.PYTHON));
 * StatusSnapshot snapshot = gateway.fetchStatus(handle);
 * if (snapshot.isTerminal()) {
 *     gateway.dispose(handle);
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RemoteOperationGateway {

    /**
     * 작업 제출.
     *
     * @param request 제출 요청
     * @return 플랫폼이 발급한 핸들
     * @throws GatewayException 제출 실패 시
     * @throws IllegalArgumentException request가 null인 경우
     */
    OperationHandle submit(SubmitRequest request);

    /**
     * 작업 상태 조회.
     *
     * <p>반환 타입은 핸들 종류에 대응합니다 (CONTEXT → ContextSnapshot 등).</p>
     *
     * @param handle 작업 핸들
     * @return 현재 상태 스냅샷
     * @throws GatewayException 조회 실패 시 (자원이 없으면 NOT_FOUND)
     */
    StatusSnapshot fetchStatus(OperationHandle handle);

    /**
     * Statement 결과의 다음 페이지 조회.
     *
     * @param handle STATEMENT 핸들
     * @param pageToken 이전 페이지가 반환한 토큰
     * @return 결과 페이지
     * @throws GatewayException 조회 실패 시
     * @throws IllegalArgumentException STATEMENT 핸들이 아닌 경우
     */
    ResultPage fetchPage(OperationHandle handle, String pageToken);

    /**
     * 작업 취소 요청.
     *
     * <p>취소는 요청일 뿐이며, 작업이 동시에 완료되면 완료 결과가 유지됩니다.</p>
     *
     * @param handle 작업 핸들
     * @throws GatewayException 취소 요청 실패 시
     */
    void cancel(OperationHandle handle);

    /**
     * 작업 자원 폐기.
     *
     * <p>원격 자원이 있는 경우(실행 컨텍스트)에만 외부 요청을 보냅니다.
     * 이미 없는 자원에 대해서는 NOT_FOUND로 실패할 수 있습니다.</p>
     *
     * @param handle 작업 핸들
     * @throws GatewayException 폐기 실패 시
     */
    void dispose(OperationHandle handle);
}

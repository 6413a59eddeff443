package com.ryuqq.remoteexec.core.request;

import com.ryuqq.remoteexec.core.model.OperationKind;

/**
 * Gateway에 제출하는 작업 요청.
 *
 * <p>작업 종류별로 필요한 파라미터가 다르므로 sealed interface로 정의합니다.
 * Job Run은 이 엔진이 생성하지 않으므로 요청 타입이 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface SubmitRequest permits ContextRequest, CommandRequest, StatementRequest {

    /**
     * 요청이 생성할 작업의 종류.
     *
     * @return OperationKind
     */
    OperationKind kind();
}

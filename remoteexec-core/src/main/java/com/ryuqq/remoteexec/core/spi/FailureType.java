package com.ryuqq.remoteexec.core.spi;

/**
 * Gateway 호출 실패 분류.
 *
 * <ul>
 *   <li>TRANSIENT: 재시도하면 성공할 수 있음 (네트워크 순단, Rate Limit, 5xx)</li>
 *   <li>PERMANENT: 재시도해도 성공할 수 없음 (권한 취소, 잘못된 요청)</li>
 *   <li>NOT_FOUND: 대상 자원이 존재하지 않음 (삭제되었거나 회수됨)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailureType {

    TRANSIENT,

    PERMANENT,

    NOT_FOUND
}

package com.ryuqq.remoteexec.core.exception;

/**
 * 엔진 오류 분류.
 *
 * <p>호출자는 이 값으로 재시도 / 포기 / 컨텍스트 재생성 여부를 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 컨텍스트가 RUNNING이 아니거나 이미 파괴됨.
     */
    INVALID_CONTEXT,

    /**
     * 컨텍스트 생성 실패 (ERROR 상태, 타임아웃, 제출 실패).
     */
    CONTEXT_CREATION_FAILED,

    /**
     * 작업 중 컨텍스트가 사라짐.
     */
    CONTEXT_LOST,

    /**
     * 폐기된 핸들 사용.
     */
    INVALID_HANDLE,

    /**
     * 일시적 실패 재시도 횟수 소진.
     */
    POLL_FAILED,

    /**
     * 폴링 중 영구 실패.
     */
    POLL_ABORTED,

    /**
     * 대기 시간 초과.
     */
    TIMED_OUT,

    /**
     * 대상 자원 없음.
     */
    NOT_FOUND,

    /**
     * 호출자의 취소 신호로 대기 중단.
     */
    CANCELLED
}

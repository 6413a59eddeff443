package com.ryuqq.remoteexec.core.snapshot;

/**
 * 상태 조회 결과 (한 시점의 스냅샷).
 *
 * <p>Gateway 경계에서 원시 응답을 한 번만 디코딩하여 이 타입으로 변환합니다.
 * 상위 컴포넌트는 타입이 없는 원시 구조를 직접 다루지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface StatusSnapshot permits ContextSnapshot, CommandSnapshot, StatementSnapshot, RunSnapshot {

    /**
     * 스냅샷이 종료 상태를 나타내는지 확인.
     *
     * @return 종료 상태이면 true
     */
    boolean isTerminal();
}

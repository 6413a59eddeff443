package com.ryuqq.remoteexec.application.poll;

import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.poll.CancellationSignal;
import com.ryuqq.remoteexec.core.poll.PollConfig;
import com.ryuqq.remoteexec.core.poll.PollResult;
import com.ryuqq.remoteexec.core.snapshot.StatusSnapshot;

import java.util.function.Predicate;

/**
 * 재사용 가능한 상태 폴링 루프.
 *
 * <p>모든 대기 연산(컨텍스트 생성, 커맨드, Statement, Job Run)이 이 루프 하나를 사용하며,
 * 종료 판정만 {@code isTerminal} 조건으로 달리합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>반복 시작 시 취소 신호 확인</li>
 *   <li>상태 조회, 종료 상태면 추가 지연 없이 반환</li>
 *   <li>남은 시간이 조회 간격 이하면 마감 시각까지만 대기 후 마지막 조회</li>
 *   <li>일시적 실패는 같은 간격으로 재시도, 영구 실패는 즉시 중단</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PollResult&lt;CommandSnapshot&gt; result = pollLoop.await(
 *     handle, CommandSnapshot.class, CommandSnapshot::isTerminal,
 *     PollConfig.forCommands(), CancellationSignal.none());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface PollLoop {

    /**
     * 종료 조건을 만족할 때까지 상태 폴링.
     *
     * <p>이 메서드는 예외를 던지지 않고 항상 {@link PollResult}를 반환합니다.
     * (인자 검증 실패 제외)</p>
     *
     * @param handle 조회할 핸들
     * @param snapshotType 기대하는 스냅샷 타입
     * @param isTerminal 종료 판정 조건
     * @param config 폴링 설정
     * @param signal 취소 신호
     * @param <S> 스냅샷 타입
     * @return 폴링 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    <S extends StatusSnapshot> PollResult<S> await(
        OperationHandle handle,
        Class<S> snapshotType,
        Predicate<? super S> isTerminal,
        PollConfig config,
        CancellationSignal signal
    );
}

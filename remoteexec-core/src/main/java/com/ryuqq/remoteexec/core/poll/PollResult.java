package com.ryuqq.remoteexec.core.poll;

import com.ryuqq.remoteexec.core.snapshot.StatusSnapshot;
import com.ryuqq.remoteexec.core.spi.GatewayException;

/**
 * Poll Loop 실행 결과.
 *
 * <p>Poll Loop는 예외를 던지지 않고 항상 다음 중 하나를 반환합니다.
 * 예외 변환은 각 Runner의 책임입니다.</p>
 *
 * <ul>
 *   <li>{@link Terminal}: 종료 상태 도달</li>
 *   <li>{@link TimedOut}: 최대 대기 시간 초과</li>
 *   <li>{@link Cancelled}: 취소 신호 또는 인터럽트</li>
 *   <li>{@link Aborted}: 영구 실패 또는 NOT_FOUND</li>
 *   <li>{@link Failed}: 연속 일시적 실패 허용 횟수 초과</li>
 * </ul>
 *
 * @param <S> 스냅샷 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface PollResult<S extends StatusSnapshot>
    permits PollResult.Terminal, PollResult.TimedOut, PollResult.Cancelled, PollResult.Aborted, PollResult.Failed {

    /**
     * 수행한 상태 조회 횟수 (실패한 조회 포함).
     */
    int polls();

    /**
     * Poll Loop 진입 후 경과 시간 (밀리초).
     */
    long elapsedMs();

    /**
     * 종료 상태 도달.
     */
    record Terminal<S extends StatusSnapshot>(S snapshot, int polls, long elapsedMs) implements PollResult<S> {

        public Terminal {
            if (snapshot == null) {
                throw new IllegalArgumentException("snapshot cannot be null");
            }
        }
    }

    /**
     * 최대 대기 시간 초과. 한 번도 조회에 성공하지 못했다면 lastSnapshot은 null입니다.
     */
    record TimedOut<S extends StatusSnapshot>(S lastSnapshot, int polls, long elapsedMs) implements PollResult<S> {
    }

    /**
     * 호출자 취소.
     */
    record Cancelled<S extends StatusSnapshot>(S lastSnapshot, int polls, long elapsedMs) implements PollResult<S> {
    }

    /**
     * 영구 실패 또는 NOT_FOUND로 즉시 중단.
     */
    record Aborted<S extends StatusSnapshot>(GatewayException cause, int polls, long elapsedMs) implements PollResult<S> {

        public Aborted {
            if (cause == null) {
                throw new IllegalArgumentException("cause cannot be null");
            }
        }

        public boolean isNotFound() {
            return cause.isNotFound();
        }
    }

    /**
     * 일시적 실패가 허용 횟수를 넘어 연속 발생.
     */
    record Failed<S extends StatusSnapshot>(GatewayException lastFailure, int polls, long elapsedMs) implements PollResult<S> {

        public Failed {
            if (lastFailure == null) {
                throw new IllegalArgumentException("lastFailure cannot be null");
            }
        }
    }
}

package com.ryuqq.remoteexec.core.outcome;

/**
 * 원격 취소 결과.
 *
 * <p>작업이 플랫폼에서 취소 상태로 종료되었음을 나타냅니다.
 * 호출자가 대기를 중단한 것({@code ErrorKind.CANCELLED})과는 다릅니다.</p>
 *
 * @param reason 취소 사유 (null 가능)
 * @param <T> 성공 시 결과 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Cancelled<T>(String reason) implements Outcome<T> {

    public static <T> Cancelled<T> of(String reason) {
        return new Cancelled<>(reason);
    }
}

package com.ryuqq.remoteexec.core.outcome;

/**
 * 원격 작업의 최종 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공적으로 완료됨 (결과 값 포함)</li>
 *   <li>{@link Fail}: 원격에서 실패함 (오류 코드와 메시지 포함)</li>
 *   <li>{@link Cancelled}: 원격에서 취소됨</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 알려져 있습니다.
 * 종료 상태에서만 생성되며, 한 번 기록된 Outcome은 바뀌지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Ok&lt;CommandOutput&gt; ok) {
 *     render(ok.value());
 * } else if (outcome instanceof Fail&lt;CommandOutput&gt; fail) {
 *     log.warn("{}: {}", fail.errorCode(), fail.message());
 * }
 * </pre>
 *
 * @param <T> 성공 결과 값의 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Fail, Cancelled {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 결과가 취소인지 확인.
     *
     * @return 취소 여부
     */
    default boolean isCancelled() {
        return this instanceof Cancelled;
    }
}

package com.ryuqq.remoteexec.application.context;

import com.ryuqq.remoteexec.core.model.ExecutionContext;
import com.ryuqq.remoteexec.core.model.Language;

/**
 * 실행 컨텍스트 생명주기 관리자.
 *
 * <p>컨텍스트 생성, 검증, 파괴를 담당하며, 파괴된 컨텍스트를 다시 사용하지 않도록
 * 로컬에서 추적합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ExecutionContext context = contexts.create("cluster-1", Language.PYTHON);
 * try {
 *     // 커맨드 실행
 * } finally {
 *     contexts.destroy(context);
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ExecutionContextManager {

    /**
     * 컨텍스트 생성 후 RUNNING이 될 때까지 대기.
     *
     * <p>ERROR 상태, 타임아웃, 폴링 실패, 제출 실패 시 생성 중이던 컨텍스트를
     * 최선을 다해 폐기하고 CONTEXT_CREATION_FAILED로 실패합니다.</p>
     *
     * @param clusterId 클러스터 ID
     * @param language 실행 언어
     * @return RUNNING 상태의 컨텍스트
     * @throws com.ryuqq.remoteexec.core.exception.RemoteExecutionException CONTEXT_CREATION_FAILED
     * @throws IllegalArgumentException 인자가 null이거나 빈 경우
     */
    ExecutionContext create(String clusterId, Language language);

    /**
     * 컨텍스트가 아직 사용 가능한지 플랫폼에 확인.
     *
     * <p>플랫폼에서 찾을 수 없는 컨텍스트는 로컬에서 파괴된 것으로 표시합니다.</p>
     *
     * @param context 검사할 컨텍스트
     * @return Valid 또는 Invalid(사유)
     * @throws com.ryuqq.remoteexec.core.exception.RemoteExecutionException 일시적 실패 시 POLL_FAILED
     */
    ContextValidity validate(ExecutionContext context);

    /**
     * 컨텍스트 파괴 (멱등, 최선 노력).
     *
     * <p>이미 없는 컨텍스트는 성공으로 간주합니다. 폐기 오류는 로그만 남기고 던지지 않습니다.</p>
     *
     * @param context 파괴할 컨텍스트
     */
    void destroy(ExecutionContext context);

    /**
     * 관리자가 아직 살아있는 컨텍스트로 추적 중인지 확인.
     *
     * @param context 컨텍스트
     * @return 추적 중이면 true
     */
    boolean isLive(ExecutionContext context);
}

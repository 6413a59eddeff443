package com.ryuqq.remoteexec.core.model;

import java.util.Objects;

/**
 * 원격 작업 핸들.
 *
 * <p>플랫폼이 발급한 작업 식별자를 감싸는 불변 값 객체입니다.
 * 제출(submit) 이후의 모든 상태 조회, 취소, 폐기는 이 핸들을 통해 이루어집니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>resourceScope: 작업이 실행되는 자원 (클러스터 ID, 웨어하우스 ID, 또는 {@value #JOBS_SCOPE})</li>
 *   <li>operationId: 플랫폼이 발급한 ID</li>
 *   <li>kind: 작업 종류 ({@link OperationKind})</li>
 *   <li>parentId: COMMAND 핸들의 소속 컨텍스트 ID (다른 종류는 null)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OperationHandle context = OperationHandle.context("0923-164208-abc", "ctx-1");
 * OperationHandle command = OperationHandle.command("0923-164208-abc", "ctx-1", "cmd-7");
 * OperationHandle run = OperationHandle.run("1065548238370157");
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가, 값 기반 equals/hashCode</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OperationHandle {

    /**
     * Job Run 핸들이 사용하는 고정 scope.
     */
    public static final String JOBS_SCOPE = "jobs";

    private final String resourceScope;
    private final String operationId;
    private final OperationKind kind;
    private final String parentId;

    private OperationHandle(String resourceScope, String operationId, OperationKind kind, String parentId) {
        if (resourceScope == null || resourceScope.isBlank()) {
            throw new IllegalArgumentException("resourceScope cannot be null or blank");
        }
        if (operationId == null || operationId.isBlank()) {
            throw new IllegalArgumentException("operationId cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind == OperationKind.COMMAND && (parentId == null || parentId.isBlank())) {
            throw new IllegalArgumentException("parentId cannot be null or blank for command handle");
        }
        if (kind != OperationKind.COMMAND && parentId != null) {
            throw new IllegalArgumentException("parentId is only allowed for command handle (kind: " + kind + ")");
        }
        this.resourceScope = resourceScope;
        this.operationId = operationId;
        this.kind = kind;
        this.parentId = parentId;
    }

    /**
     * 실행 컨텍스트 핸들 생성.
     *
     * @param clusterId 클러스터 ID
     * @param contextId 컨텍스트 ID
     * @return CONTEXT 핸들
     * @throws IllegalArgumentException 값이 null이거나 빈 문자열인 경우
     */
    public static OperationHandle context(String clusterId, String contextId) {
        return new OperationHandle(clusterId, contextId, OperationKind.CONTEXT, null);
    }

    /**
     * 커맨드 핸들 생성.
     *
     * @param clusterId 클러스터 ID
     * @param contextId 소속 컨텍스트 ID
     * @param commandId 커맨드 ID
     * @return COMMAND 핸들
     * @throws IllegalArgumentException 값이 null이거나 빈 문자열인 경우
     */
    public static OperationHandle command(String clusterId, String contextId, String commandId) {
        return new OperationHandle(clusterId, commandId, OperationKind.COMMAND, contextId);
    }

    /**
     * SQL Statement 핸들 생성.
     *
     * @param warehouseId 웨어하우스 ID
     * @param statementId Statement ID
     * @return STATEMENT 핸들
     * @throws IllegalArgumentException 값이 null이거나 빈 문자열인 경우
     */
    public static OperationHandle statement(String warehouseId, String statementId) {
        return new OperationHandle(warehouseId, statementId, OperationKind.STATEMENT, null);
    }

    /**
     * Job Run 핸들 생성.
     *
     * @param runId Run ID
     * @return RUN 핸들
     * @throws IllegalArgumentException runId가 null이거나 빈 문자열인 경우
     */
    public static OperationHandle run(String runId) {
        return new OperationHandle(JOBS_SCOPE, runId, OperationKind.RUN, null);
    }

    /**
     * COMMAND 핸들이 속한 컨텍스트의 핸들 조회.
     *
     * @return 소속 컨텍스트 핸들
     * @throws IllegalStateException COMMAND 핸들이 아닌 경우
     */
    public OperationHandle contextHandle() {
        if (kind != OperationKind.COMMAND) {
            throw new IllegalStateException("Only command handle has an owning context (kind: " + kind + ")");
        }
        return context(resourceScope, parentId);
    }

    public String getResourceScope() {
        return resourceScope;
    }

    public String getOperationId() {
        return operationId;
    }

    public OperationKind getKind() {
        return kind;
    }

    /**
     * 소속 컨텍스트 ID 조회.
     *
     * @return COMMAND 핸들이면 컨텍스트 ID, 그 외에는 null
     */
    public String getParentId() {
        return parentId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationHandle that = (OperationHandle) o;
        return resourceScope.equals(that.resourceScope)
            && operationId.equals(that.operationId)
            && kind == that.kind
            && Objects.equals(parentId, that.parentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resourceScope, operationId, kind, parentId);
    }

    @Override
    public String toString() {
        if (parentId != null) {
            return "OperationHandle{" + kind + " " + resourceScope + "/" + parentId + "/" + operationId + "}";
        }
        return "OperationHandle{" + kind + " " + resourceScope + "/" + operationId + "}";
    }
}

package com.ryuqq.remoteexec.core.model;

/**
 * 원격 작업 단위의 종류.
 *
 * <ul>
 *   <li>CONTEXT: 클러스터 위의 실행 컨텍스트 (세션)</li>
 *   <li>COMMAND: 실행 컨텍스트 안에서 실행되는 코드 조각</li>
 *   <li>STATEMENT: 웨어하우스에서 실행되는 SQL 문</li>
 *   <li>RUN: 이미 생성된 Job Run (관찰만 함)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum OperationKind {

    CONTEXT,

    COMMAND,

    STATEMENT,

    RUN
}

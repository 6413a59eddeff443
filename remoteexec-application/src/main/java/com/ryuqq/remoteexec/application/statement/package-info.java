/**
 * SQL Statement 실행 포트.
 *
 * @since 1.0.0
 */
package com.ryuqq.remoteexec.application.statement;

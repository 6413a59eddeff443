/**
 * 커맨드 실행 포트.
 *
 * @since 1.0.0
 */
package com.ryuqq.remoteexec.application.command;

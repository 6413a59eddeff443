/**
 * Job Run 대기 포트.
 *
 * @since 1.0.0
 */
package com.ryuqq.remoteexec.application.run;

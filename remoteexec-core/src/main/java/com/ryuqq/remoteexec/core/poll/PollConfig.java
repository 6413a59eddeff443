package com.ryuqq.remoteexec.core.poll;

/**
 * Poll Loop 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollIntervalMs: 상태 조회 간격</li>
 *   <li>maxWaitMs: 최대 대기 시간 (Poll Loop 진입 시점부터 측정)</li>
 *   <li>maxTransientRetries: 연속 일시적 실패 허용 횟수 (기본 3)</li>
 * </ul>
 *
 * <p><strong>작업 종류별 기본값:</strong></p>
 * <ul>
 *   <li>컨텍스트: 1초 / 2분</li>
 *   <li>커맨드: 2초 / 5분</li>
 *   <li>일회성 커맨드 (runOnceAndWait): 2초 / 60초</li>
 *   <li>Statement: 1초 / 5분</li>
 *   <li>Job Run: 10초 / 60분</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param pollIntervalMs 조회 간격 (밀리초, 양수여야 함)
 * @param maxWaitMs 최대 대기 시간 (밀리초, 양수여야 함)
 * @param maxTransientRetries 연속 일시적 실패 허용 횟수 (0 이상이어야 함)
 */
public record PollConfig(
    long pollIntervalMs,
    long maxWaitMs,
    int maxTransientRetries
) {

    public static final int DEFAULT_MAX_TRANSIENT_RETRIES = 3;

    /**
     * 기본 재시도 횟수를 사용하는 생성자.
     *
     * @param pollIntervalMs 조회 간격
     * @param maxWaitMs 최대 대기 시간
     */
    public PollConfig(long pollIntervalMs, long maxWaitMs) {
        this(pollIntervalMs, maxWaitMs, DEFAULT_MAX_TRANSIENT_RETRIES);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PollConfig {
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
        if (maxWaitMs <= 0) {
            throw new IllegalArgumentException(
                "maxWaitMs must be positive (current: " + maxWaitMs + ")"
            );
        }
        if (maxTransientRetries < 0) {
            throw new IllegalArgumentException(
                "maxTransientRetries must be non-negative (current: " + maxTransientRetries + ")"
            );
        }
    }

    public static PollConfig forContexts() {
        return new PollConfig(1_000, 120_000);
    }

    public static PollConfig forCommands() {
        return new PollConfig(2_000, 300_000);
    }

    public static PollConfig forRunOnce() {
        return new PollConfig(2_000, 60_000);
    }

    public static PollConfig forStatements() {
        return new PollConfig(1_000, 300_000);
    }

    public static PollConfig forRuns() {
        return new PollConfig(10_000, 3_600_000);
    }

    /**
     * pollIntervalMs만 변경한 새 인스턴스 생성.
     */
    public PollConfig withPollIntervalMs(long pollIntervalMs) {
        return new PollConfig(pollIntervalMs, maxWaitMs, maxTransientRetries);
    }

    /**
     * maxWaitMs만 변경한 새 인스턴스 생성.
     */
    public PollConfig withMaxWaitMs(long maxWaitMs) {
        return new PollConfig(pollIntervalMs, maxWaitMs, maxTransientRetries);
    }

    /**
     * maxTransientRetries만 변경한 새 인스턴스 생성.
     */
    public PollConfig withMaxTransientRetries(int maxTransientRetries) {
        return new PollConfig(pollIntervalMs, maxWaitMs, maxTransientRetries);
    }
}

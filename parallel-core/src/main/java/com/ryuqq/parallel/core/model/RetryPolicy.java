package com.ryuqq.parallel.core.model;

/**
 * Task 재시도 정책.
 *
 * <p>maxAttempts는 최초 시도를 포함한 총 시도 횟수입니다.
 * maxAttempts=1이면 재시도 없이 한 번만 실행합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * // 최대 3회, 100ms → 200ms 대기
 * RetryPolicy policy = new RetryPolicy(3, BackoffStrategy.EXPONENTIAL, 100);
 * </pre>
 *
 * @param maxAttempts 총 시도 횟수 (1 이상)
 * @param backoff 백오프 방식
 * @param initialDelayMs 첫 재시도 전 대기 시간 (밀리초, 0 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RetryPolicy(
    int maxAttempts,
    BackoffStrategy backoff,
    long initialDelayMs
) {

    private static final RetryPolicy NONE = new RetryPolicy(1, BackoffStrategy.EXPONENTIAL, 0);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException("initialDelayMs must be non-negative (current: " + initialDelayMs + ")");
        }
    }

    /**
     * 재시도 없음 (1회 실행).
     *
     * @return 공유 인스턴스
     */
    public static RetryPolicy none() {
        return NONE;
    }

    /**
     * 재시도 여부.
     *
     * @return maxAttempts가 2 이상이면 true
     */
    public boolean retries() {
        return maxAttempts > 1;
    }
}

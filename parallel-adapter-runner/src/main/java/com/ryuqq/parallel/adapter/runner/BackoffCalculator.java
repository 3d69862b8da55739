package com.ryuqq.parallel.adapter.runner;

import com.ryuqq.parallel.core.model.RetryPolicy;

/**
 * 재시도 대기 시간 계산기.
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * EXPONENTIAL: delay = initialDelay * 2^attemptIndex
 * LINEAR:      delay = initialDelay * (attemptIndex + 1)
 * delay = min(delay + jitter, maxDelay)
 * jitter = random(0, delay * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (initialDelay=100ms, jitterFactor=0):</strong></p>
 * <ul>
 *   <li>attemptIndex=0: EXPONENTIAL 100ms, LINEAR 100ms</li>
 *   <li>attemptIndex=1: EXPONENTIAL 200ms, LINEAR 200ms</li>
 *   <li>attemptIndex=2: EXPONENTIAL 400ms, LINEAR 300ms</li>
 * </ul>
 *
 * <p>기본값은 상한 없음(Long.MAX_VALUE), jitterFactor 0으로 계산식 그대로의 값을 반환합니다.
 * long 범위를 넘는 값만 Long.MAX_VALUE로 포화됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    /** 상한 없음. */
    public static final long UNBOUNDED = Long.MAX_VALUE;

    /** 2^62를 넘는 시프트는 overflow이므로 상한을 둔다. */
    private static final int MAX_SHIFT = 62;

    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: maxDelay={@link #UNBOUNDED}, jitterFactor=0.0</p>
     */
    public BackoffCalculator() {
        this(UNBOUNDED, 0.0);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param maxDelayMs 최대 지연 시간 (밀리초, 0 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long maxDelayMs, double jitterFactor) {
        if (maxDelayMs < 0) {
            throw new IllegalArgumentException(
                "maxDelayMs must be non-negative (current: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param policy 재시도 정책
     * @param attemptIndex 방금 실패한 시도의 인덱스 (0부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException policy가 null이거나 attemptIndex가 음수인 경우
     */
    public long calculate(RetryPolicy policy, int attemptIndex) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (attemptIndex < 0) {
            throw new IllegalArgumentException(
                "attemptIndex must be non-negative (current: " + attemptIndex + ")"
            );
        }

        long initialDelayMs = policy.initialDelayMs();
        long base = switch (policy.backoff()) {
            case EXPONENTIAL -> attemptIndex > MAX_SHIFT
                ? multiplyCapped(initialDelayMs, Long.MAX_VALUE)
                : multiplyCapped(initialDelayMs, 1L << attemptIndex);
            case LINEAR -> multiplyCapped(initialDelayMs, attemptIndex + 1L);
        };

        long jitter = (long) (base * jitterFactor * Math.random());
        if (jitter > maxDelayMs - base) {
            return maxDelayMs;
        }
        return base + jitter;
    }

    private long multiplyCapped(long delay, long factor) {
        if (delay != 0 && factor > maxDelayMs / delay) {
            return maxDelayMs;
        }
        return Math.min(delay * factor, maxDelayMs);
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}

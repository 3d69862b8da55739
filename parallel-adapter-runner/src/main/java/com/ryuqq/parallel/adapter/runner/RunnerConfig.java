package com.ryuqq.parallel.adapter.runner;

import com.ryuqq.parallel.core.model.BackoffStrategy;
import com.ryuqq.parallel.core.model.RetryPolicy;

import java.util.Locale;
import java.util.Properties;

/**
 * LevelBarrierExecutor 엔진 기본 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultTaskTimeoutMs: Task에 timeoutMs가 없을 때 적용 (기본 30000ms, 0 = 제한 없음)</li>
 *   <li>defaultRetryPolicy: Task에 retryPolicy가 없을 때 적용 (기본 재시도 없음)</li>
 *   <li>workerThreads: Task 시작을 처리하는 워커 스레드 수 (기본 10)</li>
 *   <li>schedulerThreads: 타임아웃 타이머와 백오프 대기용 스레드 수 (기본 2)</li>
 *   <li>shutdownTimeoutMs: close() 시 graceful shutdown 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * <p><strong>Properties 키 ({@link #fromProperties}):</strong></p>
 * <pre>
 * parallel.runner.default-task-timeout-ms=30000
 * parallel.runner.worker-threads=10
 * parallel.runner.scheduler-threads=2
 * parallel.runner.shutdown-timeout-ms=60000
 * parallel.runner.default-retry.max-attempts=1
 * parallel.runner.default-retry.backoff=exponential
 * parallel.runner.default-retry.initial-delay-ms=0
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param defaultTaskTimeoutMs 기본 Task 타임아웃 (밀리초, 0 이상)
 * @param defaultRetryPolicy 기본 재시도 정책
 * @param workerThreads 워커 스레드 수 (1 이상)
 * @param schedulerThreads 스케줄러 스레드 수 (1 이상)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 0 이상)
 */
public record RunnerConfig(
    long defaultTaskTimeoutMs,
    RetryPolicy defaultRetryPolicy,
    int workerThreads,
    int schedulerThreads,
    long shutdownTimeoutMs
) {

    public static final String PREFIX = "parallel.runner.";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultTaskTimeoutMs=30000ms, defaultRetryPolicy=none,
     * workerThreads=10, schedulerThreads=2, shutdownTimeoutMs=60000ms</p>
     */
    public RunnerConfig() {
        this(30000, RetryPolicy.none(), 10, 2, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RunnerConfig {
        if (defaultTaskTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "defaultTaskTimeoutMs must be non-negative (current: " + defaultTaskTimeoutMs + ")"
            );
        }
        if (defaultRetryPolicy == null) {
            throw new IllegalArgumentException("defaultRetryPolicy cannot be null");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException(
                "workerThreads must be positive (current: " + workerThreads + ")"
            );
        }
        if (schedulerThreads <= 0) {
            throw new IllegalArgumentException(
                "schedulerThreads must be positive (current: " + schedulerThreads + ")"
            );
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be non-negative (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * Properties에서 설정 로드.
     *
     * <p>없는 키는 기본값을 사용합니다.</p>
     *
     * @param properties 설정 원본
     * @return RunnerConfig
     * @throws IllegalArgumentException 숫자 형식이 잘못되었거나 값이 유효하지 않은 경우
     */
    public static RunnerConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        RunnerConfig defaults = new RunnerConfig();
        RetryPolicy defaultRetry = defaults.defaultRetryPolicy();

        RetryPolicy retryPolicy = new RetryPolicy(
            (int) readLong(properties, "default-retry.max-attempts", defaultRetry.maxAttempts()),
            readBackoff(properties, defaultRetry.backoff()),
            readLong(properties, "default-retry.initial-delay-ms", defaultRetry.initialDelayMs())
        );

        return new RunnerConfig(
            readLong(properties, "default-task-timeout-ms", defaults.defaultTaskTimeoutMs()),
            retryPolicy,
            (int) readLong(properties, "worker-threads", defaults.workerThreads()),
            (int) readLong(properties, "scheduler-threads", defaults.schedulerThreads()),
            readLong(properties, "shutdown-timeout-ms", defaults.shutdownTimeoutMs())
        );
    }

    private static long readLong(Properties properties, String key, long defaultValue) {
        String raw = properties.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Invalid number for " + PREFIX + key + " (current: " + raw + ")", e
            );
        }
    }

    private static BackoffStrategy readBackoff(Properties properties, BackoffStrategy defaultValue) {
        String key = PREFIX + "default-retry.backoff";
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return BackoffStrategy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid backoff for " + key + " (current: " + raw + ")", e);
        }
    }

    /**
     * defaultTaskTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withDefaultTaskTimeoutMs(long defaultTaskTimeoutMs) {
        return new RunnerConfig(defaultTaskTimeoutMs, defaultRetryPolicy, workerThreads, schedulerThreads, shutdownTimeoutMs);
    }

    /**
     * defaultRetryPolicy만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withDefaultRetryPolicy(RetryPolicy defaultRetryPolicy) {
        return new RunnerConfig(defaultTaskTimeoutMs, defaultRetryPolicy, workerThreads, schedulerThreads, shutdownTimeoutMs);
    }

    /**
     * workerThreads만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withWorkerThreads(int workerThreads) {
        return new RunnerConfig(defaultTaskTimeoutMs, defaultRetryPolicy, workerThreads, schedulerThreads, shutdownTimeoutMs);
    }

    /**
     * schedulerThreads만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withSchedulerThreads(int schedulerThreads) {
        return new RunnerConfig(defaultTaskTimeoutMs, defaultRetryPolicy, workerThreads, schedulerThreads, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new RunnerConfig(defaultTaskTimeoutMs, defaultRetryPolicy, workerThreads, schedulerThreads, shutdownTimeoutMs);
    }
}

package com.ryuqq.parallel.application.execution;

/**
 * 요청 단위 실행 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConcurrent: 레벨 내 동시 실행 Task 수 상한 (기본 10)</li>
 *   <li>failureMode: 실패 처리 정책 (기본 CONTINUE)</li>
 *   <li>timeoutMs: 전체 실행 예산 (기본 0 = 제한 없음)</li>
 *   <li>enableRollback: 롤백 활성화 플래그 (기본 false, 보고용)</li>
 * </ul>
 *
 * <p>전체 예산은 레벨 경계에서만 검사되며, 실행 중인 Task를 중단하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxConcurrent 동시 실행 상한 (양수여야 함)
 * @param failureMode 실패 처리 정책
 * @param timeoutMs 전체 실행 예산 (밀리초, 0이면 제한 없음)
 * @param enableRollback 롤백 활성화 여부
 */
public record ExecutionConfig(
    int maxConcurrent,
    FailureMode failureMode,
    long timeoutMs,
    boolean enableRollback
) {

    /** 기본 동시 실행 상한. */
    public static final int DEFAULT_MAX_CONCURRENT = 10;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxConcurrent=10, failureMode=CONTINUE, timeoutMs=0, enableRollback=false</p>
     */
    public ExecutionConfig() {
        this(DEFAULT_MAX_CONCURRENT, FailureMode.CONTINUE, 0, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExecutionConfig {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrent must be positive (current: " + maxConcurrent + ")"
            );
        }
        if (failureMode == null) {
            throw new IllegalArgumentException("failureMode cannot be null");
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be non-negative (current: " + timeoutMs + ")"
            );
        }
    }

    /**
     * 전체 실행 예산이 설정되었는지 확인.
     *
     * @return timeoutMs가 양수인 경우 true
     */
    public boolean hasBudget() {
        return timeoutMs > 0;
    }

    /**
     * maxConcurrent만 변경한 새 인스턴스 생성.
     */
    public ExecutionConfig withMaxConcurrent(int maxConcurrent) {
        return new ExecutionConfig(maxConcurrent, failureMode, timeoutMs, enableRollback);
    }

    /**
     * failureMode만 변경한 새 인스턴스 생성.
     */
    public ExecutionConfig withFailureMode(FailureMode failureMode) {
        return new ExecutionConfig(maxConcurrent, failureMode, timeoutMs, enableRollback);
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     */
    public ExecutionConfig withTimeoutMs(long timeoutMs) {
        return new ExecutionConfig(maxConcurrent, failureMode, timeoutMs, enableRollback);
    }

    /**
     * enableRollback만 변경한 새 인스턴스 생성.
     */
    public ExecutionConfig withEnableRollback(boolean enableRollback) {
        return new ExecutionConfig(maxConcurrent, failureMode, timeoutMs, enableRollback);
    }
}

package com.ryuqq.parallel.core.model;

/**
 * 재시도 간 대기 시간 증가 방식.
 *
 * <ul>
 *   <li>EXPONENTIAL: initialDelay * 2^attemptIndex</li>
 *   <li>LINEAR: initialDelay * (attemptIndex + 1)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum BackoffStrategy {

    EXPONENTIAL,

    LINEAR
}

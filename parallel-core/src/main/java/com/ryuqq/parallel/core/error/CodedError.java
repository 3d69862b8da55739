package com.ryuqq.parallel.core.error;

/**
 * 안정적인 오류 코드를 제공하는 예외.
 *
 * <p>이 인터페이스를 구현한 예외는 TaskResult.error.code에
 * 클래스 이름 대신 {@link #errorCode()} 값이 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CodedError {

    /**
     * 오류 코드.
     *
     * @return 오류 코드 (예: TASK_TIMEOUT)
     */
    String errorCode();
}

package com.ryuqq.parallel.application.resolve;

import com.ryuqq.parallel.core.error.CodedError;

/**
 * 변수 참조를 해석할 수 없을 때 발생하는 예외.
 *
 * <p>해당 Task의 실패 사유로 기록되며, 실행 전체를 중단시키지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class VariableResolutionException extends RuntimeException implements CodedError {

    public static final String ERROR_CODE = "VARIABLE_RESOLUTION_FAILED";

    private final String variable;
    private final String reason;

    /**
     * 생성자.
     *
     * @param variable 원본 참조 표현 (예: {@code ${taskA.result.id}})
     * @param reason 실패 사유
     */
    public VariableResolutionException(String variable, String reason) {
        super("Cannot resolve variable " + variable + ": " + reason);
        this.variable = variable;
        this.reason = reason;
    }

    public String getVariable() {
        return variable;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String errorCode() {
        return ERROR_CODE;
    }
}

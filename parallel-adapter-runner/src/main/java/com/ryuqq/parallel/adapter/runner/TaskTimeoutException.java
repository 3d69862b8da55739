package com.ryuqq.parallel.adapter.runner;

import com.ryuqq.parallel.core.error.CodedError;

/**
 * Task가 제한 시간 안에 완료되지 않았을 때 발생하는 예외.
 *
 * <p>타임아웃은 선점형이 아닙니다. 이 예외가 발생해도 원래 작업은 취소되지 않고
 * 백그라운드에서 계속 실행될 수 있으며, 그 결과는 버려집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TaskTimeoutException extends RuntimeException implements CodedError {

    public static final String ERROR_CODE = "TASK_TIMEOUT";

    private final String taskId;
    private final long timeoutMs;

    public TaskTimeoutException(String taskId, long timeoutMs) {
        super("Task " + taskId + " exceeded timeout of " + timeoutMs + "ms");
        this.taskId = taskId;
        this.timeoutMs = timeoutMs;
    }

    public String getTaskId() {
        return taskId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public String errorCode() {
        return ERROR_CODE;
    }
}

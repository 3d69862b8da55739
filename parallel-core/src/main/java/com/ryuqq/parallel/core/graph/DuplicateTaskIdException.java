package com.ryuqq.parallel.core.graph;

/**
 * 동일한 Task ID가 두 번 이상 제출됨.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DuplicateTaskIdException extends DagValidationException {

    private final String taskId;

    public DuplicateTaskIdException(String taskId) {
        super("Duplicate task ID: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}

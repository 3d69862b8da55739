package com.ryuqq.parallel.core.graph;

/**
 * 존재하지 않는 Task에 대한 의존성 선언.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MissingDependencyException extends DagValidationException {

    private final String taskId;
    private final String missingDependencyId;

    /**
     * 생성자.
     *
     * @param taskId 의존성을 선언한 Task ID
     * @param missingDependencyId 존재하지 않는 대상 Task ID
     */
    public MissingDependencyException(String taskId, String missingDependencyId) {
        super("Task " + taskId + " depends on non-existent task " + missingDependencyId);
        this.taskId = taskId;
        this.missingDependencyId = missingDependencyId;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getMissingDependencyId() {
        return missingDependencyId;
    }
}

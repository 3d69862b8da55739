package com.ryuqq.parallel.testkit.contract;

import com.ryuqq.parallel.core.model.TaskResult;
import com.ryuqq.parallel.core.spi.ExecutionListener;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ExecutionListener} that records every callback for later assertions.
 *
 * <p>Thread-safe: task callbacks arrive from worker threads.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingExecutionListener implements ExecutionListener {

    private final List<String> events = new CopyOnWriteArrayList<>();
    private final List<String> startedTasks = new CopyOnWriteArrayList<>();
    private final List<TaskResult> completedTasks = new CopyOnWriteArrayList<>();
    private final List<List<String>> levels = new CopyOnWriteArrayList<>();

    @Override
    public void onExecutionStarted(String executionId, int taskCount, int levelCount) {
        events.add("execution-started:" + taskCount + ":" + levelCount);
    }

    @Override
    public void onLevelStarted(String executionId, int level, List<String> taskIds) {
        levels.add(List.copyOf(taskIds));
        events.add("level-started:" + level);
    }

    @Override
    public void onTaskStarted(String executionId, String taskId) {
        startedTasks.add(taskId);
    }

    @Override
    public void onTaskCompleted(String executionId, TaskResult result) {
        completedTasks.add(result);
    }

    @Override
    public void onExecutionCompleted(String executionId, Collection<TaskResult> results) {
        events.add("execution-completed:" + results.size());
    }

    /**
     * Execution and level events in arrival order.
     *
     * @return snapshot
     */
    public List<String> events() {
        return List.copyOf(events);
    }

    public List<String> startedTasks() {
        return List.copyOf(startedTasks);
    }

    public List<TaskResult> completedTasks() {
        return List.copyOf(completedTasks);
    }

    public List<List<String>> levels() {
        return List.copyOf(levels);
    }

    public void clear() {
        events.clear();
        startedTasks.clear();
        completedTasks.clear();
        levels.clear();
    }
}

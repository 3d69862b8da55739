package com.ryuqq.parallel.core.graph;

import com.ryuqq.parallel.core.model.Task;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Task ID로 색인된 노드 집합 (그래프 소유자).
 *
 * <p>노드와 Task 모두 제출 순서를 유지합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskGraph {

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, DagNode> nodes = new LinkedHashMap<>();

    TaskGraph() {
    }

    void add(Task task) {
        tasks.put(task.id(), task);
        nodes.put(task.id(), new DagNode(task.id(), task.dependsOn()));
    }

    /**
     * ID 포함 여부.
     *
     * @param taskId Task ID
     * @return 포함되면 true
     */
    public boolean contains(String taskId) {
        return nodes.containsKey(taskId);
    }

    /**
     * 노드 조회.
     *
     * @param taskId Task ID
     * @return 노드
     * @throws IllegalArgumentException 그래프에 없는 ID인 경우
     */
    public DagNode node(String taskId) {
        DagNode node = nodes.get(taskId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown task ID: " + taskId);
        }
        return node;
    }

    /**
     * Task 조회.
     *
     * @param taskId Task ID
     * @return Task
     * @throws IllegalArgumentException 그래프에 없는 ID인 경우
     */
    public Task task(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task ID: " + taskId);
        }
        return task;
    }

    /**
     * 전체 Task ID (제출 순서).
     *
     * @return Task ID 집합
     */
    public Set<String> taskIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    /**
     * 전체 노드 (제출 순서).
     *
     * @return 노드 컬렉션
     */
    public Collection<DagNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int size() {
        return nodes.size();
    }
}

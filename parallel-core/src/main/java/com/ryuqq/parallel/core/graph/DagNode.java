package com.ryuqq.parallel.core.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.OptionalInt;
import java.util.Set;

/**
 * 의존성 그래프의 노드.
 *
 * <p>Task를 직접 소유하지 않고 ID로 참조합니다. 간선도 노드 참조가 아닌
 * Task ID 집합으로 저장되며, 실제 Task는 소유 그래프({@link TaskGraph})에서 조회합니다.</p>
 *
 * <p><strong>가변 상태:</strong> dependents(그래프 구성 중)와 level(레벨 계산 중)만
 * {@link DagBuilder}가 같은 패키지 안에서 설정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DagNode {

    private final String taskId;
    private final Set<String> dependencies;
    private final Set<String> dependents = new LinkedHashSet<>();
    private Integer level;

    DagNode(String taskId, Set<String> dependencies) {
        this.taskId = taskId;
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
    }

    public String getTaskId() {
        return taskId;
    }

    /**
     * 이 노드가 기다리는 Task ID.
     *
     * @return 선행 Task ID 집합 (불변)
     */
    public Set<String> getDependencies() {
        return dependencies;
    }

    /**
     * 이 노드를 기다리는 Task ID (역방향 간선).
     *
     * @return 후행 Task ID 집합 (불변 뷰)
     */
    public Set<String> getDependents() {
        return Collections.unmodifiableSet(dependents);
    }

    /**
     * 실행 레벨.
     *
     * @return 레벨 계산 전이면 empty
     */
    public OptionalInt getLevel() {
        return level == null ? OptionalInt.empty() : OptionalInt.of(level);
    }

    void addDependent(String dependentId) {
        dependents.add(dependentId);
    }

    void assignLevel(int level) {
        this.level = level;
    }

    @Override
    public String toString() {
        return "DagNode{" + taskId + ", deps=" + dependencies + ", level=" + level + '}';
    }
}

package com.ryuqq.parallel.core.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * 검증을 통과한 실행 계획.
 *
 * @param graph 레벨이 할당된 그래프
 * @param levels 레벨별 Task ID (0번 레벨은 의존성 없음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DagPlan(TaskGraph graph, List<List<String>> levels) {

    public DagPlan {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (levels == null) {
            throw new IllegalArgumentException("levels cannot be null");
        }
        List<List<String>> copy = new ArrayList<>(levels.size());
        for (List<String> level : levels) {
            copy.add(List.copyOf(level));
        }
        levels = List.copyOf(copy);
    }

    public int levelCount() {
        return levels.size();
    }
}

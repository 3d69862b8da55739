package com.ryuqq.parallel.application.execution;

import com.ryuqq.parallel.core.graph.GraphEdge;

import java.util.ArrayList;
import java.util.List;

/**
 * 실행 보고서에 포함되는 DAG 진단 정보.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param levels 레벨별 Task ID
 * @param edges 선행 → 후행 간선
 */
public record DagInfo(List<List<String>> levels, List<GraphEdge> edges) {

    public DagInfo {
        if (levels == null || edges == null) {
            throw new IllegalArgumentException("levels and edges cannot be null");
        }
        List<List<String>> copy = new ArrayList<>(levels.size());
        for (List<String> level : levels) {
            copy.add(List.copyOf(level));
        }
        levels = List.copyOf(copy);
        edges = List.copyOf(edges);
    }
}

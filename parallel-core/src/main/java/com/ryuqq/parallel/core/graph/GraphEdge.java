package com.ryuqq.parallel.core.graph;

/**
 * 의존성 간선 (선행 Task → 후행 Task).
 *
 * @param from 선행 Task ID
 * @param to 후행 Task ID
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GraphEdge(String from, String to) {

    public GraphEdge {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Edge endpoints cannot be null (from: " + from + ", to: " + to + ")");
        }
    }
}

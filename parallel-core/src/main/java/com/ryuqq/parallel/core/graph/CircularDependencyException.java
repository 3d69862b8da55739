package com.ryuqq.parallel.core.graph;

import java.util.List;

/**
 * 순환 의존성 발견.
 *
 * <p>cycle은 같은 ID로 시작하고 끝나는 경로입니다.
 * 자기 자신에 대한 의존성은 {@code [A, A]}로 표현됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CircularDependencyException extends DagValidationException {

    private final List<String> cycle;

    public CircularDependencyException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" → ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * 순환 경로 조회.
     *
     * @return 첫 원소와 마지막 원소가 같은 ID 목록
     */
    public List<String> getCycle() {
        return cycle;
    }
}

package com.ryuqq.parallel.core.graph;

/**
 * 실행 전 그래프 검증 실패.
 *
 * <p>이 예외가 발생하면 요청 전체가 거부되며, 어떤 Task도 실행되지 않고
 * ExecutionReport도 생성되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see DuplicateTaskIdException
 * @see MissingDependencyException
 * @see CircularDependencyException
 */
public abstract class DagValidationException extends RuntimeException {

    protected DagValidationException(String message) {
        super(message);
    }
}

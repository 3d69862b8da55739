/**
 * 의존성 그래프 - 구성, 검증, 레벨 계산.
 *
 * <p>{@link com.ryuqq.parallel.core.graph.TaskGraph}는 Task ID로 색인된 노드 저장소이며,
 * 노드 간 간선은 참조가 아닌 ID로 저장됩니다.</p>
 *
 * <h2>검증 예외</h2>
 * <ul>
 *   <li>{@link com.ryuqq.parallel.core.graph.DuplicateTaskIdException}</li>
 *   <li>{@link com.ryuqq.parallel.core.graph.MissingDependencyException}</li>
 *   <li>{@link com.ryuqq.parallel.core.graph.CircularDependencyException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.parallel.core.graph;

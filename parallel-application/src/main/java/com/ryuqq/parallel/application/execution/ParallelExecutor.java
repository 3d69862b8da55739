package com.ryuqq.parallel.application.execution;

import com.ryuqq.parallel.core.graph.DagValidationException;

/**
 * DAG 기반 병렬 실행기.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * List&lt;Task&gt; tasks = List.of(
 *     Task.of("fetch", "http_get", params),
 *     Task.builder("parse", "json_parse")
 *         .params(MapValue.from(Map.of("body", "${fetch.result.body}")))
 *         .dependsOn("fetch")
 *         .build()
 * );
 *
 * ExecutionReport report = executor.execute(ExecutionRequest.of(tasks));
 * if (report.status() == ExecutionStatus.SUCCESS) {
 *     Value parsed = report.task("parse").orElseThrow().result();
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ParallelExecutor {

    /**
     * 요청을 검증하고 모든 Task를 레벨 순으로 실행.
     *
     * <p>검증을 통과한 이후에는 예외를 던지지 않으며,
     * 모든 Task의 결과가 담긴 보고서를 반환합니다.</p>
     *
     * @param request 실행 요청
     * @return 실행 보고서
     * @throws IllegalArgumentException request가 null이거나 Task 목록이 비어 있는 경우
     * @throws DagValidationException 의존성 그래프가 유효하지 않은 경우
     */
    ExecutionReport execute(ExecutionRequest request);
}

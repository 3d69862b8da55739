/**
 * Parallel Engine Application Layer - 실행 계약.
 *
 * <p>요청({@link com.ryuqq.parallel.application.execution.ExecutionRequest})과
 * 보고서({@link com.ryuqq.parallel.application.execution.ExecutionReport}),
 * 그리고 실행기 포트({@link com.ryuqq.parallel.application.execution.ParallelExecutor})를 정의합니다.
 * 구현체는 adapter-runner 모듈에 위치합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.parallel.application.execution;

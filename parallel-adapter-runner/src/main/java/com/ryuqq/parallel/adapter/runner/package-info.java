/**
 * Runner Adapter Layer - ParallelExecutor 구현체.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.parallel.adapter.runner.LevelBarrierExecutor} - 레벨 배리어 병렬 실행기</li>
 *   <li>{@link com.ryuqq.parallel.adapter.runner.TaskRunner} - 타임아웃/재시도 래퍼</li>
 *   <li>{@link com.ryuqq.parallel.adapter.runner.BackoffCalculator} - 재시도 대기 시간 계산</li>
 *   <li>{@link com.ryuqq.parallel.adapter.runner.ErrorNormalizer} - 실패 값 → TaskError</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (LevelBarrierExecutor)
 *   ↓ implements
 * application (ParallelExecutor, VariableResolver)
 *   ↓ depends on
 * core (Task, TaskResult, DagBuilder, ToolInvoker SPI)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.parallel.adapter.runner;

/**
 * Task 모델 - 요청 입력과 실행 결과.
 *
 * <h2>입력</h2>
 * <ul>
 *   <li>{@link com.ryuqq.parallel.core.model.Task} - 단위 작업 (Tool + 파라미터 + 의존성)</li>
 *   <li>{@link com.ryuqq.parallel.core.model.RetryPolicy} - 재시도 정책</li>
 * </ul>
 *
 * <h2>결과</h2>
 * <ul>
 *   <li>{@link com.ryuqq.parallel.core.model.TaskResult} - Task별 종료 결과</li>
 *   <li>{@link com.ryuqq.parallel.core.model.TaskError} - 정규화된 오류</li>
 *   <li>{@link com.ryuqq.parallel.core.model.ResultLedger} - append-only 결과 저장소</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.parallel.core.model;

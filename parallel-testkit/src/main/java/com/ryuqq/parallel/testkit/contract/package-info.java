/**
 * Contract Test infrastructure for the parallel execution engine.
 *
 * <p>{@link com.ryuqq.parallel.testkit.contract.AbstractContractTest} runs real requests through
 * {@link com.ryuqq.parallel.adapter.runner.LevelBarrierExecutor} against scripted tools
 * ({@link com.ryuqq.parallel.testkit.contract.ScriptedTools}) and records listener callbacks
 * ({@link com.ryuqq.parallel.testkit.contract.RecordingExecutionListener}).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.parallel.testkit.contract;

package com.ryuqq.parallel.testkit.contract;

import com.ryuqq.parallel.adapter.runner.RunnerConfig;
import com.ryuqq.parallel.application.execution.ExecutionConfig;
import com.ryuqq.parallel.application.execution.ExecutionReport;
import com.ryuqq.parallel.core.model.BackoffStrategy;
import com.ryuqq.parallel.core.model.RetryPolicy;
import com.ryuqq.parallel.core.model.Task;
import com.ryuqq.parallel.core.model.TaskResult;
import com.ryuqq.parallel.core.model.TaskStatus;
import com.ryuqq.parallel.core.value.Value;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: per-task retry and timeout.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Transient failures recover within maxAttempts</li>
 *   <li>Exhausted retries report the last error</li>
 *   <li>Timeouts fail the task with TASK_TIMEOUT and apply to every attempt</li>
 *   <li>Engine-wide defaults apply when a task sets nothing</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RetryTimeoutContractTest extends AbstractContractTest {

    @Test
    void testRetry_TransientFailureRecovers() {
        // Given
        ScriptedTools.FlakyTool flaky = new ScriptedTools.FlakyTool(2, "recovered");
        registry.register("flaky", flaky);
        Task task = Task.builder("A", "flaky")
            .retryPolicy(new RetryPolicy(3, BackoffStrategy.EXPONENTIAL, 10))
            .build();

        // When
        ExecutionReport report = execute(new ExecutionConfig(), task);

        // Then
        TaskResult result = assertTaskStatus(report, "A", TaskStatus.SUCCESS);
        assertEquals(Value.of("recovered"), result.result());
        assertEquals(3, flaky.attempts());
        assertTrue(result.durationMs() >= 30, "Backoff of 10ms + 20ms should be included in duration");
    }

    @Test
    void testRetry_ExhaustedReportsLastError() {
        ScriptedTools.FlakyTool flaky = new ScriptedTools.FlakyTool(5, "never");
        registry.register("flaky", flaky);
        Task task = Task.builder("A", "flaky")
            .retryPolicy(new RetryPolicy(2, BackoffStrategy.LINEAR, 5))
            .build();

        ExecutionReport report = execute(new ExecutionConfig(), task);

        TaskResult result = assertTaskStatus(report, "A", TaskStatus.FAILED);
        assertEquals("attempt 2 failed", result.error().message());
        assertEquals("IllegalStateException", result.error().code());
        assertEquals(2, flaky.attempts());
    }

    @Test
    void testRetry_DefaultPolicyRunsOnce() {
        ScriptedTools.FlakyTool flaky = new ScriptedTools.FlakyTool(1, "second");
        registry.register("flaky", flaky);

        ExecutionReport report = execute(new ExecutionConfig(), task("A", "flaky"));

        assertTaskStatus(report, "A", TaskStatus.FAILED);
        assertEquals(1, flaky.attempts());
    }

    @Test
    void testTimeout_TaskFailsWithTimeoutCode() {
        // Given
        registry.register("hang", ScriptedTools.never());
        Task task = Task.builder("A", "hang").timeoutMs(100).build();

        // When
        ExecutionReport report = execute(new ExecutionConfig(), task);

        // Then
        TaskResult result = assertTaskStatus(report, "A", TaskStatus.FAILED);
        assertEquals("TASK_TIMEOUT", result.error().code());
        assertEquals("Task A exceeded timeout of 100ms", result.error().message());
        assertTrue(result.durationMs() >= 100);
    }

    @Test
    void testTimeout_AppliesToEachRetryAttempt() {
        // Given: every attempt hangs
        ScriptedTools.FlakyTool counter = new ScriptedTools.FlakyTool(0, "unused");
        registry.register("hang", params -> {
            counter.invoke(params);
            return new CompletableFuture<>();
        });
        Task task = Task.builder("A", "hang")
            .timeoutMs(50)
            .retryPolicy(new RetryPolicy(3, BackoffStrategy.LINEAR, 0))
            .build();

        // When
        ExecutionReport report = execute(new ExecutionConfig(), task);

        // Then
        TaskResult result = assertTaskStatus(report, "A", TaskStatus.FAILED);
        assertEquals("TASK_TIMEOUT", result.error().code());
        assertEquals(3, counter.attempts());
    }

    @Test
    void testTimeout_EngineDefaultApplies() {
        registry.register("hang", ScriptedTools.never());
        RunnerConfig runnerConfig = new RunnerConfig().withDefaultTaskTimeoutMs(80);

        ExecutionReport report = execute(runnerConfig, new ExecutionConfig(), List.of(task("A", "hang")));

        TaskResult result = assertTaskStatus(report, "A", TaskStatus.FAILED);
        assertEquals("Task A exceeded timeout of 80ms", result.error().message());
    }

    @Test
    void testTimeout_FastTaskUnaffected() {
        registry.register("fast", ScriptedTools.delayed(10, "ok"));
        Task task = Task.builder("A", "fast").timeoutMs(1000).build();

        ExecutionReport report = execute(new ExecutionConfig(), task);

        assertTaskStatus(report, "A", TaskStatus.SUCCESS);
    }
}

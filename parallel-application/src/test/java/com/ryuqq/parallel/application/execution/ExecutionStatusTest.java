package com.ryuqq.parallel.application.execution;

import com.ryuqq.parallel.core.model.TaskError;
import com.ryuqq.parallel.core.model.TaskResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExecutionStatus / ExecutionSummary 집계 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ExecutionStatusTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private static TaskResult ok(String id) {
        return TaskResult.success(id, null, NOW, NOW);
    }

    private static TaskResult failed(String id) {
        return TaskResult.failed(id, TaskError.of("E", "boom"), NOW, NOW);
    }

    private static TaskResult skipped(String id) {
        return TaskResult.skipped(id, "dependency failed", NOW);
    }

    @Test
    void from_AllSucceeded_ReturnsSuccess() {
        assertEquals(ExecutionStatus.SUCCESS, ExecutionStatus.from(List.of(ok("A"), ok("B"))));
    }

    @Test
    void from_MixedResults_ReturnsPartial() {
        assertEquals(ExecutionStatus.PARTIAL, ExecutionStatus.from(List.of(ok("A"), failed("B"), skipped("C"))));
        assertEquals(ExecutionStatus.PARTIAL, ExecutionStatus.from(List.of(ok("A"), skipped("B"))));
    }

    @Test
    void from_NoSuccess_ReturnsFailure() {
        assertEquals(ExecutionStatus.FAILURE, ExecutionStatus.from(List.of(failed("A"), skipped("B"))));
        assertEquals(ExecutionStatus.FAILURE, ExecutionStatus.from(List.of(skipped("A"))));
    }

    @Test
    void summary_CountsEachStatus() {
        ExecutionSummary summary = ExecutionSummary.of(List.of(ok("A"), failed("B"), skipped("C"), skipped("D")));

        assertEquals(new ExecutionSummary(4, 1, 1, 2), summary);
    }

    @Test
    void summary_InconsistentCounts_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new ExecutionSummary(3, 1, 1, 0));
    }
}

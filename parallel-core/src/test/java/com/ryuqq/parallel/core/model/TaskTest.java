package com.ryuqq.parallel.core.model;

import com.ryuqq.parallel.core.value.MapValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Task 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskTest {

    @Test
    void of_MinimalTask_UsesDefaults() {
        // When
        Task task = Task.of("A", "http_get", null);

        // Then
        assertTrue(task.params().isEmpty());
        assertTrue(task.dependsOn().isEmpty());
        assertEquals(Task.DEFAULT_PRIORITY, task.effectivePriority());
        assertTrue(task.timeout().isEmpty());
        assertTrue(task.retry().isEmpty());
    }

    @Test
    void builder_AllFields_AreKept() {
        // Given
        RetryPolicy policy = new RetryPolicy(3, BackoffStrategy.LINEAR, 100);

        // When
        Task task = Task.builder("B", "transform")
            .params(MapValue.from(Map.of("mode", "fast")))
            .dependsOn("A", "C", "A")
            .priority(9)
            .timeoutMs(500)
            .retryPolicy(policy)
            .build();

        // Then
        assertEquals(List.of("A", "C"), List.copyOf(task.dependsOn()));
        assertEquals(9, task.effectivePriority());
        assertEquals(500L, task.timeout().orElseThrow());
        assertSame(policy, task.retry().orElseThrow());
    }

    @Test
    void constructor_BlankId_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Task.of(" ", "tool", null));
        assertThrows(IllegalArgumentException.class, () -> Task.of(null, "tool", null));
    }

    @Test
    void constructor_BlankTool_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Task.of("A", "", null)
        );
        assertTrue(exception.getMessage().contains("task: A"));
    }

    @Test
    void constructor_PriorityOutOfRange_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Task.builder("A", "t").priority(0).build());
        assertThrows(IllegalArgumentException.class, () -> Task.builder("A", "t").priority(11).build());
        assertDoesNotThrow(() -> Task.builder("A", "t").priority(1).build());
        assertDoesNotThrow(() -> Task.builder("A", "t").priority(10).build());
    }

    @Test
    void constructor_NonPositiveTimeout_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Task.builder("A", "t").timeoutMs(0).build());
    }

    @Test
    void dependsOn_IsUnmodifiable() {
        Task task = Task.builder("B", "t").dependsOn("A").build();

        assertThrows(UnsupportedOperationException.class, () -> task.dependsOn().add("X"));
    }
}

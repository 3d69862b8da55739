package com.ryuqq.parallel.core.model;

import com.ryuqq.parallel.core.value.MapValue;
import com.ryuqq.parallel.core.value.NullValue;
import com.ryuqq.parallel.core.value.StringValue;
import com.ryuqq.parallel.core.value.Value;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskResult 테스트.
 *
 * <p>상태별 필드 규칙과 Value 표현을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskResultTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-01-01T00:00:01.250Z");

    @Test
    void success_ComputesDuration() {
        // When
        TaskResult result = TaskResult.success("A", Value.of(Map.of("userId", 1)), START, END);

        // Then
        assertTrue(result.isSuccess());
        assertEquals(1250, result.durationMs());
        assertNull(result.error());
        assertTrue(result.resultValue().isPresent());
    }

    @Test
    void success_NullResult_BecomesNullValue() {
        TaskResult result = TaskResult.success("A", null, START, END);

        assertSame(NullValue.INSTANCE, result.result());
    }

    @Test
    void failed_RequiresError() {
        assertThrows(IllegalArgumentException.class, () -> TaskResult.failed("A", null, START, END));
    }

    @Test
    void constructor_ResultOnFailed_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new TaskResult(
            "A", TaskStatus.FAILED, 0, NullValue.INSTANCE, TaskError.of("E", "m"), null, START, END));
    }

    @Test
    void constructor_SkipReasonOnSuccess_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new TaskResult(
            "A", TaskStatus.SUCCESS, 0, NullValue.INSTANCE, null, "why", START, END));
    }

    @Test
    void skipped_HasZeroDuration() {
        TaskResult result = TaskResult.skipped("C", "dependency B failed", START);

        assertEquals(TaskStatus.SKIPPED, result.status());
        assertEquals(0, result.durationMs());
        assertFalse(result.status().wasAttempted());
        assertEquals(START, result.endTime());
    }

    @Test
    void asValue_Success_ExposesResultField() {
        // Given
        TaskResult result = TaskResult.success("A", Value.of(Map.of("userId", 123)), START, END);

        // When
        MapValue value = result.asValue();

        // Then
        assertEquals(new StringValue("success"), value.get("status").orElseThrow());
        MapValue inner = (MapValue) value.get("result").orElseThrow();
        assertEquals(Value.of(123), inner.get("userId").orElseThrow());
        assertFalse(value.containsKey("error"));
        assertEquals(new StringValue("2024-01-01T00:00:00Z"), value.get("startTime").orElseThrow());
    }

    @Test
    void asValue_Failed_ExposesErrorWithoutStack() {
        TaskResult result = TaskResult.failed("B", TaskError.of("HTTP_ERROR", "503"), START, END);

        MapValue error = (MapValue) result.asValue().get("error").orElseThrow();

        assertEquals(List.of("code", "message"), List.copyOf(error.entries().keySet()));
        assertFalse(result.asValue().containsKey("result"));
    }

    @Test
    void taskError_NullMessage_BecomesEmpty() {
        assertEquals("", TaskError.of("X", null).message());
        assertThrows(IllegalArgumentException.class, () -> TaskError.of(" ", "m"));
    }
}

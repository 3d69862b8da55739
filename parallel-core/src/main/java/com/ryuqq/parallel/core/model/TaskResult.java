package com.ryuqq.parallel.core.model;

import com.ryuqq.parallel.core.value.MapValue;
import com.ryuqq.parallel.core.value.NumberValue;
import com.ryuqq.parallel.core.value.StringValue;
import com.ryuqq.parallel.core.value.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 단일 Task의 실행 결과.
 *
 * <p><strong>상태별 필드 규칙:</strong></p>
 * <ul>
 *   <li>SUCCESS: result 존재 (NullValue 가능), error/skipReason 없음</li>
 *   <li>FAILED: error 존재, result/skipReason 없음</li>
 *   <li>SKIPPED: skipReason 존재, result/error 없음</li>
 * </ul>
 *
 * <p>상태별 팩토리 메서드 ({@link #success}, {@link #failed}, {@link #skipped})로만
 * 생성하는 것을 권장합니다.</p>
 *
 * @param taskId Task ID
 * @param status 종료 상태
 * @param durationMs 실행 시간 (밀리초)
 * @param result Tool 결과 (SUCCESS일 때만)
 * @param error 오류 정보 (FAILED일 때만)
 * @param skipReason 건너뛴 이유 (SKIPPED일 때만)
 * @param startTime 시작 시각
 * @param endTime 종료 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskResult(
    String taskId,
    TaskStatus status,
    long durationMs,
    Value result,
    TaskError error,
    String skipReason,
    Instant startTime,
    Instant endTime
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 상태별 필드 규칙을 위반한 경우
     */
    public TaskResult {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (startTime == null || endTime == null) {
            throw new IllegalArgumentException("startTime and endTime cannot be null (task: " + taskId + ")");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be non-negative (current: " + durationMs + ")");
        }
        if (status == TaskStatus.SUCCESS && result == null) {
            throw new IllegalArgumentException("result is required for SUCCESS (task: " + taskId + ")");
        }
        if (status != TaskStatus.SUCCESS && result != null) {
            throw new IllegalArgumentException("result is only allowed for SUCCESS (task: " + taskId + ")");
        }
        if (status == TaskStatus.FAILED && error == null) {
            throw new IllegalArgumentException("error is required for FAILED (task: " + taskId + ")");
        }
        if (status != TaskStatus.FAILED && error != null) {
            throw new IllegalArgumentException("error is only allowed for FAILED (task: " + taskId + ")");
        }
        if (status != TaskStatus.SKIPPED && skipReason != null) {
            throw new IllegalArgumentException("skipReason is only allowed for SKIPPED (task: " + taskId + ")");
        }
    }

    /**
     * 성공 결과 생성.
     *
     * @param taskId Task ID
     * @param result Tool 결과 (null이면 NullValue)
     * @param startTime 시작 시각
     * @param endTime 종료 시각
     * @return TaskResult 인스턴스
     */
    public static TaskResult success(String taskId, Value result, Instant startTime, Instant endTime) {
        return new TaskResult(taskId, TaskStatus.SUCCESS, millisBetween(startTime, endTime),
            result == null ? Value.of(null) : result, null, null, startTime, endTime);
    }

    /**
     * 실패 결과 생성.
     *
     * @param taskId Task ID
     * @param error 정규화된 오류
     * @param startTime 시작 시각
     * @param endTime 종료 시각
     * @return TaskResult 인스턴스
     */
    public static TaskResult failed(String taskId, TaskError error, Instant startTime, Instant endTime) {
        return new TaskResult(taskId, TaskStatus.FAILED, millisBetween(startTime, endTime),
            null, error, null, startTime, endTime);
    }

    /**
     * 건너뜀 결과 생성 (실행 시간 0).
     *
     * @param taskId Task ID
     * @param reason 건너뛴 이유
     * @param at 기록 시각
     * @return TaskResult 인스턴스
     */
    public static TaskResult skipped(String taskId, String reason, Instant at) {
        return new TaskResult(taskId, TaskStatus.SKIPPED, 0, null, null, reason, at, at);
    }

    /**
     * 성공 여부.
     *
     * @return SUCCESS인 경우 true
     */
    public boolean isSuccess() {
        return status == TaskStatus.SUCCESS;
    }

    /**
     * Tool 결과 조회.
     *
     * @return SUCCESS인 경우 결과
     */
    public Optional<Value> resultValue() {
        return Optional.ofNullable(result);
    }

    /**
     * 변수 경로 탐색용 필드 뷰.
     *
     * <p>{@code ${taskId.result.userId}}의 {@code result.userId} 부분은
     * 이 MapValue를 기준으로 탐색됩니다. 값이 없는 필드(result, error, skipReason)는
     * 키 자체가 포함되지 않습니다.</p>
     *
     * @return taskId, status, duration, result?, error?, skipReason?, startTime, endTime
     */
    public MapValue asValue() {
        Map<String, Value> fields = new LinkedHashMap<>();
        fields.put("taskId", new StringValue(taskId));
        fields.put("status", new StringValue(status.name().toLowerCase(Locale.ROOT)));
        fields.put("duration", NumberValue.of(durationMs));
        if (result != null) {
            fields.put("result", result);
        }
        if (error != null) {
            Map<String, Value> errorFields = new LinkedHashMap<>();
            errorFields.put("code", new StringValue(error.code()));
            errorFields.put("message", new StringValue(error.message()));
            if (error.stack() != null) {
                errorFields.put("stack", new StringValue(error.stack()));
            }
            fields.put("error", new MapValue(errorFields));
        }
        if (skipReason != null) {
            fields.put("skipReason", new StringValue(skipReason));
        }
        fields.put("startTime", new StringValue(startTime.toString()));
        fields.put("endTime", new StringValue(endTime.toString()));
        return new MapValue(fields);
    }

    private static long millisBetween(Instant start, Instant end) {
        if (start == null || end == null) {
            return 0;
        }
        return Math.max(0, Duration.between(start, end).toMillis());
    }
}

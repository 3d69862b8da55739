package com.ryuqq.parallel.application.execution;

import com.ryuqq.parallel.core.model.TaskResult;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 실행 결과 보고서.
 *
 * <p>tasks는 제출 순서를 유지하며, 제출된 모든 Task가 정확히 한 번씩 포함됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param executionId 실행 ID (UUID)
 * @param status 전체 상태
 * @param startTime 시작 시각
 * @param endTime 종료 시각
 * @param durationMs 소요 시간 (밀리초)
 * @param tasks Task ID → 결과 (제출 순서)
 * @param summary 상태별 개수
 * @param dag DAG 진단 정보
 */
public record ExecutionReport(
    String executionId,
    ExecutionStatus status,
    Instant startTime,
    Instant endTime,
    long durationMs,
    Map<String, TaskResult> tasks,
    ExecutionSummary summary,
    DagInfo dag
) {

    public ExecutionReport {
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId cannot be null or blank");
        }
        if (status == null || summary == null || dag == null) {
            throw new IllegalArgumentException("status, summary and dag cannot be null");
        }
        if (startTime == null || endTime == null) {
            throw new IllegalArgumentException("startTime and endTime cannot be null");
        }
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        tasks = Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
    }

    /**
     * Task 결과 조회.
     *
     * @param taskId Task ID
     * @return 결과 (없으면 empty)
     */
    public Optional<TaskResult> task(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }
}

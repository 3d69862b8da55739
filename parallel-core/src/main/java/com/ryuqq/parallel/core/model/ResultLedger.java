package com.ryuqq.parallel.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 실행 요청 하나의 Task 결과 누적 저장소 (append-only).
 *
 * <p>Orchestrator 호출 하나가 소유하며 요청 간에 공유되지 않습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>Task당 결과는 정확히 한 번만 기록됩니다</li>
 *   <li>기록된 결과는 덮어쓰거나 삭제할 수 없습니다</li>
 * </ul>
 *
 * <p>실행 중인 Task는 레벨 barrier 덕분에 이미 종료된 선행 Task 결과만 읽습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResultLedger {

    private final Map<String, TaskResult> results = new ConcurrentHashMap<>();

    /**
     * 결과 기록.
     *
     * @param result Task 결과
     * @throws IllegalArgumentException result가 null인 경우
     * @throws IllegalStateException 같은 Task의 결과가 이미 기록된 경우
     */
    public void record(TaskResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        TaskResult existing = results.putIfAbsent(result.taskId(), result);
        if (existing != null) {
            throw new IllegalStateException(String.format(
                "Result already recorded for task %s (existing: %s, attempted: %s)",
                result.taskId(), existing.status(), result.status()));
        }
    }

    /**
     * 아직 기록되지 않은 경우에만 결과 기록.
     *
     * <p>중단 처리처럼 같은 Task에 대해 두 경로가 경합할 수 있는 곳에서 사용합니다.
     * 먼저 도착한 결과가 유지됩니다.</p>
     *
     * @param result Task 결과
     * @return 기록된 경우 true, 이미 결과가 있는 경우 false
     * @throws IllegalArgumentException result가 null인 경우
     */
    public boolean tryRecord(TaskResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        return results.putIfAbsent(result.taskId(), result) == null;
    }

    /**
     * 결과 조회.
     *
     * @param taskId Task ID
     * @return 기록된 결과
     */
    public Optional<TaskResult> get(String taskId) {
        return Optional.ofNullable(results.get(taskId));
    }

    /**
     * 기록 여부.
     *
     * @param taskId Task ID
     * @return 결과가 있으면 true
     */
    public boolean contains(String taskId) {
        return results.containsKey(taskId);
    }

    /**
     * 읽기 전용 뷰.
     *
     * @return Task ID → 결과 (불변 뷰)
     */
    public Map<String, TaskResult> view() {
        return Collections.unmodifiableMap(results);
    }

    public int size() {
        return results.size();
    }
}

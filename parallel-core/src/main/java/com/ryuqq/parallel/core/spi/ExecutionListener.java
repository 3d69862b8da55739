package com.ryuqq.parallel.core.spi;

import com.ryuqq.parallel.core.model.TaskResult;

import java.util.Collection;
import java.util.List;

/**
 * 실행 진행 상황 Hook SPI.
 *
 * <p>진행률 표시, 메트릭 수집, 감사 로그 등에 사용합니다.
 * 모든 메서드는 기본 구현이 비어 있으므로 필요한 것만 재정의하면 됩니다.</p>
 *
 * <p><strong>주의:</strong></p>
 * <ul>
 *   <li>onTaskStarted / onTaskCompleted는 워커 스레드에서 동시에 호출될 수 있습니다</li>
 *   <li>Listener에서 발생한 예외는 로그로 남기고 무시되며, 실행 결과에 영향을 주지 않습니다</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ExecutionListener {

    /**
     * 검증 통과 후 실행 시작.
     *
     * @param executionId 실행 ID
     * @param taskCount 전체 Task 수
     * @param levelCount 레벨 수
     */
    default void onExecutionStarted(String executionId, int taskCount, int levelCount) {
    }

    /**
     * 레벨 시작.
     *
     * @param executionId 실행 ID
     * @param level 레벨 번호 (0부터)
     * @param taskIds 레벨에 속한 Task ID
     */
    default void onLevelStarted(String executionId, int level, List<String> taskIds) {
    }

    /**
     * Task 실행 시작 (변수 해석 직전).
     *
     * @param executionId 실행 ID
     * @param taskId Task ID
     */
    default void onTaskStarted(String executionId, String taskId) {
    }

    /**
     * Task 결과 기록 (SUCCESS, FAILED, SKIPPED 모두).
     *
     * @param executionId 실행 ID
     * @param result 기록된 결과
     */
    default void onTaskCompleted(String executionId, TaskResult result) {
    }

    /**
     * 실행 종료.
     *
     * @param executionId 실행 ID
     * @param results 전체 Task 결과
     */
    default void onExecutionCompleted(String executionId, Collection<TaskResult> results) {
    }
}

package com.ryuqq.parallel.application.execution;

import com.ryuqq.parallel.core.model.TaskResult;
import com.ryuqq.parallel.core.model.TaskStatus;

import java.util.Collection;

/**
 * 실행 전체 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ExecutionStatus {

    SUCCESS,

    PARTIAL,

    FAILURE;

    /**
     * Task 결과로부터 전체 상태 도출.
     *
     * <ul>
     *   <li>모든 Task 성공 → SUCCESS</li>
     *   <li>성공 0건이면서 실패가 있거나, 시도된 Task가 없음 → FAILURE</li>
     *   <li>그 외 → PARTIAL</li>
     * </ul>
     *
     * @param results Task 결과 목록
     * @return 전체 상태
     */
    public static ExecutionStatus from(Collection<TaskResult> results) {
        int succeeded = 0;
        int failed = 0;
        for (TaskResult result : results) {
            if (result.status() == TaskStatus.SUCCESS) {
                succeeded++;
            } else if (result.status() == TaskStatus.FAILED) {
                failed++;
            }
        }

        if (!results.isEmpty() && succeeded == results.size()) {
            return SUCCESS;
        }
        if (succeeded == 0) {
            return FAILURE;
        }
        return PARTIAL;
    }
}

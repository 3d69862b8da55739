package com.ryuqq.parallel.application.execution;

import com.ryuqq.parallel.core.model.TaskResult;

import java.util.Collection;

/**
 * 상태별 Task 개수 요약.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param total 전체 Task 수
 * @param succeeded 성공 수
 * @param failed 실패 수
 * @param skipped 건너뛴 수
 */
public record ExecutionSummary(int total, int succeeded, int failed, int skipped) {

    public ExecutionSummary {
        if (succeeded + failed + skipped != total) {
            throw new IllegalArgumentException(String.format(
                "summary counts must add up to total (total: %d, succeeded: %d, failed: %d, skipped: %d)",
                total, succeeded, failed, skipped));
        }
    }

    /**
     * Task 결과 집계.
     *
     * @param results Task 결과 목록
     * @return 요약
     */
    public static ExecutionSummary of(Collection<TaskResult> results) {
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        for (TaskResult result : results) {
            switch (result.status()) {
                case SUCCESS -> succeeded++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }
        return new ExecutionSummary(results.size(), succeeded, failed, skipped);
    }
}

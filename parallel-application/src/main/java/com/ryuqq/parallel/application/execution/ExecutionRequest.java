package com.ryuqq.parallel.application.execution;

import com.ryuqq.parallel.core.model.Task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 실행 요청.
 *
 * <p>tasks의 유효성(비어 있지 않음, null 원소, 의존성 그래프)은 실행기가 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param tasks 제출된 Task 목록 (제출 순서 유지)
 * @param config 실행 설정 (null이면 기본값)
 */
public record ExecutionRequest(List<Task> tasks, ExecutionConfig config) {

    public ExecutionRequest {
        tasks = tasks == null ? null : Collections.unmodifiableList(new ArrayList<>(tasks));
        config = config == null ? new ExecutionConfig() : config;
    }

    /**
     * 기본 설정으로 요청 생성.
     *
     * @param tasks Task 목록
     * @return ExecutionRequest
     */
    public static ExecutionRequest of(List<Task> tasks) {
        return new ExecutionRequest(tasks, null);
    }
}

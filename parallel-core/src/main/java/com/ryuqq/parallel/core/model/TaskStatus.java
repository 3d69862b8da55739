package com.ryuqq.parallel.core.model;

/**
 * Task 실행 결과 상태.
 *
 * <p>세 상태 모두 종료 상태(terminal)이며, TaskResult에 한 번 기록되면 변경되지 않습니다.</p>
 *
 * <ul>
 *   <li>SUCCESS: Tool 호출 성공</li>
 *   <li>FAILED: 변수 해석 실패, 타임아웃, Tool 오류 (재시도 소진 후)</li>
 *   <li>SKIPPED: 시도하지 않음 (선행 Task 실패, STOP 모드, 전체 타임아웃)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TaskStatus {

    SUCCESS,

    FAILED,

    SKIPPED;

    /**
     * 실제로 실행을 시도했는지 확인.
     *
     * @return SUCCESS 또는 FAILED인 경우 true
     */
    public boolean wasAttempted() {
        return this != SKIPPED;
    }
}

package com.ryuqq.parallel.application.execution;

/**
 * Task 실패 시 실행 정책.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailureMode {

    /**
     * 실패한 Task에 (전이적으로) 의존하는 Task만 건너뛰고 나머지 분기는 계속 실행.
     */
    CONTINUE,

    /**
     * 첫 실패 이후 아직 시작하지 않은 모든 Task를 건너뜀.
     * 이미 실행 중인 Task는 끝까지 실행되고 기록됩니다.
     */
    STOP,

    /**
     * STOP과 동일하게 동작합니다. 보상(compensation) 모델이 없으므로
     * 성공한 Task는 되돌려지지 않으며 경고 로그만 남습니다.
     */
    ROLLBACK;

    /**
     * 첫 실패 이후 신규 Task 시작을 중단하는 모드인지 확인.
     *
     * @return STOP 또는 ROLLBACK인 경우 true
     */
    public boolean haltsOnFailure() {
        return this != CONTINUE;
    }
}

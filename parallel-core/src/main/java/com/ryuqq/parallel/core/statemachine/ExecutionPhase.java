package com.ryuqq.parallel.core.statemachine;

/**
 * 실행 요청 단위의 생명주기 단계.
 *
 * <pre>
 * VALIDATING
 *    │
 *    ▼ (검증 통과)
 * RUNNING   (레벨 0 → 1 → ... 순차 진행)
 *    │
 *    ▼ (모든 레벨 종료)
 * COMPLETED
 * </pre>
 *
 * <p>VALIDATING에서 검증이 실패하면 요청은 예외와 함께 거부되며 COMPLETED에 도달하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ExecutionPhase {

    /**
     * 그래프 구성 및 검증 중.
     */
    VALIDATING,

    /**
     * 레벨 단위 실행 중.
     */
    RUNNING,

    /**
     * 보고서 생성 완료.
     */
    COMPLETED;

    /**
     * 종료 단계인지 확인.
     *
     * @return COMPLETED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED;
    }
}

package com.ryuqq.parallel.core.statemachine;

/**
 * 실행 단계 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>VALIDATING → RUNNING</li>
 *   <li>RUNNING → COMPLETED</li>
 * </ul>
 *
 * <p>종료 단계에서의 전이, 역방향 전이, 단계 건너뛰기는 모두 거부됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PhaseTransition {

    // Utility class - prevent instantiation
    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 유효성 검증.
     *
     * @param from 현재 단계
     * @param to 다음 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ExecutionPhase from, ExecutionPhase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case VALIDATING -> to == ExecutionPhase.RUNNING;
            case RUNNING -> to == ExecutionPhase.COMPLETED;
            case COMPLETED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid phase transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return next
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static ExecutionPhase transition(ExecutionPhase current, ExecutionPhase next) {
        validate(current, next);
        return next;
    }
}

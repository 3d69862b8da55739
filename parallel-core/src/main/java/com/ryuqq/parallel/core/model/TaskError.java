package com.ryuqq.parallel.core.model;

/**
 * 정규화된 Task 오류 정보.
 *
 * @param code 오류 코드 (예: TASK_TIMEOUT, IllegalStateException)
 * @param message 오류 메시지
 * @param stack 스택 트레이스 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskError(
    String code,
    String message,
    String stack
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code가 null이거나 빈 문자열인 경우
     */
    public TaskError {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        message = message == null ? "" : message;
        // stack은 null 허용
    }

    /**
     * 스택 없이 생성.
     *
     * @param code 오류 코드
     * @param message 오류 메시지
     * @return TaskError 인스턴스
     */
    public static TaskError of(String code, String message) {
        return new TaskError(code, message, null);
    }
}

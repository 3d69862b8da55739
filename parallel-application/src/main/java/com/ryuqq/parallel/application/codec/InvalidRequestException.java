package com.ryuqq.parallel.application.codec;

/**
 * JSON 실행 요청의 형태가 올바르지 않을 때 발생하는 예외.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InvalidRequestException extends RuntimeException {

    private final String field;

    /**
     * 생성자.
     *
     * @param field 문제가 된 필드 경로 (예: {@code tasks[1].tool})
     * @param message 상세 메시지
     */
    public InvalidRequestException(String field, String message) {
        super("Invalid request at " + field + ": " + message);
        this.field = field;
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param field 문제가 된 필드 경로
     * @param message 상세 메시지
     * @param cause 원인
     */
    public InvalidRequestException(String field, String message, Throwable cause) {
        super("Invalid request at " + field + ": " + message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}

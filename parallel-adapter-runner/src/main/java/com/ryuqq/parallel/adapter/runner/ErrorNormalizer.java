package com.ryuqq.parallel.adapter.runner;

import com.ryuqq.parallel.core.error.CodedError;
import com.ryuqq.parallel.core.model.TaskError;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 임의의 실패 값을 {@link TaskError}로 정규화.
 *
 * <p><strong>매핑 규칙:</strong></p>
 * <ul>
 *   <li>CompletionException / ExecutionException → 원인(cause)으로 풀어서 처리</li>
 *   <li>{@link CodedError}를 구현한 Throwable → {errorCode(), message, stack}</li>
 *   <li>그 외 Throwable → {단순 클래스명, message, stack}</li>
 *   <li>String → {ERROR, 문자열}</li>
 *   <li>code 또는 name, message 키를 가진 Map → 그대로 사용</li>
 *   <li>그 외 → {UNKNOWN_ERROR, String.valueOf(raw)}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ErrorNormalizer {

    public static final String GENERIC_CODE = "ERROR";
    public static final String UNKNOWN_CODE = "UNKNOWN_ERROR";

    // Utility class - prevent instantiation
    private ErrorNormalizer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 실패 값 정규화.
     *
     * @param raw 실패 값 (null 허용)
     * @return TaskError
     */
    public static TaskError normalize(Object raw) {
        if (raw instanceof Throwable throwable) {
            Throwable cause = unwrap(throwable);
            String code = cause instanceof CodedError coded
                ? coded.errorCode()
                : cause.getClass().getSimpleName();
            return new TaskError(
                code == null || code.isBlank() ? UNKNOWN_CODE : code,
                cause.getMessage() == null ? cause.toString() : cause.getMessage(),
                stackTraceOf(cause)
            );
        }
        if (raw instanceof String text) {
            return TaskError.of(GENERIC_CODE, text);
        }
        if (raw instanceof Map<?, ?> map) {
            Object code = map.get("code") != null ? map.get("code") : map.get("name");
            Object message = map.get("message");
            if (code != null || message != null) {
                return TaskError.of(
                    code == null || String.valueOf(code).isBlank() ? UNKNOWN_CODE : String.valueOf(code),
                    message == null ? String.valueOf(raw) : String.valueOf(message)
                );
            }
        }
        return TaskError.of(UNKNOWN_CODE, String.valueOf(raw));
    }

    /**
     * 비동기 래퍼 예외 제거.
     *
     * @param throwable 예외
     * @return 가장 안쪽의 실제 원인
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String stackTraceOf(Throwable throwable) {
        StringWriter buffer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(buffer));
        return buffer.toString();
    }
}

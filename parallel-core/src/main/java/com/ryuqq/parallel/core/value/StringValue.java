package com.ryuqq.parallel.core.value;

/**
 * 문자열 값.
 *
 * <p>Task 파라미터의 문자열은 {@code ${taskId.path}} 형태의 변수 참조를 포함할 수 있습니다.</p>
 *
 * @param value 문자열 (null 불가)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StringValue(String value) implements Value {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public StringValue {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null (use NullValue)");
        }
    }

    @Override
    public Object toJava() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}

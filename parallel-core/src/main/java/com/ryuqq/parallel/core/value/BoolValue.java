package com.ryuqq.parallel.core.value;

/**
 * 불리언 값.
 *
 * @param value 값
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record BoolValue(boolean value) implements Value {

    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    /**
     * BoolValue 조회.
     *
     * @param value 값
     * @return 공유 인스턴스
     */
    public static BoolValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public Object toJava() {
        return value;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}

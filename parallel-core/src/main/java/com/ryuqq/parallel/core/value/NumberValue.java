package com.ryuqq.parallel.core.value;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 숫자 값.
 *
 * <p>내부적으로 {@link BigDecimal}을 사용하며, 생성 시 trailing zero를 제거하여
 * {@code 123}과 {@code 123.0}이 동일하게 비교되도록 정규화합니다.</p>
 *
 * @param value 정규화된 숫자
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record NumberValue(BigDecimal value) implements Value {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public NumberValue {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }

    /**
     * 임의의 Number로부터 생성.
     *
     * @param number 숫자
     * @return NumberValue 인스턴스
     * @throws IllegalArgumentException NaN 또는 무한대인 경우
     */
    public static NumberValue of(Number number) {
        if (number instanceof BigDecimal decimal) {
            return new NumberValue(decimal);
        }
        if (number instanceof BigInteger integer) {
            return new NumberValue(new BigDecimal(integer));
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Non-finite numbers are not supported (current: " + d + ")");
            }
            return new NumberValue(BigDecimal.valueOf(d));
        }
        return new NumberValue(BigDecimal.valueOf(number.longValue()));
    }

    /**
     * 정수 변환 (소수부 버림).
     *
     * @return long 값
     */
    public long longValue() {
        return value.longValue();
    }

    /**
     * 텍스트 표현 (지수 표기 없이).
     *
     * @return 예: "123", "1.5"
     */
    public String toPlainString() {
        return value.toPlainString();
    }

    @Override
    public Object toJava() {
        return value;
    }

    @Override
    public String toString() {
        return toPlainString();
    }
}

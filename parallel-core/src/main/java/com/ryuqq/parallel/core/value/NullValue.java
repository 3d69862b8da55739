package com.ryuqq.parallel.core.value;

/**
 * null 값 (싱글톤).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum NullValue implements Value {

    INSTANCE;

    @Override
    public Object toJava() {
        return null;
    }

    @Override
    public String toString() {
        return "null";
    }
}

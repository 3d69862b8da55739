package com.ryuqq.parallel.core.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 순서 있는 값 시퀀스 (불변).
 *
 * @param items 원소 목록
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ListValue(List<Value> items) implements Value {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException items가 null이거나 null 원소를 포함하는 경우
     */
    public ListValue {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        for (Value item : items) {
            if (item == null) {
                throw new IllegalArgumentException("items cannot contain null (use NullValue)");
            }
        }
        items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    /**
     * 원소 목록으로 생성.
     *
     * @param items 원소
     * @return ListValue 인스턴스
     */
    public static ListValue of(Value... items) {
        return new ListValue(List.of(items));
    }

    /**
     * 원소 수.
     *
     * @return 크기
     */
    public int size() {
        return items.size();
    }

    /**
     * 인덱스로 원소 조회.
     *
     * @param index 인덱스
     * @return 원소
     * @throws IndexOutOfBoundsException 범위를 벗어난 경우
     */
    public Value get(int index) {
        return items.get(index);
    }

    @Override
    public Object toJava() {
        List<Object> list = new ArrayList<>(items.size());
        for (Value item : items) {
            list.add(item.toJava());
        }
        return list;
    }
}

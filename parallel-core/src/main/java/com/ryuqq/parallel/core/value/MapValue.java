package com.ryuqq.parallel.core.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 문자열 키 매핑 (불변, 삽입 순서 유지).
 *
 * <p>Task 파라미터 객체와 Tool 결과 객체의 기본 형태입니다.</p>
 *
 * @param entries 키-값 매핑
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MapValue(Map<String, Value> entries) implements Value {

    private static final MapValue EMPTY = new MapValue(Map.of());

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException entries가 null이거나 null 키/값을 포함하는 경우
     */
    public MapValue {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        Map<String, Value> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Value> entry : entries.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("entries cannot contain null keys");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException(
                    "entries cannot contain null values (key: " + entry.getKey() + ", use NullValue)"
                );
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        entries = Collections.unmodifiableMap(copy);
    }

    /**
     * 빈 MapValue.
     *
     * @return 공유 인스턴스
     */
    public static MapValue empty() {
        return EMPTY;
    }

    /**
     * 일반 Map으로부터 생성.
     *
     * @param raw 문자열 키 Map (값은 {@link Value#of(Object)}가 지원하는 타입)
     * @return MapValue 인스턴스
     * @throws IllegalArgumentException 변환 불가능한 값이 포함된 경우
     */
    public static MapValue from(Map<String, ?> raw) {
        if (raw == null) {
            return EMPTY;
        }
        return (MapValue) Value.of(raw);
    }

    /**
     * 키로 값 조회.
     *
     * @param key 키
     * @return 값 (키가 없으면 empty)
     */
    public Optional<Value> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * 키 존재 여부.
     *
     * @param key 키
     * @return 존재하면 true
     */
    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    /**
     * 비어있는지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public Object toJava() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<String, Value> entry : entries.entrySet()) {
            map.put(entry.getKey(), entry.getValue().toJava());
        }
        return map;
    }
}

package com.ryuqq.parallel.core.value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task 파라미터와 Tool 결과를 표현하는 태그드 값 타입.
 *
 * <p>JSON과 동일한 여섯 가지 형태만 허용합니다:</p>
 * <ul>
 *   <li>{@link NullValue} - null</li>
 *   <li>{@link BoolValue} - true / false</li>
 *   <li>{@link NumberValue} - 숫자 (정규화된 BigDecimal)</li>
 *   <li>{@link StringValue} - 문자열 (변수 참조 포함 가능)</li>
 *   <li>{@link ListValue} - 순서 있는 시퀀스</li>
 *   <li>{@link MapValue} - 삽입 순서를 유지하는 문자열 키 매핑</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 VariableResolver 등이 리플렉션 없이
 * 모든 케이스를 순회할 수 있습니다.</p>
 *
 * <p><strong>변환 예시:</strong></p>
 * <pre>{@code
 * Value v = Value.of(Map.of("userId", 123, "tags", List.of("a", "b")));
 * Object plain = v.toJava();   // Map<String, Object>
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Value permits NullValue, BoolValue, NumberValue, StringValue, ListValue, MapValue {

    /**
     * 일반 Java 객체를 Value로 변환.
     *
     * <p>지원 타입: null, Value, Boolean, Number, CharSequence, List, Map(문자열 키).
     * 컬렉션은 재귀적으로 변환됩니다.</p>
     *
     * @param raw 변환할 객체 (null 허용)
     * @return 변환된 Value
     * @throws IllegalArgumentException 지원하지 않는 타입인 경우
     */
    static Value of(Object raw) {
        if (raw == null) {
            return NullValue.INSTANCE;
        }
        if (raw instanceof Value value) {
            return value;
        }
        if (raw instanceof Boolean bool) {
            return BoolValue.of(bool);
        }
        if (raw instanceof BigDecimal decimal) {
            return new NumberValue(decimal);
        }
        if (raw instanceof Number number) {
            return NumberValue.of(number);
        }
        if (raw instanceof CharSequence text) {
            return new StringValue(text.toString());
        }
        if (raw instanceof List<?> list) {
            List<Value> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(of(item));
            }
            return new ListValue(items);
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Value> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException(
                        "Map keys must be strings (current: " + entry.getKey() + ")"
                    );
                }
                entries.put(key, of(entry.getValue()));
            }
            return new MapValue(entries);
        }
        throw new IllegalArgumentException("Unsupported value type: " + raw.getClass().getName());
    }

    /**
     * 일반 Java 객체로 변환.
     *
     * <p>NullValue는 null, NumberValue는 BigDecimal, ListValue는 List,
     * MapValue는 LinkedHashMap으로 변환됩니다.</p>
     *
     * @return 변환된 Java 객체 (null 가능)
     */
    Object toJava();

    /**
     * null 값인지 확인.
     *
     * @return NullValue인 경우 true
     */
    default boolean isNull() {
        return this instanceof NullValue;
    }
}

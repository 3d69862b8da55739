package com.ryuqq.parallel.application.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.parallel.core.value.BoolValue;
import com.ryuqq.parallel.core.value.ListValue;
import com.ryuqq.parallel.core.value.MapValue;
import com.ryuqq.parallel.core.value.NullValue;
import com.ryuqq.parallel.core.value.NumberValue;
import com.ryuqq.parallel.core.value.StringValue;
import com.ryuqq.parallel.core.value.Value;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link Value} ↔ Jackson {@link JsonNode} 변환기.
 *
 * <p>숫자는 BigDecimal로 읽고 지수 표기 없이 씁니다.
 * 맵은 삽입 순서를 그대로 유지하므로 같은 Value는 항상 같은 문자열이 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ValueJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
        .setNodeFactory(NODES);

    // Utility class - prevent instantiation
    private ValueJson() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Value를 JsonNode로 변환.
     *
     * @param value 변환할 값
     * @return JsonNode
     */
    public static JsonNode toNode(Value value) {
        if (value == null || value instanceof NullValue) {
            return NODES.nullNode();
        }
        if (value instanceof BoolValue bool) {
            return NODES.booleanNode(bool.value());
        }
        if (value instanceof NumberValue number) {
            BigDecimal decimal = number.value();
            if (decimal.scale() <= 0) {
                return NODES.numberNode(decimal.toBigIntegerExact());
            }
            return NODES.numberNode(decimal);
        }
        if (value instanceof StringValue text) {
            return NODES.textNode(text.value());
        }
        if (value instanceof ListValue list) {
            ArrayNode array = NODES.arrayNode();
            for (Value item : list.items()) {
                array.add(toNode(item));
            }
            return array;
        }
        MapValue map = (MapValue) value;
        ObjectNode object = NODES.objectNode();
        for (Map.Entry<String, Value> entry : map.entries().entrySet()) {
            object.set(entry.getKey(), toNode(entry.getValue()));
        }
        return object;
    }

    /**
     * JsonNode를 Value로 변환.
     *
     * @param node JsonNode (null이면 NullValue)
     * @return Value
     * @throws IllegalArgumentException 바이너리 등 JSON 값이 아닌 노드인 경우
     */
    public static Value fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NullValue.INSTANCE;
        }
        if (node.isBoolean()) {
            return BoolValue.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return new NumberValue(node.decimalValue());
        }
        if (node.isTextual()) {
            return new StringValue(node.textValue());
        }
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(fromNode(item));
            }
            return new ListValue(items);
        }
        if (node.isObject()) {
            Map<String, Value> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), fromNode(field.getValue()));
            }
            return new MapValue(entries);
        }
        throw new IllegalArgumentException("Unsupported JSON node type: " + node.getNodeType());
    }

    /**
     * 간결한(compact) JSON 문자열로 직렬화.
     *
     * @param value 직렬화할 값
     * @return JSON 문자열
     */
    public static String stringify(Value value) {
        return write(toNode(value));
    }

    /**
     * JSON 문자열을 Value로 파싱.
     *
     * @param json JSON 문자열
     * @return Value
     * @throws IllegalArgumentException JSON 문법 오류인 경우
     */
    public static Value parse(String json) {
        try {
            return fromNode(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // JsonNode 트리 직렬화는 I/O가 없으므로 여기 도달하지 않는다
            throw new UncheckedIOException(e);
        }
    }
}

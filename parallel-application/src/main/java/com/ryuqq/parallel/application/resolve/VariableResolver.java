package com.ryuqq.parallel.application.resolve;

import com.ryuqq.parallel.application.codec.ValueJson;
import com.ryuqq.parallel.core.model.TaskResult;
import com.ryuqq.parallel.core.value.BoolValue;
import com.ryuqq.parallel.core.value.ListValue;
import com.ryuqq.parallel.core.value.MapValue;
import com.ryuqq.parallel.core.value.NullValue;
import com.ryuqq.parallel.core.value.NumberValue;
import com.ryuqq.parallel.core.value.StringValue;
import com.ryuqq.parallel.core.value.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Task 파라미터의 변수 참조 해석기.
 *
 * <p>문자열 안의 {@code ${taskId.field.nested}} 형태 참조를
 * 선행 Task의 결과로 치환합니다.</p>
 *
 * <p><strong>치환 규칙:</strong></p>
 * <ul>
 *   <li>문자열 전체가 하나의 참조 → 참조된 값을 원래 타입 그대로 반환</li>
 *   <li>문자열 일부가 참조 → 텍스트로 치환 (리스트/맵은 compact JSON)</li>
 *   <li>리스트/맵 → 원소별 재귀 처리</li>
 *   <li>그 외 → 그대로 통과</li>
 * </ul>
 *
 * <p><strong>경로 탐색:</strong> 첫 세그먼트는 Task ID이고, 나머지는
 * {@link TaskResult#asValue()} 필드 뷰를 따라갑니다.
 * 따라서 Tool 결과는 {@code ${taskA.result.userId}}처럼 {@code result}를 거쳐 참조합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class VariableResolver {

    private static final Pattern VARIABLE = Pattern.compile("\\$\\{([^}]+)}");
    private static final Pattern INDEX = Pattern.compile("\\d+");

    // Utility class - prevent instantiation
    private VariableResolver() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 파라미터 전체의 변수 참조 해석.
     *
     * @param params Task 파라미터
     * @param priorResults 선행 Task 결과 (Task ID → 결과)
     * @return 해석된 파라미터 (참조가 없으면 입력과 동일한 값)
     * @throws VariableResolutionException 참조를 해석할 수 없는 경우
     */
    public static MapValue resolve(MapValue params, Map<String, TaskResult> priorResults) {
        if (params == null) {
            return MapValue.empty();
        }
        return (MapValue) resolveValue(params, priorResults);
    }

    private static Value resolveValue(Value value, Map<String, TaskResult> priorResults) {
        if (value instanceof StringValue text) {
            return resolveString(text.value(), priorResults);
        }
        if (value instanceof ListValue list) {
            List<Value> items = new ArrayList<>(list.size());
            for (Value item : list.items()) {
                items.add(resolveValue(item, priorResults));
            }
            return new ListValue(items);
        }
        if (value instanceof MapValue map) {
            Map<String, Value> entries = new LinkedHashMap<>();
            for (Map.Entry<String, Value> entry : map.entries().entrySet()) {
                entries.put(entry.getKey(), resolveValue(entry.getValue(), priorResults));
            }
            return new MapValue(entries);
        }
        return value;
    }

    private static Value resolveString(String text, Map<String, TaskResult> priorResults) {
        if (!text.contains("${")) {
            return new StringValue(text);
        }

        Matcher whole = VARIABLE.matcher(text);
        if (whole.matches()) {
            return resolvePath(whole.group(1), priorResults);
        }

        Matcher matcher = VARIABLE.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Value resolved = resolvePath(matcher.group(1), priorResults);
            matcher.appendReplacement(out, Matcher.quoteReplacement(asText(resolved)));
        }
        matcher.appendTail(out);
        return new StringValue(out.toString());
    }

    /**
     * 점(.) 구분 경로를 선행 결과에서 조회.
     *
     * @param path 경로 (예: {@code taskA.result.items.0.name})
     * @param priorResults 선행 Task 결과
     * @return 경로가 가리키는 값
     * @throws VariableResolutionException 경로를 해석할 수 없는 경우
     */
    public static Value resolvePath(String path, Map<String, TaskResult> priorResults) {
        String variable = "${" + path + "}";
        String[] segments = path.split("\\.", -1);

        if (segments.length < 2) {
            throw new VariableResolutionException(variable,
                "Variable must have at least taskId and field (e.g., ${taskId.result})");
        }

        String taskId = segments[0];
        TaskResult taskResult = priorResults == null ? null : priorResults.get(taskId);
        if (taskResult == null) {
            throw new VariableResolutionException(variable,
                "Task " + taskId + " not found in previous results");
        }
        if (!taskResult.isSuccess()) {
            throw new VariableResolutionException(variable,
                "Task " + taskId + " did not succeed (status: "
                    + taskResult.status().name().toLowerCase(Locale.ROOT) + ")");
        }

        List<String> rest = Arrays.asList(segments).subList(1, segments.length);
        Value current = taskResult.asValue();
        for (String segment : rest) {
            if (current.isNull()) {
                throw new VariableResolutionException(variable,
                    "Path segment \"" + segment + "\" accessed on null value");
            }
            Optional<Value> next = child(current, segment);
            if (next.isEmpty()) {
                throw new VariableResolutionException(variable,
                    "Path \"" + String.join(".", rest) + "\" not found in task " + taskId + " result");
            }
            current = next.get();
        }
        return current;
    }

    private static Optional<Value> child(Value current, String segment) {
        if (current instanceof MapValue map) {
            return map.get(segment);
        }
        if (current instanceof ListValue list && INDEX.matcher(segment).matches()) {
            try {
                int index = Integer.parseInt(segment);
                return index < list.size() ? Optional.of(list.get(index)) : Optional.empty();
            } catch (NumberFormatException e) {
                // 자릿수가 int 범위를 넘는 인덱스
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * 문자열 삽입용 텍스트 변환.
     *
     * @param value 변환할 값
     * @return 텍스트 (리스트/맵은 compact JSON)
     */
    static String asText(Value value) {
        if (value instanceof StringValue text) {
            return text.value();
        }
        if (value instanceof NumberValue number) {
            return number.toPlainString();
        }
        if (value instanceof BoolValue || value instanceof NullValue) {
            return value.toString();
        }
        return ValueJson.stringify(value);
    }
}

package com.ryuqq.parallel.application.resolve;

import com.ryuqq.parallel.core.model.TaskError;
import com.ryuqq.parallel.core.model.TaskResult;
import com.ryuqq.parallel.core.value.ListValue;
import com.ryuqq.parallel.core.value.MapValue;
import com.ryuqq.parallel.core.value.StringValue;
import com.ryuqq.parallel.core.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * VariableResolver 테스트.
 *
 * <ul>
 *   <li>단일 참조는 원래 타입 유지</li>
 *   <li>삽입 참조는 텍스트 치환 (리스트/맵은 compact JSON)</li>
 *   <li>해석 실패 사유별 메시지</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class VariableResolverTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private Map<String, TaskResult> results;

    @BeforeEach
    void setUp() {
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("userId", 123);
        user.put("name", "kim");
        user.put("tags", List.of("a", "b"));
        user.put("profile", null);
        user.put("active", true);

        results = new HashMap<>();
        results.put("taskA", TaskResult.success("taskA", Value.of(user), NOW, NOW));
        results.put("taskB", TaskResult.failed("taskB", TaskError.of("HTTP_ERROR", "503"), NOW, NOW));
    }

    private static MapValue params(String key, Object value) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(key, value);
        return MapValue.from(raw);
    }

    @Test
    void 단일_참조는_숫자_타입을_유지한다() {
        // when
        MapValue resolved = VariableResolver.resolve(params("id", "${taskA.result.userId}"), results);

        // then
        assertThat(resolved.get("id")).contains(Value.of(123));
    }

    @Test
    void 단일_참조는_리스트를_그대로_반환한다() {
        MapValue resolved = VariableResolver.resolve(params("tags", "${taskA.result.tags}"), results);

        assertThat(resolved.get("tags")).contains(ListValue.of(new StringValue("a"), new StringValue("b")));
    }

    @Test
    void 삽입_참조는_텍스트로_치환된다() {
        MapValue resolved = VariableResolver.resolve(
            params("url", "https://api/users/${taskA.result.userId}?active=${taskA.result.active}"), results);

        assertThat(resolved.get("url")).contains(new StringValue("https://api/users/123?active=true"));
    }

    @Test
    void 삽입된_리스트는_compact_JSON이_된다() {
        MapValue resolved = VariableResolver.resolve(params("q", "tags=${taskA.result.tags}"), results);

        assertThat(resolved.get("q")).contains(new StringValue("tags=[\"a\",\"b\"]"));
    }

    @Test
    void 삽입된_null은_null_텍스트가_된다() {
        MapValue resolved = VariableResolver.resolve(params("q", "p=${taskA.result.profile}"), results);

        assertThat(resolved.get("q")).contains(new StringValue("p=null"));
    }

    @Test
    void 리스트_인덱스로_탐색한다() {
        Value value = VariableResolver.resolvePath("taskA.result.tags.1", results);

        assertThat(value).isEqualTo(new StringValue("b"));
    }

    @Test
    void 결과_필드_뷰의_status를_참조할_수_있다() {
        assertThat(VariableResolver.resolvePath("taskA.status", results)).isEqualTo(new StringValue("success"));
    }

    @Test
    void 중첩된_맵과_리스트도_재귀적으로_해석된다() {
        // given
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("body", Map.of("ids", List.of("${taskA.result.userId}", "literal")));
        raw.put("retries", 3);

        // when
        MapValue resolved = VariableResolver.resolve(MapValue.from(raw), results);

        // then
        assertThat(resolved.toJava()).isEqualTo(Map.of(
            "body", Map.of("ids", List.of(new java.math.BigDecimal("123"), "literal")),
            "retries", new java.math.BigDecimal("3")
        ));
    }

    @Test
    void 참조가_없으면_입력과_동일하다() {
        MapValue input = MapValue.from(Map.of("a", 1, "b", List.of("x", Map.of("c", false))));

        assertThat(VariableResolver.resolve(input, results)).isEqualTo(input);
    }

    @Test
    void 세그먼트가_하나뿐이면_실패한다() {
        assertThatThrownBy(() -> VariableResolver.resolvePath("taskA", results))
            .isInstanceOf(VariableResolutionException.class)
            .hasMessageContaining("Variable must have at least taskId and field");
    }

    @Test
    void 없는_Task는_실패한다() {
        assertThatThrownBy(() -> VariableResolver.resolve(params("x", "${ghost.result}"), results))
            .isInstanceOfSatisfying(VariableResolutionException.class, e -> {
                assertThat(e.getVariable()).isEqualTo("${ghost.result}");
                assertThat(e.getReason()).isEqualTo("Task ghost not found in previous results");
                assertThat(e.errorCode()).isEqualTo("VARIABLE_RESOLUTION_FAILED");
            });
    }

    @Test
    void 실패한_Task는_참조할_수_없다() {
        assertThatThrownBy(() -> VariableResolver.resolvePath("taskB.error.code", results))
            .isInstanceOf(VariableResolutionException.class)
            .hasMessageContaining("Task taskB did not succeed (status: failed)");
    }

    @Test
    void null_값_위의_세그먼트는_실패한다() {
        assertThatThrownBy(() -> VariableResolver.resolvePath("taskA.result.profile.email", results))
            .isInstanceOf(VariableResolutionException.class)
            .hasMessageContaining("Path segment \"email\" accessed on null value");
    }

    @Test
    void 없는_필드는_전체_경로를_포함해_실패한다() {
        assertThatThrownBy(() -> VariableResolver.resolvePath("taskA.result.missing", results))
            .isInstanceOf(VariableResolutionException.class)
            .hasMessageContaining("Path \"result.missing\" not found in task taskA result");
    }

    @Test
    void 범위를_벗어난_인덱스는_없는_필드로_취급한다() {
        assertThatThrownBy(() -> VariableResolver.resolvePath("taskA.result.tags.5", results))
            .isInstanceOf(VariableResolutionException.class)
            .hasMessageContaining("not found");
    }
}

package com.ryuqq.parallel.application.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.parallel.application.execution.DagInfo;
import com.ryuqq.parallel.application.execution.ExecutionReport;
import com.ryuqq.parallel.application.execution.ExecutionRequest;
import com.ryuqq.parallel.application.execution.ExecutionStatus;
import com.ryuqq.parallel.application.execution.ExecutionSummary;
import com.ryuqq.parallel.application.execution.FailureMode;
import com.ryuqq.parallel.core.graph.GraphEdge;
import com.ryuqq.parallel.core.model.BackoffStrategy;
import com.ryuqq.parallel.core.model.Task;
import com.ryuqq.parallel.core.model.TaskError;
import com.ryuqq.parallel.core.model.TaskResult;
import com.ryuqq.parallel.core.value.StringValue;
import com.ryuqq.parallel.core.value.Value;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ExecutionJsonCodec 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ExecutionJsonCodecTest {

    private final ExecutionJsonCodec codec = new ExecutionJsonCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void readRequest_전체_필드를_매핑한다() {
        // given
        String json = """
            {
              "tasks": [
                { "id": "fetch", "tool": "http_get", "params": { "url": "https://x" } },
                { "id": "parse", "tool": "json_parse", "params": { "body": "${fetch.result.body}" },
                  "dependsOn": ["fetch"], "priority": 8, "timeout": 5000,
                  "retryPolicy": { "maxAttempts": 3, "backoff": "linear", "initialDelay": 100 } }
              ],
              "config": { "maxConcurrent": 2, "failureMode": "stop", "timeout": 60000, "enableRollback": true }
            }
            """;

        // when
        ExecutionRequest request = codec.readRequest(json);

        // then
        assertThat(request.tasks()).hasSize(2);
        Task parse = request.tasks().get(1);
        assertThat(parse.dependsOn()).containsExactly("fetch");
        assertThat(parse.priority()).isEqualTo(8);
        assertThat(parse.timeoutMs()).isEqualTo(5000L);
        assertThat(parse.retryPolicy().backoff()).isEqualTo(BackoffStrategy.LINEAR);
        assertThat(parse.retryPolicy().initialDelayMs()).isEqualTo(100L);
        assertThat(parse.params().get("body")).contains(new StringValue("${fetch.result.body}"));

        assertThat(request.config().maxConcurrent()).isEqualTo(2);
        assertThat(request.config().failureMode()).isEqualTo(FailureMode.STOP);
        assertThat(request.config().timeoutMs()).isEqualTo(60000L);
        assertThat(request.config().enableRollback()).isTrue();
    }

    @Test
    void readRequest_config가_없으면_기본값() {
        ExecutionRequest request = codec.readRequest("{\"tasks\":[{\"id\":\"a\",\"tool\":\"t\",\"params\":{}}]}");

        assertThat(request.config().maxConcurrent()).isEqualTo(10);
        assertThat(request.config().failureMode()).isEqualTo(FailureMode.CONTINUE);
        assertThat(request.tasks().get(0).priority()).isNull();
    }

    @Test
    void readRequest_tool이_없으면_거부한다() {
        assertThatThrownBy(() -> codec.readRequest("{\"tasks\":[{\"id\":\"a\",\"params\":{}}]}"))
            .isInstanceOfSatisfying(InvalidRequestException.class,
                e -> assertThat(e.getField()).isEqualTo("tasks[0].tool"));
    }

    @Test
    void readRequest_params가_객체가_아니면_거부한다() {
        assertThatThrownBy(() -> codec.readRequest("{\"tasks\":[{\"id\":\"a\",\"tool\":\"t\",\"params\":[]}]}"))
            .isInstanceOf(InvalidRequestException.class)
            .hasMessageContaining("tasks[0].params");
    }

    @Test
    void readRequest_tasks가_배열이_아니면_거부한다() {
        assertThatThrownBy(() -> codec.readRequest("{\"tasks\":{}}"))
            .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> codec.readRequest("not json"))
            .isInstanceOf(InvalidRequestException.class)
            .hasMessageContaining("malformed JSON");
    }

    @Test
    void readRequest_범위를_벗어난_priority는_거부한다() {
        assertThatThrownBy(() -> codec.readRequest(
            "{\"tasks\":[{\"id\":\"a\",\"tool\":\"t\",\"params\":{},\"priority\":11}]}"))
            .isInstanceOf(InvalidRequestException.class)
            .hasMessageContaining("priority must be between 1 and 10");
    }

    @Test
    void readRequest_알수없는_failureMode는_거부한다() {
        assertThatThrownBy(() -> codec.readRequest(
            "{\"tasks\":[],\"config\":{\"failureMode\":\"explode\"}}"))
            .isInstanceOf(InvalidRequestException.class)
            .hasMessageContaining("Unknown FailureMode");
    }

    @Test
    void writeReport_상태는_소문자이고_없는_필드는_생략한다() throws Exception {
        // given
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Instant end = Instant.parse("2024-01-01T00:00:00.500Z");
        Map<String, TaskResult> tasks = new LinkedHashMap<>();
        tasks.put("A", TaskResult.success("A", Value.of(Map.of("id", 1)), start, end));
        tasks.put("B", TaskResult.failed("B", TaskError.of("TASK_TIMEOUT", "slow"), start, end));
        tasks.put("C", TaskResult.skipped("C", "dependency B did not succeed", end));
        ExecutionReport report = new ExecutionReport("exec-1", ExecutionStatus.PARTIAL, start, end, 500,
            tasks, ExecutionSummary.of(tasks.values()),
            new DagInfo(List.of(List.of("A", "B"), List.of("C")), List.of(new GraphEdge("B", "C"))));

        // when
        JsonNode json = mapper.readTree(codec.writeReport(report));

        // then
        assertThat(json.get("status").asText()).isEqualTo("partial");
        assertThat(json.get("startTime").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(json.get("duration").asLong()).isEqualTo(500);
        assertThat(json.get("tasks").fieldNames()).toIterable().containsExactly("A", "B", "C");

        JsonNode a = json.get("tasks").get("A");
        assertThat(a.get("status").asText()).isEqualTo("success");
        assertThat(a.get("result").get("id").asInt()).isEqualTo(1);
        assertThat(a.has("error")).isFalse();

        JsonNode b = json.get("tasks").get("B");
        assertThat(b.get("error").get("code").asText()).isEqualTo("TASK_TIMEOUT");
        assertThat(b.get("error").has("stack")).isFalse();
        assertThat(b.has("result")).isFalse();

        JsonNode c = json.get("tasks").get("C");
        assertThat(c.get("status").asText()).isEqualTo("skipped");
        assertThat(c.get("skipReason").asText()).isEqualTo("dependency B did not succeed");

        assertThat(json.get("summary").get("skipped").asInt()).isEqualTo(1);
        assertThat(json.get("dag").get("levels").get(0).size()).isEqualTo(2);
        assertThat(json.get("dag").get("edges").get(0).get("to").asText()).isEqualTo("C");
    }
}

package com.ryuqq.parallel.testkit.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.parallel.adapter.runner.RunnerConfig;
import com.ryuqq.parallel.application.codec.ExecutionJsonCodec;
import com.ryuqq.parallel.application.codec.InvalidRequestException;
import com.ryuqq.parallel.application.execution.ExecutionReport;
import com.ryuqq.parallel.application.execution.ExecutionRequest;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: JSON request in, JSON report out.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class JsonRequestContractTest extends AbstractContractTest {

    private final ExecutionJsonCodec codec = new ExecutionJsonCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testJsonRoundTrip_ContinueModeWithVariables() throws Exception {
        // Given
        registry.register("lookup", ScriptedTools.returning(Map.of("id", 42)));
        registry.register("echo", ScriptedTools.echo());
        registry.register("boom", ScriptedTools.failing("broken"));
        String json = """
            {
              "tasks": [
                {"id": "lookup", "tool": "lookup", "params": {}},
                {"id": "notify", "tool": "echo", "params": {"userId": "${lookup.result.id}"},
                 "dependsOn": ["lookup"], "priority": 8, "timeout": 1000},
                {"id": "broken", "tool": "boom", "params": {}},
                {"id": "after", "tool": "echo", "params": {}, "dependsOn": ["broken"]}
              ],
              "config": {"maxConcurrent": 4, "failureMode": "continue"}
            }
            """;

        // When
        ExecutionRequest request = codec.readRequest(json);
        ExecutionReport report = newExecutor(new RunnerConfig()).execute(request);
        JsonNode out = mapper.readTree(codec.writeReport(report));

        // Then
        assertEquals("partial", out.get("status").asText());
        assertEquals(4, out.get("summary").get("total").asInt());
        assertEquals(2, out.get("summary").get("succeeded").asInt());
        assertEquals(1, out.get("summary").get("failed").asInt());
        assertEquals(1, out.get("summary").get("skipped").asInt());

        JsonNode notify = out.get("tasks").get("notify");
        assertEquals("success", notify.get("status").asText());
        assertEquals(42, notify.get("result").get("userId").asInt());
        assertFalse(notify.has("error"));

        JsonNode broken = out.get("tasks").get("broken");
        assertEquals("failed", broken.get("status").asText());
        assertEquals("broken", broken.get("error").get("message").asText());

        assertEquals("skipped", out.get("tasks").get("after").get("status").asText());
        assertEquals(2, out.get("dag").get("levels").size());
        assertTrue(out.get("duration").isIntegralNumber());
    }

    @Test
    void testInvalidJson_RejectedWithFieldPath() {
        String json = """
            {"tasks": [{"id": "a", "tool": "echo", "params": {}, "retryPolicy": {"maxAttempts": 0}}]}
            """;

        InvalidRequestException thrown = assertThrows(InvalidRequestException.class, () -> codec.readRequest(json));

        assertTrue(thrown.getField().startsWith("tasks[0]"), "Unexpected field: " + thrown.getField());
        assertTrue(listener.events().isEmpty());
    }
}

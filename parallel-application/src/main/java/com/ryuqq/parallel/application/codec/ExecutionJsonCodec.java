package com.ryuqq.parallel.application.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.parallel.application.execution.DagInfo;
import com.ryuqq.parallel.application.execution.ExecutionConfig;
import com.ryuqq.parallel.application.execution.ExecutionReport;
import com.ryuqq.parallel.application.execution.ExecutionRequest;
import com.ryuqq.parallel.application.execution.ExecutionSummary;
import com.ryuqq.parallel.application.execution.FailureMode;
import com.ryuqq.parallel.core.graph.GraphEdge;
import com.ryuqq.parallel.core.model.BackoffStrategy;
import com.ryuqq.parallel.core.model.RetryPolicy;
import com.ryuqq.parallel.core.model.Task;
import com.ryuqq.parallel.core.model.TaskError;
import com.ryuqq.parallel.core.model.TaskResult;
import com.ryuqq.parallel.core.value.MapValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 실행 요청/보고서 JSON 코덱.
 *
 * <p><strong>요청 형태:</strong></p>
 * <pre>
 * {
 *   "tasks": [
 *     { "id": "fetch", "tool": "http_get", "params": { "url": "..." },
 *       "dependsOn": [], "priority": 8, "timeout": 5000,
 *       "retryPolicy": { "maxAttempts": 3, "backoff": "exponential", "initialDelay": 100 } }
 *   ],
 *   "config": { "maxConcurrent": 10, "failureMode": "continue", "timeout": 0, "enableRollback": false }
 * }
 * </pre>
 *
 * <p>보고서는 상태를 소문자로, 시각을 ISO-8601로 직렬화하며
 * 값이 없는 result / error / skipReason 필드는 생략합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionJsonCodec {

    /**
     * JSON 문자열을 실행 요청으로 변환.
     *
     * @param json 요청 JSON
     * @return ExecutionRequest
     * @throws InvalidRequestException JSON 문법 오류 또는 형태가 올바르지 않은 경우
     */
    public ExecutionRequest readRequest(String json) {
        if (json == null) {
            throw new InvalidRequestException("$", "request cannot be null");
        }
        JsonNode root;
        try {
            root = ValueJson.MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("$", "malformed JSON: " + e.getOriginalMessage(), e);
        }
        return readRequest(root);
    }

    /**
     * JSON 트리를 실행 요청으로 변환.
     *
     * @param root 요청 JSON 트리
     * @return ExecutionRequest
     * @throws InvalidRequestException 형태가 올바르지 않은 경우
     */
    public ExecutionRequest readRequest(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidRequestException("$", "request must be an object");
        }
        JsonNode tasksNode = root.get("tasks");
        if (tasksNode == null || !tasksNode.isArray()) {
            throw new InvalidRequestException("tasks", "must be an array");
        }

        List<Task> tasks = new ArrayList<>(tasksNode.size());
        for (int i = 0; i < tasksNode.size(); i++) {
            tasks.add(readTask(tasksNode.get(i), "tasks[" + i + "]"));
        }

        JsonNode configNode = root.get("config");
        ExecutionConfig config = configNode == null || configNode.isNull()
            ? new ExecutionConfig()
            : readConfig(configNode);

        return new ExecutionRequest(tasks, config);
    }

    private Task readTask(JsonNode node, String at) {
        if (node == null || !node.isObject()) {
            throw new InvalidRequestException(at, "task must be an object");
        }
        String id = requireText(node, "id", at);
        String tool = requireText(node, "tool", at);
        JsonNode params = node.get("params");
        if (params == null || !params.isObject()) {
            throw new InvalidRequestException(at + ".params", "must be an object");
        }

        Task.Builder builder = Task.builder(id, tool)
            .params((MapValue) ValueJson.fromNode(params));

        JsonNode dependsOn = node.get("dependsOn");
        if (dependsOn != null && !dependsOn.isNull()) {
            if (!dependsOn.isArray()) {
                throw new InvalidRequestException(at + ".dependsOn", "must be an array of task ids");
            }
            for (int i = 0; i < dependsOn.size(); i++) {
                JsonNode dependency = dependsOn.get(i);
                if (!dependency.isTextual()) {
                    throw new InvalidRequestException(at + ".dependsOn[" + i + "]", "must be a string");
                }
                builder.dependsOn(dependency.textValue());
            }
        }

        JsonNode priority = node.get("priority");
        if (priority != null && !priority.isNull()) {
            builder.priority(requireInt(priority, at + ".priority"));
        }
        JsonNode timeout = node.get("timeout");
        if (timeout != null && !timeout.isNull()) {
            builder.timeoutMs(requireLong(timeout, at + ".timeout"));
        }
        JsonNode retryPolicy = node.get("retryPolicy");
        if (retryPolicy != null && !retryPolicy.isNull()) {
            builder.retryPolicy(readRetryPolicy(retryPolicy, at + ".retryPolicy"));
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(at, e.getMessage(), e);
        }
    }

    private RetryPolicy readRetryPolicy(JsonNode node, String at) {
        if (!node.isObject()) {
            throw new InvalidRequestException(at, "must be an object");
        }
        int maxAttempts = requireInt(requireField(node, "maxAttempts", at), at + ".maxAttempts");
        String backoff = requireText(node, "backoff", at);
        JsonNode initialDelay = node.get("initialDelay");
        long initialDelayMs = initialDelay == null || initialDelay.isNull()
            ? 0
            : requireLong(initialDelay, at + ".initialDelay");
        try {
            return new RetryPolicy(maxAttempts, parseEnum(BackoffStrategy.class, backoff), initialDelayMs);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(at, e.getMessage(), e);
        }
    }

    private ExecutionConfig readConfig(JsonNode node) {
        if (!node.isObject()) {
            throw new InvalidRequestException("config", "must be an object");
        }
        ExecutionConfig config = new ExecutionConfig();
        try {
            JsonNode maxConcurrent = node.get("maxConcurrent");
            if (maxConcurrent != null && !maxConcurrent.isNull()) {
                config = config.withMaxConcurrent(requireInt(maxConcurrent, "config.maxConcurrent"));
            }
            JsonNode failureMode = node.get("failureMode");
            if (failureMode != null && !failureMode.isNull()) {
                config = config.withFailureMode(
                    parseEnum(FailureMode.class, requireText(node, "failureMode", "config")));
            }
            JsonNode timeout = node.get("timeout");
            if (timeout != null && !timeout.isNull()) {
                config = config.withTimeoutMs(requireLong(timeout, "config.timeout"));
            }
            JsonNode enableRollback = node.get("enableRollback");
            if (enableRollback != null && !enableRollback.isNull()) {
                if (!enableRollback.isBoolean()) {
                    throw new InvalidRequestException("config.enableRollback", "must be a boolean");
                }
                config = config.withEnableRollback(enableRollback.booleanValue());
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("config", e.getMessage(), e);
        }
        return config;
    }

    /**
     * 실행 보고서를 JSON 문자열로 변환.
     *
     * @param report 실행 보고서
     * @return compact JSON
     */
    public String writeReport(ExecutionReport report) {
        return ValueJson.write(toNode(report));
    }

    /**
     * 실행 보고서를 JSON 트리로 변환.
     *
     * @param report 실행 보고서
     * @return JSON 트리
     */
    public ObjectNode toNode(ExecutionReport report) {
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null");
        }
        ObjectNode root = ValueJson.MAPPER.createObjectNode();
        root.put("executionId", report.executionId());
        root.put("status", lower(report.status()));
        root.put("startTime", report.startTime().toString());
        root.put("endTime", report.endTime().toString());
        root.put("duration", report.durationMs());

        ObjectNode tasks = root.putObject("tasks");
        for (Map.Entry<String, TaskResult> entry : report.tasks().entrySet()) {
            tasks.set(entry.getKey(), toNode(entry.getValue()));
        }

        ExecutionSummary summary = report.summary();
        ObjectNode summaryNode = root.putObject("summary");
        summaryNode.put("total", summary.total());
        summaryNode.put("succeeded", summary.succeeded());
        summaryNode.put("failed", summary.failed());
        summaryNode.put("skipped", summary.skipped());

        root.set("dag", toNode(report.dag()));
        return root;
    }

    private ObjectNode toNode(TaskResult result) {
        ObjectNode node = ValueJson.MAPPER.createObjectNode();
        node.put("taskId", result.taskId());
        node.put("status", lower(result.status()));
        node.put("duration", result.durationMs());
        if (result.result() != null) {
            node.set("result", ValueJson.toNode(result.result()));
        }
        TaskError error = result.error();
        if (error != null) {
            ObjectNode errorNode = node.putObject("error");
            errorNode.put("code", error.code());
            errorNode.put("message", error.message());
            if (error.stack() != null) {
                errorNode.put("stack", error.stack());
            }
        }
        if (result.skipReason() != null) {
            node.put("skipReason", result.skipReason());
        }
        node.put("startTime", result.startTime().toString());
        node.put("endTime", result.endTime().toString());
        return node;
    }

    private ObjectNode toNode(DagInfo dag) {
        ObjectNode node = ValueJson.MAPPER.createObjectNode();
        ArrayNode levels = node.putArray("levels");
        for (List<String> level : dag.levels()) {
            ArrayNode levelNode = levels.addArray();
            level.forEach(levelNode::add);
        }
        ArrayNode edges = node.putArray("edges");
        for (GraphEdge edge : dag.edges()) {
            edges.addObject().put("from", edge.from()).put("to", edge.to());
        }
        return node;
    }

    private static JsonNode requireField(JsonNode node, String field, String at) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new InvalidRequestException(at + "." + field, "is required");
        }
        return value;
    }

    private static String requireText(JsonNode node, String field, String at) {
        JsonNode value = requireField(node, field, at);
        if (!value.isTextual()) {
            throw new InvalidRequestException(at + "." + field, "must be a string");
        }
        return value.textValue();
    }

    private static int requireInt(JsonNode value, String at) {
        if (!value.isIntegralNumber() && !(value.isNumber() && isWhole(value))) {
            throw new InvalidRequestException(at, "must be an integer");
        }
        if (!value.canConvertToInt()) {
            throw new InvalidRequestException(at, "is out of range");
        }
        return value.intValue();
    }

    private static long requireLong(JsonNode value, String at) {
        if (!value.isIntegralNumber() && !(value.isNumber() && isWhole(value))) {
            throw new InvalidRequestException(at, "must be an integer");
        }
        if (!value.canConvertToLong()) {
            throw new InvalidRequestException(at, "is out of range");
        }
        return value.longValue();
    }

    private static boolean isWhole(JsonNode value) {
        return value.decimalValue().stripTrailingZeros().scale() <= 0;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String raw) {
        try {
            return Enum.valueOf(type, raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Unknown " + type.getSimpleName() + ": " + raw, e);
        }
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}

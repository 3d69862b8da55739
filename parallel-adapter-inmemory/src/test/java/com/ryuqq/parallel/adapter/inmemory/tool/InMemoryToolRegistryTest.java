package com.ryuqq.parallel.adapter.inmemory.tool;

import com.ryuqq.parallel.core.value.MapValue;
import com.ryuqq.parallel.core.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link InMemoryToolRegistry}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryToolRegistryTest {

    private InMemoryToolRegistry registry;

    @BeforeEach
    void setUp() {
        // Run sync tools on the caller thread to keep tests deterministic
        registry = new InMemoryToolRegistry(Runnable::run);
    }

    @Test
    void testInvoke_RegisteredAsyncTool_ReturnsItsResult() throws Exception {
        // Given
        registry.register("echo", params -> CompletableFuture.completedFuture(params));
        MapValue params = MapValue.from(Map.of("msg", "hello"));

        // When
        Value result = registry.invoke("echo", params).get(1, TimeUnit.SECONDS);

        // Then
        assertEquals(params, result);
    }

    @Test
    void testInvoke_SyncTool_CompletesWithValue() throws Exception {
        registry.registerSync("upper", params ->
            Value.of(params.get("text").map(Value::toJava).orElse("").toString().toUpperCase()));

        Value result = registry.invoke("upper", MapValue.from(Map.of("text", "abc"))).get(1, TimeUnit.SECONDS);

        assertEquals(Value.of("ABC"), result);
    }

    @Test
    void testInvoke_SyncToolReturningNull_CompletesWithNullValue() throws Exception {
        registry.registerSync("nothing", params -> null);

        Value result = registry.invoke("nothing", MapValue.empty()).get(1, TimeUnit.SECONDS);

        assertTrue(result.isNull());
    }

    @Test
    void testInvoke_SyncToolThrowsCheckedException_FailsFuture() {
        // Given
        IOException failure = new IOException("disk unavailable");
        registry.registerSync("read", params -> {
            throw failure;
        });

        // When
        CompletableFuture<Value> future = registry.invoke("read", MapValue.empty());

        // Then
        ExecutionException thrown = assertThrows(ExecutionException.class, future::get);
        assertSame(failure, thrown.getCause());
    }

    @Test
    void testInvoke_AsyncToolThrowsSynchronously_FailsFuture() {
        registry.register("broken", params -> {
            throw new IllegalStateException("not ready");
        });

        CompletableFuture<Value> future = registry.invoke("broken", MapValue.empty());

        ExecutionException thrown = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(IllegalStateException.class, thrown.getCause());
    }

    @Test
    void testInvoke_ToolReturnsNullFuture_FailsFuture() {
        registry.register("lazy", params -> null);

        CompletableFuture<Value> future = registry.invoke("lazy", MapValue.empty());

        ExecutionException thrown = assertThrows(ExecutionException.class, future::get);
        assertEquals("Tool lazy returned a null future", thrown.getCause().getMessage());
    }

    @Test
    void testInvoke_UnknownTool_FailsWithUnknownToolCode() {
        // When
        CompletableFuture<Value> future = registry.invoke("missing", MapValue.empty());

        // Then
        ExecutionException thrown = assertThrows(ExecutionException.class, future::get);
        UnknownToolException cause = assertInstanceOf(UnknownToolException.class, thrown.getCause());
        assertEquals("missing", cause.getToolName());
        assertEquals("UNKNOWN_TOOL", cause.errorCode());
        assertEquals("Unknown tool: missing", cause.getMessage());
    }

    @Test
    void testRegister_SameName_ReplacesTool() throws Exception {
        registry.registerSync("t", params -> Value.of(1));
        registry.registerSync("t", params -> Value.of(2));

        assertEquals(Value.of(2), registry.invoke("t", MapValue.empty()).get());
        assertEquals(1, registry.toolNames().size());
    }

    @Test
    void testRegister_InvalidArguments_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", params -> null));
        assertThrows(IllegalArgumentException.class, () -> registry.register("t", null));
        assertThrows(IllegalArgumentException.class, () -> registry.registerSync("t", null));
    }

    @Test
    void testUnregisterAndClear() {
        registry.registerSync("b", params -> null);
        registry.registerSync("a", params -> null);

        assertIterableEquals(java.util.List.of("a", "b"), registry.toolNames());
        assertTrue(registry.unregister("a"));
        assertFalse(registry.unregister("a"));
        assertFalse(registry.contains("a"));

        registry.clear();
        assertTrue(registry.toolNames().isEmpty());
    }
}

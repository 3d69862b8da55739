package com.ryuqq.parallel.adapter.inmemory.tool;

import com.ryuqq.parallel.core.spi.ToolInvoker;
import com.ryuqq.parallel.core.value.MapValue;
import com.ryuqq.parallel.core.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * In-memory implementation of {@link ToolInvoker} SPI backed by a name → tool map.
 *
 * <p>This registry is the reference adapter used by Contract Tests and local runs.
 * Production hosts plug in their own {@link ToolInvoker} that routes to real tools
 * (browser, file, database, email, HTTP).</p>
 *
 * <p><strong>Implementation Notes:</strong></p>
 * <ul>
 *   <li>Thread-safe: tools are stored in a {@link ConcurrentHashMap}</li>
 *   <li>{@link SyncTool}s run on the configured executor, never on the caller thread</li>
 *   <li>Failures never escape {@link #invoke}: unknown names, synchronous throws
 *       and null futures all become failed futures</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryToolRegistry registry = new InMemoryToolRegistry();
 * registry.registerSync("echo", params -&gt; params);
 * registry.register("fetch", params -&gt; httpClient.getAsync(params));
 *
 * try (LevelBarrierExecutor executor = new LevelBarrierExecutor(registry)) {
 *     ExecutionReport report = executor.execute(request);
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryToolRegistry implements ToolInvoker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryToolRegistry.class);

    private final ConcurrentHashMap<String, Tool> tools = new ConcurrentHashMap<>();
    private final Executor syncExecutor;

    /**
     * Creates a registry that runs blocking tools on the common pool.
     */
    public InMemoryToolRegistry() {
        this(ForkJoinPool.commonPool());
    }

    /**
     * Creates a registry.
     *
     * @param syncExecutor executor for {@link SyncTool}s
     */
    public InMemoryToolRegistry(Executor syncExecutor) {
        if (syncExecutor == null) {
            throw new IllegalArgumentException("syncExecutor cannot be null");
        }
        this.syncExecutor = syncExecutor;
    }

    /**
     * Registers an asynchronous tool, replacing any tool with the same name.
     *
     * @param name tool name
     * @param tool tool implementation
     */
    public void register(String name, Tool tool) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (tool == null) {
            throw new IllegalArgumentException("tool cannot be null");
        }
        if (tools.put(name, tool) != null) {
            log.debug("Tool {} replaced", name);
        }
    }

    /**
     * Registers a blocking tool.
     *
     * @param name tool name
     * @param tool tool implementation
     */
    public void registerSync(String name, SyncTool tool) {
        if (tool == null) {
            throw new IllegalArgumentException("tool cannot be null");
        }
        register(name, params -> {
            CompletableFuture<Value> future = new CompletableFuture<>();
            syncExecutor.execute(() -> {
                try {
                    Value value = tool.apply(params);
                    future.complete(value == null ? Value.of(null) : value);
                } catch (Exception e) {
                    future.completeExceptionally(e);
                }
            });
            return future;
        });
    }

    /**
     * Removes a tool.
     *
     * @param name tool name
     * @return true if a tool was removed
     */
    public boolean unregister(String name) {
        return name != null && tools.remove(name) != null;
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    /**
     * Registered tool names in alphabetical order.
     *
     * @return unmodifiable snapshot
     */
    public Set<String> toolNames() {
        return Collections.unmodifiableSet(new TreeSet<>(tools.keySet()));
    }

    /**
     * Removes every tool. Used between tests.
     */
    public void clear() {
        tools.clear();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Unknown tool names complete exceptionally with {@link UnknownToolException}.</p>
     */
    @Override
    public CompletableFuture<Value> invoke(String toolName, MapValue params) {
        Tool tool = toolName == null ? null : tools.get(toolName);
        if (tool == null) {
            log.warn("Unknown tool requested: {} (registered: {})", toolName, toolNames());
            return CompletableFuture.failedFuture(new UnknownToolException(toolName));
        }

        try {
            CompletableFuture<Value> future = tool.invoke(params == null ? MapValue.empty() : params);
            if (future == null) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("Tool " + toolName + " returned a null future"));
            }
            return future;
        } catch (RuntimeException e) {
            log.debug("Tool {} threw synchronously", toolName, e);
            return CompletableFuture.failedFuture(e);
        }
    }
}

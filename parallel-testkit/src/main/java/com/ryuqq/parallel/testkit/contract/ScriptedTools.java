package com.ryuqq.parallel.testkit.contract;

import com.ryuqq.parallel.adapter.inmemory.tool.Tool;
import com.ryuqq.parallel.core.value.MapValue;
import com.ryuqq.parallel.core.value.Value;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted tool implementations for Contract Tests.
 *
 * <p>Every tool completes asynchronously or immediately and never blocks a thread,
 * so timing-sensitive scenarios stay reproducible.</p>
 *
 * <p><strong>Available Tools:</strong></p>
 * <ul>
 *   <li>{@link #returning(Object)}: succeeds with a fixed value</li>
 *   <li>{@link #echo()}: succeeds with its own parameters</li>
 *   <li>{@link #failing(String)}: always fails</li>
 *   <li>{@link #delayed(long, Object)}: succeeds after a delay</li>
 *   <li>{@link #never()}: never completes</li>
 *   <li>{@link FlakyTool}: fails a fixed number of times, then succeeds</li>
 *   <li>{@link ConcurrencyProbe}: records start order and peak concurrency</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedTools {

    private ScriptedTools() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Tool returning(Object value) {
        Value result = Value.of(value);
        return params -> CompletableFuture.completedFuture(result);
    }

    public static Tool echo() {
        return params -> CompletableFuture.completedFuture(params);
    }

    public static Tool failing(String message) {
        return params -> CompletableFuture.failedFuture(new IllegalStateException(message));
    }

    /**
     * Succeeds after the given delay without holding a thread.
     *
     * @param delayMs delay in milliseconds
     * @param value result value
     * @return tool
     */
    public static Tool delayed(long delayMs, Object value) {
        Value result = Value.of(value);
        return params -> CompletableFuture.supplyAsync(() -> result, after(delayMs));
    }

    public static Tool never() {
        return params -> new CompletableFuture<>();
    }

    private static Executor after(long delayMs) {
        return CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Fails the first {@code failures} invocations, then succeeds.
     */
    public static final class FlakyTool implements Tool {

        private final int failures;
        private final Value result;
        private final AtomicInteger attempts = new AtomicInteger();

        public FlakyTool(int failures, Object result) {
            if (failures < 0) {
                throw new IllegalArgumentException("failures must be non-negative (current: " + failures + ")");
            }
            this.failures = failures;
            this.result = Value.of(result);
        }

        @Override
        public CompletableFuture<Value> invoke(MapValue params) {
            int attempt = attempts.incrementAndGet();
            if (attempt <= failures) {
                return CompletableFuture.failedFuture(new IllegalStateException("attempt " + attempt + " failed"));
            }
            return CompletableFuture.completedFuture(result);
        }

        public int attempts() {
            return attempts.get();
        }
    }

    /**
     * Tracks how many invocations overlap.
     *
     * <p>Each invocation records the {@code label} parameter (or "?" when absent)
     * and completes after {@code delayMs}.</p>
     */
    public static final class ConcurrencyProbe implements Tool {

        private final long delayMs;
        private final AtomicInteger current = new AtomicInteger();
        private final AtomicInteger peak = new AtomicInteger();
        private final List<String> startOrder = new CopyOnWriteArrayList<>();

        public ConcurrencyProbe(long delayMs) {
            this.delayMs = delayMs;
        }

        @Override
        public CompletableFuture<Value> invoke(MapValue params) {
            String label = params.get("label").map(value -> String.valueOf(value.toJava())).orElse("?");
            startOrder.add(label);
            peak.accumulateAndGet(current.incrementAndGet(), Math::max);

            CompletableFuture<Value> future = new CompletableFuture<>();
            after(delayMs).execute(() -> {
                current.decrementAndGet();
                future.complete(Value.of(label));
            });
            return future;
        }

        public int peakConcurrency() {
            return peak.get();
        }

        public List<String> startOrder() {
            return List.copyOf(startOrder);
        }
    }
}

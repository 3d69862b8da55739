package com.ryuqq.parallel.adapter.inmemory.tool;

import com.ryuqq.parallel.core.value.MapValue;
import com.ryuqq.parallel.core.value.Value;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous tool registered in {@link InMemoryToolRegistry}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Tool {

    /**
     * Invokes the tool.
     *
     * @param params resolved parameters
     * @return future completed with the tool output
     */
    CompletableFuture<Value> invoke(MapValue params);
}

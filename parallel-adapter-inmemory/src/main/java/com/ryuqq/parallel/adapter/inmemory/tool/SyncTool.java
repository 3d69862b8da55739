package com.ryuqq.parallel.adapter.inmemory.tool;

import com.ryuqq.parallel.core.value.MapValue;
import com.ryuqq.parallel.core.value.Value;

/**
 * Blocking tool. {@link InMemoryToolRegistry} runs it on its executor
 * so that the calling thread is never blocked.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SyncTool {

    /**
     * Runs the tool.
     *
     * @param params resolved parameters
     * @return tool output (null is reported as a null value)
     * @throws Exception any failure, recorded as the task error
     */
    Value apply(MapValue params) throws Exception;
}

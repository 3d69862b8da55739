package com.ryuqq.parallel.adapter.inmemory.tool;

import com.ryuqq.parallel.core.error.CodedError;

/**
 * Thrown when a task names a tool that is not registered.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UnknownToolException extends RuntimeException implements CodedError {

    public static final String ERROR_CODE = "UNKNOWN_TOOL";

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }

    @Override
    public String errorCode() {
        return ERROR_CODE;
    }
}

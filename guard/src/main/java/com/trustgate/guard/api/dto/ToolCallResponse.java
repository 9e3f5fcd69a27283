package com.trustgate.guard.api.dto;

import com.trustgate.guard.tool.ToolError;
import com.trustgate.guard.tool.ToolResult;

/**
 * Response body for POST /sessions/{id}/tools/{tool}. Exactly one of
 * {@code output} and {@code error} is non-null; a failed call is still HTTP 200.
 */
public record ToolCallResponse(
        String    tool,
        boolean   success,
        String    output,
        ToolError error
) {
    public static ToolCallResponse from(String tool, ToolResult result) {
        return new ToolCallResponse(tool, result.success(), result.output(), result.error());
    }
}

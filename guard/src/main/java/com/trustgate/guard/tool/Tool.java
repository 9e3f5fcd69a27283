package com.trustgate.guard.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A capability the agent can call. Every tool is a Spring {@code @Component};
 * the {@link ToolRegistry} collects them at startup.
 *
 * <p>{@link #execute} reports policy, quota and I/O failures as a failed
 * {@link ToolResult}. It may throw {@link ToolArgumentException} for malformed
 * arguments; the registry turns that, and any other unexpected exception,
 * into a result as well, so one bad call never ends the session.
 */
public interface Tool {

    ToolManifest manifest();

    ToolResult execute(JsonNode arguments, ToolSession session);
}

package com.trustgate.guard.tool;

import java.util.Objects;

/**
 * Outcome of one tool call: either an output string or a {@link ToolError}.
 *
 * Failures are values, not exceptions, so a failed call never ends the
 * agent's session.
 */
public record ToolResult(String output, ToolError error) {

    public ToolResult {
        if ((output == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of output or error must be set");
        }
    }

    public static ToolResult ok(String output) {
        return new ToolResult(Objects.requireNonNull(output, "output"), null);
    }

    public static ToolResult failed(ToolError error) {
        return new ToolResult(null, Objects.requireNonNull(error, "error"));
    }

    public static ToolResult failed(ToolError.Kind kind, String message) {
        return failed(ToolError.of(kind, message));
    }

    public boolean success() { return error == null; }

    /** True if this is a failure of the given kind. */
    public boolean failedWith(ToolError.Kind kind) {
        return error != null && error.kind() == kind;
    }

    /** What the agent reads on its next turn. */
    public String render() {
        return success() ? output : error.message();
    }
}

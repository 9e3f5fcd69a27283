package com.trustgate.guard.tool;

import java.util.Map;
import java.util.Objects;

/**
 * Structured failure of a tool call.
 *
 * {@link #kind()} lets the orchestrator branch programmatically (retry with a
 * different path, shrink a read, abort); {@link #details()} carries the values
 * a caller needs to self-correct (cap, actual size, matched pattern, permitted
 * paths). {@link #message()} is the human/LLM rendering of the same data.
 */
public record ToolError(Kind kind, String message, Map<String, Object> details) {

    public enum Kind {
        POLICY_DENIED,
        QUOTA_EXCEEDED,
        AMBIGUOUS_EDIT,
        NOT_FOUND,
        IO_ERROR,
        COMMAND_BLOCKED,
        TIMEOUT,
        INVALID_SPECIFIER,
        NOT_CONFIGURED,
        INVALID_ARGUMENTS,
        INTERNAL_ERROR
    }

    public ToolError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ToolError of(Kind kind, String message) {
        return new ToolError(kind, message, Map.of());
    }

    public static ToolError of(Kind kind, String message, Map<String, Object> details) {
        return new ToolError(kind, message, details);
    }
}

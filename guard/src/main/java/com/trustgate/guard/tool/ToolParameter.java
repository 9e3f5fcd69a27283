package com.trustgate.guard.tool;

/**
 * One argument of a tool's JSON function schema.
 *
 * @param type JSON schema type: {@code string}, {@code integer} or {@code array} (of strings)
 */
public record ToolParameter(String name, String type, String description, boolean required) {

    public static ToolParameter required(String name, String type, String description) {
        return new ToolParameter(name, type, description, true);
    }

    public static ToolParameter optional(String name, String type, String description) {
        return new ToolParameter(name, type, description, false);
    }
}

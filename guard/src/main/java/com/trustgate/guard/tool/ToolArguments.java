package com.trustgate.guard.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/** Typed access to a tool call's JSON arguments. */
public final class ToolArguments {

    private ToolArguments() {}

    public static String requireString(JsonNode args, String name) {
        JsonNode node = args.get(name);
        if (node == null || node.isNull()) {
            throw new ToolArgumentException("missing required argument '" + name + "'");
        }
        if (!node.isTextual()) {
            throw new ToolArgumentException("argument '" + name + "' must be a string");
        }
        return node.asText();
    }

    public static String optionalString(JsonNode args, String name, String defaultValue) {
        JsonNode node = args.get(name);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isTextual()) {
            throw new ToolArgumentException("argument '" + name + "' must be a string");
        }
        return node.asText();
    }

    /** Null when absent. */
    public static Integer optionalInt(JsonNode args, String name) {
        JsonNode node = args.get(name);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ToolArgumentException("argument '" + name + "' must be an integer");
        }
        return node.asInt();
    }

    public static List<String> requireStringList(JsonNode args, String name) {
        JsonNode node = args.get(name);
        if (node == null || node.isNull()) {
            throw new ToolArgumentException("missing required argument '" + name + "'");
        }
        return toStringList(node, name);
    }

    public static List<String> optionalStringList(JsonNode args, String name) {
        JsonNode node = args.get(name);
        return node == null || node.isNull() ? List.of() : toStringList(node, name);
    }

    private static List<String> toStringList(JsonNode node, String name) {
        if (!node.isArray()) {
            throw new ToolArgumentException("argument '" + name + "' must be an array of strings");
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new ToolArgumentException("argument '" + name + "' must contain only strings");
            }
            values.add(element.asText());
        }
        return values;
    }
}

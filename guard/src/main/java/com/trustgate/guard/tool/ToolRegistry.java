package com.trustgate.guard.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process tool registry.
 *
 * All {@link Tool} beans are collected at startup via constructor injection.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Lookup by name ({@link #get}).</li>
 *   <li>Instrumented execution ({@link #execute}): every call runs with the
 *       {@code sessionId} and {@code tool} MDC keys set, is timed and counted,
 *       and is checked against the session's allowed-tool list.</li>
 *   <li>Function definitions ({@link #definitions}): JSON schemas for the
 *       tools a given session may call, always in sync with the registered
 *       set.</li>
 * </ol>
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;
    private final ObjectMapper  json;

    public ToolRegistry(List<Tool> allTools, MeterRegistry meterRegistry, ObjectMapper objectMapper) {
        this.meterRegistry = meterRegistry;
        this.json          = objectMapper;
        for (Tool tool : allTools) {
            Tool previous = tools.put(tool.manifest().name(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.manifest().name());
            }
            log.info("Registered tool '{}' v{} [{}]",
                    tool.manifest().name(),
                    tool.manifest().version(),
                    tool.manifest().access());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Tool get(String name) {
        Tool tool = tools.get(name);
        if (tool == null) {
            throw new ToolNotFoundException(name);
        }
        return tool;
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    /** Returns all registered tool names (sorted). */
    public List<String> toolNames() {
        return tools.keySet().stream().sorted().toList();
    }

    /**
     * Tools offered to a session: its allowed list, minus {@code INTERACT}
     * tools when the session is not interactive.
     */
    public List<String> availableTools(ToolSession session) {
        return tools.values().stream()
                .map(Tool::manifest)
                .filter(m -> session.allows(m.name()))
                .filter(m -> session.interactive() || m.access() != ToolAccess.INTERACT)
                .map(ToolManifest::name)
                .sorted()
                .toList();
    }

    // ------------------------------------------------------------------
    // Instrumented execution
    // ------------------------------------------------------------------

    /**
     * Execute a named tool for a session.
     *
     * <pre>
     *   trustgate.tool.calls{tool, status="success|policy_denied|quota_exceeded|..."}
     *   trustgate.tool.duration{tool, access="read|write|execute|interact"}
     * </pre>
     *
     * Never throws for a registered tool: argument and unexpected errors come
     * back as INVALID_ARGUMENTS and INTERNAL_ERROR results.
     *
     * @throws ToolNotFoundException if no tool has this name
     */
    public ToolResult execute(String toolName, JsonNode arguments, ToolSession session) {
        Tool tool = get(toolName);
        String accessTag = tool.manifest().access().name().toLowerCase();
        JsonNode args = arguments == null || arguments.isNull() ? json.createObjectNode() : arguments;

        MDC.put("sessionId", session.id());
        MDC.put("tool", toolName);
        Timer.Sample sample = Timer.start(meterRegistry);
        ToolResult result;
        try {
            if (!session.allows(toolName)) {
                log.warn("Tool '{}' is not in the session's allowed list", toolName);
                result = ToolResult.failed(ToolError.of(ToolError.Kind.POLICY_DENIED,
                        "Error: tool '" + toolName + "' is not available to this agent.",
                        Map.of("tool", toolName)));
            } else {
                result = tool.execute(args, session);
            }
        } catch (ToolArgumentException e) {
            result = ToolResult.failed(ToolError.Kind.INVALID_ARGUMENTS,
                    "Error: invalid arguments for " + toolName + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error in tool '{}'", toolName, e);
            result = ToolResult.failed(ToolError.Kind.INTERNAL_ERROR,
                    "Error: unexpected failure in " + toolName + ": " + e.getMessage());
        } finally {
            sample.stop(meterRegistry.timer("trustgate.tool.duration",
                    "tool", toolName, "access", accessTag));
            MDC.remove("tool");
            MDC.remove("sessionId");
        }

        String status = result.success() ? "success" : result.error().kind().name().toLowerCase();
        meterRegistry.counter("trustgate.tool.calls", "tool", toolName, "status", status).increment();
        return result;
    }

    // ------------------------------------------------------------------
    // Function definitions
    // ------------------------------------------------------------------

    /**
     * JSON function definitions for every tool in {@link #availableTools}:
     * <pre>
     * {"type":"function","function":{"name":..,"description":..,
     *   "parameters":{"type":"object","properties":{..},"required":[..]}}}
     * </pre>
     */
    public ArrayNode definitions(ToolSession session) {
        ArrayNode defs = json.createArrayNode();
        for (String name : availableTools(session)) {
            defs.add(definition(tools.get(name).manifest()));
        }
        return defs;
    }

    private ObjectNode definition(ToolManifest manifest) {
        ObjectNode properties = json.createObjectNode();
        ArrayNode  required   = json.createArrayNode();
        for (ToolParameter param : manifest.parameters()) {
            ObjectNode schema = properties.putObject(param.name());
            schema.put("type", param.type());
            if ("array".equals(param.type())) {
                schema.putObject("items").put("type", "string");
            }
            schema.put("description", param.description());
            if (param.required()) {
                required.add(param.name());
            }
        }

        ObjectNode parameters = json.createObjectNode();
        parameters.put("type", "object");
        parameters.set("properties", properties);
        parameters.set("required", required);

        ObjectNode function = json.createObjectNode();
        function.put("name", manifest.name());
        function.put("description", manifest.description());
        function.set("parameters", parameters);

        ObjectNode def = json.createObjectNode();
        def.put("type", "function");
        def.set("function", function);
        return def;
    }
}

package com.trustgate.guard.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustgate.guard.quota.ReadQuotaEnforcer;
import com.trustgate.guard.tool.*;
import org.springframework.stereotype.Component;

import java.util.List;

/** Batch read; output is a JSON object keyed by the paths exactly as given. */
@Component
public class ReadFilesTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "read_files", "1.0.0",
            "Read several files at once. Returns a JSON object mapping each path to its content, "
            + "or to an 'Error: ...' string if that file could not be read.",
            ToolAccess.READ,
            List.of(ToolParameter.required("file_paths", "array", "Paths to read.")));

    private final ReadQuotaEnforcer quota;
    private final ObjectMapper      json;

    public ReadFilesTool(ReadQuotaEnforcer quota, ObjectMapper objectMapper) {
        this.quota = quota;
        this.json  = objectMapper;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public ToolResult execute(JsonNode args, ToolSession session) {
        List<String> paths = ToolArguments.requireStringList(args, "file_paths");
        return ToolResult.ok(quota.readFiles(paths, session.workdir()).toJson(json));
    }
}

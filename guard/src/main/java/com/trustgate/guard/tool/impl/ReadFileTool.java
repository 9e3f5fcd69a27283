package com.trustgate.guard.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.trustgate.guard.quota.ReadQuotaEnforcer;
import com.trustgate.guard.tool.*;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ReadFileTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "read_file", "1.0.0",
            "Read a text file. Without offset/limit the whole file is returned, up to the size limit; "
            + "for larger files pass offset (1-based first line) and/or limit (line count).",
            ToolAccess.READ,
            List.of(ToolParameter.required("file_path", "string", "Path to the file, absolute or relative to the working directory."),
                    ToolParameter.optional("offset", "integer", "First line to return, 1-based."),
                    ToolParameter.optional("limit", "integer", "Number of lines to return.")));

    private final ReadQuotaEnforcer quota;

    public ReadFileTool(ReadQuotaEnforcer quota) {
        this.quota = quota;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public ToolResult execute(JsonNode args, ToolSession session) {
        return quota.readFile(
                session.resolve(ToolArguments.requireString(args, "file_path")),
                ToolArguments.optionalInt(args, "offset"),
                ToolArguments.optionalInt(args, "limit"));
    }
}

package com.trustgate.guard.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.trustgate.guard.quota.GlobResult;
import com.trustgate.guard.quota.ReadQuotaEnforcer;
import com.trustgate.guard.tool.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Component
public class ListFilesTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "list_files", "1.0.0",
            "List paths matching a glob pattern (e.g. '**/*.py'), relative to workdir.",
            ToolAccess.READ,
            List.of(ToolParameter.required("pattern", "string", "Glob pattern; ** matches across directories."),
                    ToolParameter.optional("workdir", "string", "Directory to search from; defaults to the working directory.")));

    private final ReadQuotaEnforcer quota;

    public ListFilesTool(ReadQuotaEnforcer quota) {
        this.quota = quota;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public ToolResult execute(JsonNode args, ToolSession session) {
        String pattern = ToolArguments.requireString(args, "pattern");
        Path   workdir = session.resolve(ToolArguments.optionalString(args, "workdir", "."));
        GlobResult result;
        try {
            result = quota.listFiles(pattern, workdir);
        } catch (IllegalArgumentException e) {
            throw new ToolArgumentException(e.getMessage());
        } catch (IOException e) {
            return ToolResult.failed(ToolError.Kind.IO_ERROR, "Error listing files: " + e);
        }
        if (result.paths().isEmpty()) {
            return ToolResult.ok("No files matched '" + pattern + "'");
        }
        return ToolResult.ok(result.render());
    }
}

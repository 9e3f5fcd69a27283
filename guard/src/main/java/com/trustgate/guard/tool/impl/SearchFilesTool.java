package com.trustgate.guard.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.trustgate.guard.process.ContentSearch;
import com.trustgate.guard.tool.*;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class SearchFilesTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "search_files", "1.0.0",
            "Search file contents recursively for a regular expression (grep). "
            + "Returns matching lines as path:line:text.",
            ToolAccess.READ,
            List.of(ToolParameter.required("pattern", "string", "Basic regular expression to search for."),
                    ToolParameter.optional("path", "string", "File or directory to search; defaults to the working directory."),
                    ToolParameter.optional("include", "string", "Only search files whose name matches this glob, e.g. '*.py'.")));

    private final ContentSearch search;

    public SearchFilesTool(ContentSearch search) {
        this.search = search;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public ToolResult execute(JsonNode args, ToolSession session) {
        return search.search(
                ToolArguments.requireString(args, "pattern"),
                session.resolve(ToolArguments.optionalString(args, "path", ".")),
                ToolArguments.optionalString(args, "include", null),
                session.workdir());
    }
}

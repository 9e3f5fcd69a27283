package com.trustgate.guard.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.trustgate.guard.tool.*;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EditFileTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "edit_file", "1.0.0",
            "Replace exactly one occurrence of old_string with new_string. Fails if old_string "
            + "is missing or occurs more than once; include surrounding lines to make it unique.",
            ToolAccess.WRITE,
            List.of(ToolParameter.required("file_path", "string", "Path of the file to edit."),
                    ToolParameter.required("old_string", "string", "Exact text to replace."),
                    ToolParameter.required("new_string", "string", "Replacement text.")));

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public ToolResult execute(JsonNode args, ToolSession session) {
        String path = ToolArguments.requireString(args, "file_path");
        return session.mutations().edit(
                session.resolve(path).toString(),
                ToolArguments.requireString(args, "old_string"),
                ToolArguments.requireString(args, "new_string"));
    }
}

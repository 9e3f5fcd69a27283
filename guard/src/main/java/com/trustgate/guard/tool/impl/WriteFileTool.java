package com.trustgate.guard.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.trustgate.guard.tool.*;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class WriteFileTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "write_file", "1.0.0",
            "Create or overwrite a file with the given content. Missing parent directories are created.",
            ToolAccess.WRITE,
            List.of(ToolParameter.required("file_path", "string", "Path of the file to write."),
                    ToolParameter.required("content", "string", "Complete new file content.")));

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public ToolResult execute(JsonNode args, ToolSession session) {
        String path    = ToolArguments.requireString(args, "file_path");
        String content = ToolArguments.requireString(args, "content");
        return session.mutations().write(session.resolve(path).toString(), content);
    }
}

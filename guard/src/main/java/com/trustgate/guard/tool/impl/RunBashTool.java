package com.trustgate.guard.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.trustgate.guard.process.ProcessLauncher;
import com.trustgate.guard.tool.*;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class RunBashTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "run_bash", "1.0.0",
            "Run a shell command and return its stdout, stderr and exit code. Destructive commands "
            + "are refused; commands are killed after the timeout.",
            ToolAccess.EXECUTE,
            List.of(ToolParameter.required("command", "string", "Shell command line."),
                    ToolParameter.optional("workdir", "string", "Directory to run in; defaults to the working directory.")));

    private final ProcessLauncher launcher;

    public RunBashTool(ProcessLauncher launcher) {
        this.launcher = launcher;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public ToolResult execute(JsonNode args, ToolSession session) {
        return launcher.runBash(
                ToolArguments.requireString(args, "command"),
                session.resolve(ToolArguments.optionalString(args, "workdir", ".")));
    }
}

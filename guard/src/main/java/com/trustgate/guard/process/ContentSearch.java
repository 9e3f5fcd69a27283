package com.trustgate.guard.process;

import com.trustgate.guard.audit.AuditEmitter;
import com.trustgate.guard.audit.AuditKind;
import com.trustgate.guard.quota.QuotaLimits;
import com.trustgate.guard.tool.ToolError;
import com.trustgate.guard.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Recursive content search via {@code grep}, always as an argument list: the
 * pattern and path are agent-supplied and must never be parsed by a shell.
 * Output is capped at the listing quota.
 */
public class ContentSearch {

    private static final Logger log = LoggerFactory.getLogger(ContentSearch.class);

    private final ProcessLauncher launcher;
    private final QuotaLimits     limits;
    private final AuditEmitter    audit;
    private final Duration        timeout;

    public ContentSearch(ProcessLauncher launcher, QuotaLimits limits, AuditEmitter audit, Duration timeout) {
        this.launcher = launcher;
        this.limits   = limits;
        this.audit    = audit;
        this.timeout  = timeout;
    }

    /** @param include file-name glob for {@code --include}; null searches every file */
    public ToolResult search(String pattern, Path path, String include, Path workdir) {
        List<String> argv = buildArgv(pattern, path, include);
        CommandResult result;
        try {
            result = launcher.execute(argv, workdir, timeout);
        } catch (CommandTimeoutException e) {
            return ToolResult.failed(ToolError.of(ToolError.Kind.TIMEOUT,
                    "Error: search timed out after " + timeout.toSeconds() + "s",
                    Map.of("timeoutSec", timeout.toSeconds())));
        } catch (IOException e) {
            log.warn("grep failed for pattern '{}': {}", pattern, e.toString());
            return ToolResult.failed(ToolError.Kind.IO_ERROR, "Error running search: " + e.getMessage());
        }

        List<String> lines = result.stdout().lines().toList();
        int cap = limits.maxGlobResults();
        String stdout = result.stdout();
        if (lines.size() > cap) {
            String warning = "search_files truncated: " + lines.size() + " matching lines for '" + pattern
                    + "', showing the first " + cap + " (limit " + cap + ")";
            audit.emit(AuditKind.WARNING, warning);
            stdout = String.join("\n", lines.subList(0, cap))
                    + "\n... [truncated: showing " + cap + " of " + lines.size() + " lines]\n";
        }
        return ToolResult.ok(new CommandResult(result.exitCode(), stdout, result.stderr(), result.elapsedMs())
                .toObservation());
    }

    static List<String> buildArgv(String pattern, Path path, String include) {
        List<String> argv = new ArrayList<>(List.of("grep", "-rn"));
        if (include != null && !include.isBlank()) {
            argv.add("--include=" + include);
        }
        argv.addAll(List.of("-e", pattern, "--", path.toString()));
        return argv;
    }
}

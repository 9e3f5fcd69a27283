package com.trustgate.guard.process;

import com.trustgate.guard.audit.AuditEmitter;
import com.trustgate.guard.audit.AuditKind;
import com.trustgate.guard.tool.ToolError;
import com.trustgate.guard.tool.ToolResult;

import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Installs one package with the project's package manager.
 *
 * The specifier is validated against a strict pattern (names, version and
 * extras syntax) before anything else; a rejected specifier never reaches a
 * shell. A valid one is single-quoted together with each word of the
 * configured prefix and delegated to {@link ProcessLauncher#runBash}, so the
 * command guard still sees it.
 */
public class PackageInstaller {

    static final Pattern VALID_SPECIFIER =
            Pattern.compile("^[a-zA-Z0-9._-]+[a-zA-Z0-9._\\-\\[\\]>=<,! ]*$");

    private final ProcessLauncher launcher;
    private final AuditEmitter    audit;

    public PackageInstaller(ProcessLauncher launcher, AuditEmitter audit) {
        this.launcher = launcher;
        this.audit    = audit;
    }

    public ToolResult install(String specifier, String installPrefix, Path workdir) {
        if (!VALID_SPECIFIER.matcher(specifier).matches()) {
            return ToolResult.failed(ToolError.of(ToolError.Kind.INVALID_SPECIFIER,
                    "Error: invalid package name: '" + specifier + "'", Map.of("specifier", specifier)));
        }
        if (installPrefix == null || installPrefix.isBlank()) {
            return ToolResult.failed(ToolError.of(ToolError.Kind.NOT_CONFIGURED,
                    "Error: no install command configured. Cannot install '" + specifier + "'.",
                    Map.of("specifier", specifier)));
        }
        String command = buildCommand(installPrefix, specifier);
        audit.emit(AuditKind.PACKAGE, "Installing " + specifier);
        return launcher.runBash(command, workdir);
    }

    static String buildCommand(String installPrefix, String specifier) {
        String prefix = Pattern.compile("\\s+").splitAsStream(installPrefix.strip())
                .map(PackageInstaller::quote)
                .collect(Collectors.joining(" "));
        return prefix + " " + quote(specifier);
    }

    static String quote(String word) {
        return "'" + word.replace("'", "'\"'\"'") + "'";
    }
}

package com.trustgate.guard.tool;

import com.trustgate.guard.mutation.MutationExecutor;
import com.trustgate.guard.policy.WritePolicy;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Set;

/**
 * One agent-role instance: its working directory, its write policy and the
 * mutation executor bound to that policy. Immutable; the orchestrator calls at
 * most one tool at a time per session.
 *
 * @param interactive  effective interactive mode (process flag AND requested flag)
 * @param installPrefix package-install command, e.g. "pip install"; blank if none
 * @param allowedTools  tools this session may call; null means every registered tool
 */
public record ToolSession(
        String           id,
        Path             workdir,
        WritePolicy      policy,
        boolean          interactive,
        String           installPrefix,
        Set<String>      allowedTools,
        MutationExecutor mutations,
        Instant          createdAt) {

    public ToolSession {
        allowedTools = allowedTools == null ? null : Set.copyOf(allowedTools);
        installPrefix = installPrefix == null ? "" : installPrefix;
    }

    public boolean allows(String toolName) {
        return allowedTools == null || allowedTools.contains(toolName);
    }

    /** Resolves an agent-supplied path against the working directory; absolute paths pass through. */
    public Path resolve(String path) {
        try {
            return workdir.resolve(path);
        } catch (InvalidPathException e) {
            throw new ToolArgumentException("invalid path '" + path + "': " + e.getReason());
        }
    }
}

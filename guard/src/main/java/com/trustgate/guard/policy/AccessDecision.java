package com.trustgate.guard.policy;

import com.trustgate.guard.tool.ToolError;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Verdict of {@link PathAccessController#checkWrite}.
 *
 * @param path           canonical path the verdict applies to; the literal absolute
 *                       path when canonicalization failed, null if even that failed
 * @param denial         null when permitted
 * @param reason         human-readable explanation; null when permitted
 * @param permittedPaths the owned set, filled only for {@link Denial#NOT_OWNED}
 */
public record AccessDecision(Path path, Denial denial, String reason, List<Path> permittedPaths) {

    public enum Denial {
        /** Inside the agent's own state directory. */
        INTERNAL_STATE,
        /** Listed in the policy's denied files. */
        EXPLICITLY_DENIED,
        /** Matches a test-file naming convention. */
        TEST_PATTERN,
        /** Not in the owned-file allowlist. */
        NOT_OWNED,
        /** The path could not be resolved (symlink loop, invalid characters). */
        UNRESOLVABLE
    }

    public AccessDecision {
        permittedPaths = permittedPaths == null ? List.of() : List.copyOf(permittedPaths);
    }

    public static AccessDecision permit(Path canonicalPath) {
        return new AccessDecision(canonicalPath, null, null, List.of());
    }

    public static AccessDecision deny(Path path, Denial denial, String reason) {
        return new AccessDecision(path, denial, reason, List.of());
    }

    public static AccessDecision notOwned(Path path, String reason, List<Path> permittedPaths) {
        return new AccessDecision(path, Denial.NOT_OWNED, reason, permittedPaths);
    }

    public boolean permitted() { return denial == null; }

    public ToolError toToolError() {
        if (permitted()) {
            throw new IllegalStateException("Write to " + path + " is permitted");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("path", String.valueOf(path));
        details.put("denial", denial.name());
        if (denial == Denial.NOT_OWNED) {
            details.put("permittedPaths", permittedPaths.stream().map(Path::toString).toList());
        }
        return ToolError.of(ToolError.Kind.POLICY_DENIED, reason, details);
    }
}

package com.trustgate.guard.tool;

import java.util.List;

/**
 * What the orchestrator supplies to open a session. Policy comes from here,
 * never from configuration files.
 *
 * @param ownedFiles   null for an unrestricted role; otherwise the allowlist (empty denies every write)
 * @param interactive  null to inherit the process flag; false opts out; true cannot opt in past the process flag
 * @param installPrefix null to use the configured default
 * @param allowedTools null for every tool
 */
public record SessionSpec(
        String       workdir,
        List<String> ownedFiles,
        List<String> deniedFiles,
        boolean      denyTestPatterns,
        Boolean      interactive,
        String       installPrefix,
        List<String> allowedTools) {

    public static SessionSpec unrestricted(String workdir) {
        return new SessionSpec(workdir, null, null, false, null, null, null);
    }
}

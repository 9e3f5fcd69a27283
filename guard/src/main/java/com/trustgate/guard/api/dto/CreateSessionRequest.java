package com.trustgate.guard.api.dto;

import com.trustgate.guard.tool.SessionSpec;

import java.util.List;

/**
 * Request body for POST /sessions.
 *
 * Required: workdir
 * Optional: ownedFiles (omit for an unrestricted role; [] denies every write),
 *   deniedFiles, denyTestPatterns, interactive (can only opt out of the
 *   process setting), installPrefix, allowedTools.
 */
public record CreateSessionRequest(
        String       workdir,
        List<String> ownedFiles,
        List<String> deniedFiles,
        Boolean      denyTestPatterns,
        Boolean      interactive,
        String       installPrefix,
        List<String> allowedTools) {

    public SessionSpec toSpec() {
        return new SessionSpec(workdir, ownedFiles, deniedFiles,
                Boolean.TRUE.equals(denyTestPatterns), interactive, installPrefix, allowedTools);
    }
}

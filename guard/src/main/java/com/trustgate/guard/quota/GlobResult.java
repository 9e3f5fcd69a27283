package com.trustgate.guard.quota;

import java.util.List;

/**
 * A possibly truncated listing.
 *
 * @param paths        matches relative to the working directory, sorted, at most the cap
 * @param truncated    true if matches were dropped
 * @param totalMatches matches found before truncation
 */
public record GlobResult(List<String> paths, boolean truncated, int totalMatches) {

    public GlobResult {
        paths = List.copyOf(paths);
    }

    public String render() {
        StringBuilder sb = new StringBuilder(String.join("\n", paths));
        if (truncated) {
            if (!paths.isEmpty()) {
                sb.append('\n');
            }
            sb.append("... [truncated: showing ").append(paths.size())
              .append(" of ").append(totalMatches).append(" matches]");
        }
        return sb.toString();
    }
}

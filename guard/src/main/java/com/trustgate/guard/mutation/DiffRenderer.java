package com.trustgate.guard.mutation;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.List;

/** Unified diffs for the audit trail, with {@code a/} and {@code b/} headers and three lines of context. */
final class DiffRenderer {

    private static final int CONTEXT_LINES = 3;

    private DiffRenderer() {}

    static String unified(String path, String before, String after) {
        List<String> original = before.lines().toList();
        List<String> revised  = after.lines().toList();
        Patch<String> patch = DiffUtils.diff(original, revised);
        String header = path.startsWith("/") ? path.substring(1) : path;
        List<String> diff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + header, "b/" + header, original, patch, CONTEXT_LINES);
        return String.join("\n", diff);
    }
}

package com.trustgate.guard.mutation;

import com.trustgate.guard.audit.AuditEmitter;
import com.trustgate.guard.audit.AuditKind;
import com.trustgate.guard.policy.AccessDecision;
import com.trustgate.guard.policy.PathAccessController;
import com.trustgate.guard.tool.ToolError;
import com.trustgate.guard.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Performs permitted writes and edits.
 *
 * <p>Every mutation is gated by {@link PathAccessController#checkWrite}; on a
 * denial nothing touches the filesystem. A permitted mutation lands on the
 * canonical path (so a write through a symlink updates its target), is
 * durable before success is reported, and leaves an audit trail:
 * <pre>
 *   write: WRITE, then DIFF (changed content) or CODE (new/identical), then FILE_CHANGE created|modified
 *   edit:  EDIT, then DIFF, then FILE_CHANGE edited
 * </pre>
 *
 * I/O failures come back as {@link ToolError}s; nothing here throws.
 */
public class MutationExecutor {

    private static final Logger log = LoggerFactory.getLogger(MutationExecutor.class);

    static final int AUDIT_MAX_LINES = 60;

    private final PathAccessController access;
    private final AuditEmitter         audit;

    public MutationExecutor(PathAccessController access, AuditEmitter audit) {
        this.access = access;
        this.audit  = audit;
    }

    // ------------------------------------------------------------------
    // write
    // ------------------------------------------------------------------

    public ToolResult write(String path, String content) {
        AccessDecision decision = access.checkWrite(path);
        if (!decision.permitted()) {
            return ToolResult.failed(decision.toToolError());
        }
        Path target = decision.path();

        String previous = null;
        if (Files.isRegularFile(target)) {
            try {
                previous = Files.readString(target, StandardCharsets.UTF_8);
            } catch (IOException e) {
                // Still overwritten; the audit trail just shows it as new content.
                log.debug("Could not read existing content of {} for diffing", target, e);
            }
        }
        boolean existed = Files.exists(target);

        audit.emit(AuditKind.WRITE, "Writing " + content.length() + " chars to " + target);
        try {
            DurableFiles.write(target, content);
        } catch (IOException e) {
            log.warn("Write to {} failed: {}", target, e.toString());
            return ioError("Error writing file " + path + ": " + e, target);
        }

        if (previous != null && !previous.equals(content)) {
            audit.emitBlock(AuditKind.DIFF, "PATCH " + path,
                    DiffRenderer.unified(path, previous, content), AUDIT_MAX_LINES);
        } else {
            audit.emitBlock(AuditKind.CODE, "NEW " + path + " (" + content.length() + " chars)",
                    content, AUDIT_MAX_LINES);
        }
        audit.emit(AuditKind.FILE_CHANGE, "path=" + target + " action=" + (existed ? "modified" : "created"));
        return ToolResult.ok("Successfully wrote to " + path);
    }

    // ------------------------------------------------------------------
    // edit
    // ------------------------------------------------------------------

    /** Replaces the single occurrence of {@code oldString}; zero or several occurrences change nothing. */
    public ToolResult edit(String path, String oldString, String newString) {
        if (oldString.isEmpty()) {
            return ToolResult.failed(ToolError.Kind.INVALID_ARGUMENTS, "Error: old_string must not be empty");
        }
        AccessDecision decision = access.checkWrite(path);
        if (!decision.permitted()) {
            return ToolResult.failed(decision.toToolError());
        }
        Path target = decision.path();

        if (!Files.isRegularFile(target)) {
            return ToolResult.failed(ToolError.of(ToolError.Kind.NOT_FOUND,
                    "Error: file not found: " + target, Map.of("path", target.toString())));
        }
        String content;
        try {
            content = Files.readString(target, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return ioError("Error reading " + target + ": " + e, target);
        }

        int occurrences = countOccurrences(content, oldString);
        if (occurrences == 0) {
            return ToolResult.failed(ToolError.of(ToolError.Kind.AMBIGUOUS_EDIT,
                    "Error: old_string not found in " + path,
                    Map.of("path", path, "occurrences", 0)));
        }
        if (occurrences > 1) {
            return ToolResult.failed(ToolError.of(ToolError.Kind.AMBIGUOUS_EDIT,
                    "Error: old_string found " + occurrences + " times in " + path
                    + ". Provide more context to make it unique.",
                    Map.of("path", path, "occurrences", occurrences)));
        }

        int at = content.indexOf(oldString);
        String updated = content.substring(0, at) + newString + content.substring(at + oldString.length());

        audit.emit(AuditKind.EDIT, "Editing " + target);
        try {
            DurableFiles.write(target, updated);
        } catch (IOException e) {
            log.warn("Edit of {} failed: {}", target, e.toString());
            return ioError("Error writing " + target + ": " + e, target);
        }

        audit.emitBlock(AuditKind.DIFF, "EDIT " + path,
                DiffRenderer.unified(path, content, updated), AUDIT_MAX_LINES);
        audit.emit(AuditKind.FILE_CHANGE, "path=" + target + " action=edited");
        return ToolResult.ok("Successfully edited " + path);
    }

    // Non-overlapping, left to right.
    static int countOccurrences(String content, String needle) {
        int count = 0;
        int from  = 0;
        while ((from = content.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }

    private static ToolResult ioError(String message, Path target) {
        return ToolResult.failed(ToolError.of(ToolError.Kind.IO_ERROR, message, Map.of("path", target.toString())));
    }
}

package com.trustgate.guard.quota;

import com.trustgate.guard.audit.AuditEmitter;
import com.trustgate.guard.audit.AuditKind;
import com.trustgate.guard.tool.ToolError;
import com.trustgate.guard.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounds what read-side tools hand back to the agent.
 *
 * <p>Two failure modes, on purpose:
 * <ul>
 *   <li>batch reads and listings degrade: they truncate to the cap, record a
 *       warning and return what fits;</li>
 *   <li>a whole-file read over the cap is refused outright with the cap and
 *       the actual size, since returning an unrequested prefix would look like
 *       the complete file.</li>
 * </ul>
 *
 * A line-ranged read ({@code offset} and/or {@code limit}) skips the file-size
 * check, but the selected lines are still bounded by the same byte cap, so a
 * huge {@code limit} cannot reopen the hole the size check closes.
 */
public class ReadQuotaEnforcer {

    private static final Logger log = LoggerFactory.getLogger(ReadQuotaEnforcer.class);

    private final QuotaLimits  limits;
    private final AuditEmitter audit;

    public ReadQuotaEnforcer(QuotaLimits limits, AuditEmitter audit) {
        this.limits = limits;
        this.audit  = audit;
    }

    public QuotaLimits limits() { return limits; }

    // ------------------------------------------------------------------
    // Single-file read
    // ------------------------------------------------------------------

    /**
     * @param offset first line to return, 1-based; null or below 1 means the first line
     * @param limit  number of lines; null means to end of file, below 1 is rejected
     */
    public ToolResult readFile(Path file, Integer offset, Integer limit) {
        String shown = file.toString();
        if (!Files.exists(file)) {
            return ToolResult.failed(ToolError.of(ToolError.Kind.NOT_FOUND,
                    "Error: file not found: " + shown, Map.of("path", shown)));
        }
        if (Files.isDirectory(file)) {
            return ToolResult.failed(ToolError.of(ToolError.Kind.IO_ERROR,
                    "Error: " + shown + " is a directory, not a file. Use list_files to see its contents.",
                    Map.of("path", shown)));
        }
        if (limit != null && limit < 1) {
            return ToolResult.failed(ToolError.of(ToolError.Kind.INVALID_ARGUMENTS,
                    "Error: limit must be at least 1, got " + limit, Map.of("limit", limit)));
        }
        try {
            if (offset == null && limit == null) {
                return readWhole(file, shown);
            }
            int start = offset == null ? 1 : Math.max(1, offset);
            return readSlice(file, shown, start, limit);
        } catch (CharacterCodingException e) {
            return ToolResult.failed(ToolError.of(ToolError.Kind.IO_ERROR,
                    "Error reading file " + shown + ": not valid UTF-8 text", Map.of("path", shown)));
        } catch (IOException e) {
            log.debug("Read of {} failed", shown, e);
            return ToolResult.failed(ToolError.of(ToolError.Kind.IO_ERROR,
                    "Error reading file " + shown + ": " + e, Map.of("path", shown)));
        }
    }

    private ToolResult readWhole(Path file, String shown) throws IOException {
        long size = Files.size(file);
        long cap  = limits.maxReadFileBytes();
        if (size > cap) {
            log.warn("Refusing full read of {}: {} bytes exceeds cap of {}", shown, size, cap);
            return ToolResult.failed(ToolError.of(ToolError.Kind.QUOTA_EXCEEDED,
                    "Error: file too large to read in full: " + shown + " is " + ByteSizes.format(size)
                    + ", the limit is " + ByteSizes.format(cap)
                    + ". Use offset and limit to read it in line ranges.",
                    Map.of("path", shown, "cap", cap, "actual", size)));
        }
        return ToolResult.ok(Files.readString(file, StandardCharsets.UTF_8));
    }

    private ToolResult readSlice(Path file, String shown, int start, Integer limit) throws IOException {
        long cap  = limits.maxReadFileBytes();
        long end  = limit == null ? Long.MAX_VALUE : (long) start + limit - 1;
        StringBuilder selected = new StringBuilder();
        StringBuilder line     = new StringBuilder();
        long sliceBytes = 0;
        int  total      = 0;

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            while (nextLine(reader, line)) {
                total++;
                if (total < start || total > end) {
                    continue;
                }
                sliceBytes += line.toString().getBytes(StandardCharsets.UTF_8).length;
                if (sliceBytes > cap) {
                    log.warn("Refusing slice of {} from line {}: over {} bytes", shown, start, cap);
                    return ToolResult.failed(ToolError.of(ToolError.Kind.QUOTA_EXCEEDED,
                            "Error: the requested lines of " + shown + " exceed the read limit of "
                            + ByteSizes.format(cap) + " (reached " + ByteSizes.format(sliceBytes)
                            + " by line " + total + "). Use a smaller limit.",
                            Map.of("path", shown, "cap", cap, "actual", sliceBytes, "line", total)));
                }
                selected.append(line);
            }
        }

        if (start > total) {
            return ToolResult.ok("[No lines: offset " + start + " is past the end of " + shown
                    + " (" + total + " lines)]\n");
        }
        long last = Math.min(end, total);
        return ToolResult.ok("[Lines " + start + "-" + last + " of " + total + "]\n" + selected);
    }

    /** Reads one line including its terminator into {@code line}; false at end of input. */
    private static boolean nextLine(BufferedReader reader, StringBuilder line) throws IOException {
        line.setLength(0);
        int c;
        while ((c = reader.read()) != -1) {
            line.append((char) c);
            if (c == '\n') {
                return true;
            }
        }
        return line.length() > 0;
    }

    // ------------------------------------------------------------------
    // Batch read
    // ------------------------------------------------------------------

    /**
     * Reads up to the batch cap of {@code paths}, resolving each against
     * {@code workdir}. Never fails as a whole: every processed path gets either
     * its content or an {@code Error:} string under its original key.
     */
    public BatchReadResult readFiles(List<String> paths, Path workdir) {
        List<String> warnings  = new ArrayList<>();
        List<String> processed = paths;
        int max = limits.maxBatchFiles();
        if (paths.size() > max) {
            processed = paths.subList(0, max);
            String warning = "read_files truncated: " + paths.size() + " paths requested, only the first "
                    + max + " were read (limit " + max + " files per call)";
            warnings.add(warning);
            audit.emit(AuditKind.WARNING, warning);
        }

        Map<String, String> entries = new LinkedHashMap<>();
        for (String path : processed) {
            entries.put(path, readBatchEntry(path, workdir));
        }
        return new BatchReadResult(entries, warnings);
    }

    private String readBatchEntry(String path, Path workdir) {
        Path file;
        try {
            file = workdir.resolve(path);
        } catch (InvalidPathException e) {
            return "Error: invalid path: " + e.getMessage();
        }
        if (!Files.exists(file)) {
            return "Error: file not found: " + path;
        }
        if (Files.isDirectory(file)) {
            return "Error: " + path + " is a directory";
        }
        try {
            long size = Files.size(file);
            long cap  = limits.maxBatchFileBytes();
            if (size > cap) {
                log.warn("Skipping {} in batch read: {} bytes exceeds cap of {}", path, size, cap);
                return "Error: file too large (" + ByteSizes.format(size) + ", limit "
                        + ByteSizes.format(cap) + "). Use read_file with offset and limit.";
            }
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            return "Error: " + path + " is not valid UTF-8 text";
        } catch (IOException e) {
            log.debug("Batch read of {} failed", path, e);
            return "Error: " + e;
        }
    }

    // ------------------------------------------------------------------
    // Listing
    // ------------------------------------------------------------------

    /**
     * Expands a glob relative to {@code workdir}. {@code *} stays within one
     * directory, {@code **} crosses directories, and a leading {@code **}{@code /}
     * also matches at the top level. Hidden entries are skipped unless the
     * pattern itself names a dot-entry.
     *
     * @throws IllegalArgumentException if the pattern is absolute or malformed
     */
    public GlobResult listFiles(String pattern, Path workdir) throws IOException {
        if (pattern.isEmpty() || pattern.startsWith("/")) {
            throw new IllegalArgumentException("pattern must be relative to the working directory: '" + pattern + "'");
        }
        PathMatcher matcher  = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        PathMatcher topLevel = pattern.startsWith("**/")
                ? FileSystems.getDefault().getPathMatcher("glob:" + pattern.substring(3))
                : null;
        boolean includeHidden = pattern.startsWith(".") || pattern.contains("/.");
        int maxDepth = pattern.contains("**") ? Integer.MAX_VALUE : pattern.split("/").length;

        List<String> matches = new ArrayList<>();
        Files.walkFileTree(workdir, EnumSet.noneOf(FileVisitOption.class), maxDepth, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(workdir)) {
                    return FileVisitResult.CONTINUE;
                }
                if (!includeHidden && isHidden(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                collect(dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (includeHidden || !isHidden(file)) {
                    collect(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.debug("Skipping unreadable entry {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }

            private void collect(Path entry) {
                Path rel = workdir.relativize(entry);
                if (matcher.matches(rel) || (topLevel != null && topLevel.matches(rel))) {
                    matches.add(rel.toString());
                }
            }
        });

        Collections.sort(matches);
        int cap = limits.maxGlobResults();
        if (matches.size() <= cap) {
            return new GlobResult(matches, false, matches.size());
        }
        String warning = "list_files truncated: " + matches.size() + " matches for '" + pattern
                + "', showing the first " + cap + " (limit " + cap + ")";
        audit.emit(AuditKind.WARNING, warning);
        return new GlobResult(matches.subList(0, cap), true, matches.size());
    }

    private static boolean isHidden(Path entry) {
        Path name = entry.getFileName();
        return name != null && name.toString().startsWith(".");
    }
}

package com.trustgate.guard.policy;

import com.trustgate.guard.audit.AuditEmitter;
import com.trustgate.guard.audit.AuditKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a write or edit to a path is permitted.
 *
 * <p>Every comparison runs on the canonical (symlink-resolved, absolute) path,
 * never on the caller's literal string: a link pointing outside the owned set
 * is denied however benign its name, and a link pointing into the owned set is
 * allowed wherever it lives.
 *
 * <p>Evaluation order is fixed, and every prohibition is checked before the
 * allowlist so that ownership can never re-grant a protected file:
 * <ol>
 *   <li>internal state directory (absolute, checked on literal and canonical form)</li>
 *   <li>explicitly denied files</li>
 *   <li>test-file naming conventions, when enabled</li>
 *   <li>unrestricted role → permit</li>
 *   <li>owned files → permit, otherwise deny listing the owned set</li>
 * </ol>
 *
 * One instance per agent-role session; it holds no mutable state.
 */
public class PathAccessController {

    private static final Logger log = LoggerFactory.getLogger(PathAccessController.class);

    private final WritePolicy  policy;
    private final String       stateDirName;
    private final AuditEmitter audit;
    private final Path         projectRoot;

    public PathAccessController(WritePolicy policy, String stateDirName, AuditEmitter audit) {
        this(policy, stateDirName, audit, null);
    }

    /**
     * @param projectRoot canonical project directory; test-file patterns are
     *                    matched on paths relative to it, so a checkout that
     *                    itself lives under e.g. {@code ~/test/} is not all
     *                    "test files". Null matches on the absolute path.
     */
    public PathAccessController(WritePolicy policy, String stateDirName, AuditEmitter audit, Path projectRoot) {
        this.policy       = policy;
        this.stateDirName = stateDirName;
        this.audit        = audit;
        this.projectRoot  = projectRoot;
    }

    public WritePolicy policy() { return policy; }

    public AccessDecision checkWrite(String path) {
        Path literal;
        try {
            literal = Path.of(path).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            return unresolvable(path, null, e);
        }
        Path canonical;
        try {
            canonical = PathCanonicalizer.canonicalize(Path.of(path));
        } catch (IOException e) {
            return unresolvable(path, literal, e);
        }
        return checkCanonical(literal, canonical);
    }

    private AccessDecision unresolvable(String path, Path literal, Exception cause) {
        log.warn("Denying write to unresolvable path '{}': {}", path, cause.getMessage());
        return AccessDecision.deny(literal, AccessDecision.Denial.UNRESOLVABLE,
                "BLOCKED: Write to " + path + " denied: the path cannot be resolved ("
                + cause.getMessage() + ").");
    }

    private AccessDecision checkCanonical(Path literal, Path canonical) {
        if (isInsideStateDir(literal) || isInsideStateDir(canonical)) {
            audit.emit(AuditKind.WARNING, "BLOCKED write to internal state path: " + literal);
            return AccessDecision.deny(canonical, AccessDecision.Denial.INTERNAL_STATE,
                    "BLOCKED: Write to " + literal + " denied: this path is inside the " + stateDirName
                    + "/ directory, which holds the agent's internal state. "
                    + "Writing here would corrupt the running pipeline.");
        }

        if (policy.deniedFiles().contains(canonical)) {
            log.debug("Write to {} denied: explicitly denied", canonical);
            return AccessDecision.deny(canonical, AccessDecision.Denial.EXPLICITLY_DENIED,
                    "BLOCKED: Write to " + canonical + " denied: file is explicitly denied for this agent "
                    + "(read-only file).");
        }

        if (policy.denyTestPatterns() && TestFilePatterns.matches(patternSubject(canonical))) {
            log.debug("Write to {} denied: test file pattern", canonical);
            return AccessDecision.deny(canonical, AccessDecision.Denial.TEST_PATTERN,
                    "BLOCKED: Write to " + canonical + " denied: matches a test file pattern. "
                    + "Test files are read-only for this agent.");
        }

        if (!(policy.ownership() instanceof Ownership.RestrictedTo restricted) || restricted.permits(canonical)) {
            return AccessDecision.permit(canonical);
        }

        List<Path> owned = new ArrayList<>(restricted.paths());
        log.debug("Write to {} denied: not owned", canonical);
        return AccessDecision.notOwned(canonical,
                "BLOCKED: Write to " + canonical + " denied: this file is not in your owned files. "
                + "Do NOT modify files outside your ownership; write your implementation into YOUR files: "
                + owned,
                owned);
    }

    private Path patternSubject(Path canonical) {
        if (projectRoot != null && canonical.startsWith(projectRoot) && !canonical.equals(projectRoot)) {
            return projectRoot.relativize(canonical);
        }
        return canonical;
    }

    private boolean isInsideStateDir(Path path) {
        for (Path name : path) {
            if (name.toString().equals(stateDirName)) {
                return true;
            }
        }
        return false;
    }
}

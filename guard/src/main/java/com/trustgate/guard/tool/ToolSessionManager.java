package com.trustgate.guard.tool;

import com.trustgate.guard.audit.AuditEmitter;
import com.trustgate.guard.mutation.MutationExecutor;
import com.trustgate.guard.policy.PathAccessController;
import com.trustgate.guard.policy.PathCanonicalizer;
import com.trustgate.guard.policy.WritePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens, looks up and closes {@link ToolSession}s. Sessions live in memory
 * until closed.
 *
 * <p>The process-wide interactive flag ({@code trustgate.interactive}) is
 * read once at startup and never changes. Each session carries its own
 * effective flag, so concurrent sessions cannot leak interactivity into
 * each other: a session can opt out of the process flag but never opt in.
 */
@Service
public class ToolSessionManager {

    private static final Logger log = LoggerFactory.getLogger(ToolSessionManager.class);

    private final Map<String, ToolSession> sessions = new ConcurrentHashMap<>();

    private final AuditEmitter audit;
    private final String       stateDirName;
    private final boolean      processInteractive;
    private final String       defaultInstallPrefix;
    private final Clock        clock;

    public ToolSessionManager(
            AuditEmitter audit,
            @Value("${trustgate.state-dir-name:.trustgate}") String stateDirName,
            @Value("${trustgate.interactive:false}") boolean processInteractive,
            @Value("${trustgate.install.prefix:}") String defaultInstallPrefix) {
        this.audit                = audit;
        this.stateDirName         = stateDirName;
        this.processInteractive   = processInteractive;
        this.defaultInstallPrefix = defaultInstallPrefix;
        this.clock                = Clock.systemUTC();
    }

    public boolean processInteractive() { return processInteractive; }

    /**
     * @throws IllegalArgumentException if the working directory does not exist
     * @throws IOException              if a policy path cannot be resolved
     */
    public ToolSession open(SessionSpec spec) throws IOException {
        if (spec.workdir() == null || spec.workdir().isBlank()) {
            throw new IllegalArgumentException("workdir is required");
        }
        Path workdir = PathCanonicalizer.canonicalize(Path.of(spec.workdir()));
        if (!Files.isDirectory(workdir)) {
            throw new IllegalArgumentException("workdir is not a directory: " + spec.workdir());
        }

        WritePolicy policy = WritePolicy.of(
                resolveAll(workdir, spec.ownedFiles()),
                resolveAll(workdir, spec.deniedFiles()),
                spec.denyTestPatterns());
        boolean interactive = processInteractive && !Boolean.FALSE.equals(spec.interactive());
        String installPrefix = spec.installPrefix() != null ? spec.installPrefix() : defaultInstallPrefix;

        PathAccessController access = new PathAccessController(policy, stateDirName, audit, workdir);
        ToolSession session = new ToolSession(
                UUID.randomUUID().toString(),
                workdir,
                policy,
                interactive,
                installPrefix,
                spec.allowedTools() == null ? null : new HashSet<>(spec.allowedTools()),
                new MutationExecutor(access, audit),
                clock.instant());
        sessions.put(session.id(), session);

        log.info("Opened session {} in {} (ownership={}, interactive={})",
                session.id(), workdir,
                policy.ownership().isUnrestricted() ? "unrestricted" : "restricted",
                interactive);
        return session;
    }

    public Optional<ToolSession> find(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    /** @return false if no such session was open */
    public boolean close(String id) {
        ToolSession removed = sessions.remove(id);
        if (removed != null) {
            log.info("Closed session {}", id);
        }
        return removed != null;
    }

    public int openSessions() { return sessions.size(); }

    // Relative policy paths are relative to the session's working directory.
    private static List<String> resolveAll(Path workdir, List<String> paths) {
        if (paths == null) {
            return null;
        }
        return paths.stream().map(p -> workdir.resolve(p).toString()).toList();
    }
}

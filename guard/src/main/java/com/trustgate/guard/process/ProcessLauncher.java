package com.trustgate.guard.process;

import com.trustgate.guard.audit.AuditEmitter;
import com.trustgate.guard.audit.AuditKind;
import com.trustgate.guard.command.CommandGuard;
import com.trustgate.guard.command.CommandVerdict;
import com.trustgate.guard.tool.ToolError;
import com.trustgate.guard.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs commands for the agent.
 *
 * <p>{@link #runBash} is the shell path: the command string is screened by the
 * {@link CommandGuard} first, and a blocked command never reaches the
 * {@link ProcessSpawner}. {@link #execute} is the argument-list path used for
 * dynamically built commands (content search), where no shell ever parses the
 * arguments.
 *
 * <p>Both paths close the child's stdin immediately, drain stdout and stderr
 * on two threads, and on timeout destroy every descendant before the process
 * itself so nothing is left running in the background. Background jobs that
 * detach from the tree before the deadline are out of reach.
 */
public class ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessLauncher.class);

    private static final int      MAX_ECHO_CHARS = 200;
    private static final Duration REAP_GRACE     = Duration.ofSeconds(5);
    private static final List<String> VENV_DIRS  = List.of(".venv", "venv");

    private final CommandGuard   guard;
    private final ProcessSpawner spawner;
    private final AuditEmitter   audit;
    private final String         shell;
    private final Duration       bashTimeout;

    public ProcessLauncher(CommandGuard guard, ProcessSpawner spawner, AuditEmitter audit,
                           String shell, Duration bashTimeout) {
        this.guard       = guard;
        this.spawner     = spawner;
        this.audit       = audit;
        this.shell       = shell;
        this.bashTimeout = bashTimeout;
    }

    // ------------------------------------------------------------------
    // Shell path
    // ------------------------------------------------------------------

    public ToolResult runBash(String command, Path workdir) {
        CommandVerdict verdict = guard.evaluate(command, workdir);
        if (verdict.blocked()) {
            return ToolResult.failed(ToolError.of(ToolError.Kind.COMMAND_BLOCKED,
                    "Error: command blocked by safety filter. Pattern matched: " + verdict.matchedPattern(),
                    Map.of("pattern", verdict.matchedPattern(),
                           "description", verdict.rule().description())));
        }

        audit.emit(AuditKind.BASH, "$ " + abbreviate(command));
        try {
            CommandResult result = execute(List.of(shell, "-c", command), workdir, bashTimeout);
            log.debug("Command exited {} in {} ms: {}", result.exitCode(), result.elapsedMs(), abbreviate(command));
            return ToolResult.ok(result.toObservation());
        } catch (CommandTimeoutException e) {
            long seconds = e.getTimeout().toSeconds();
            return ToolResult.failed(ToolError.of(ToolError.Kind.TIMEOUT,
                    "Error: command timed out after " + seconds + "s: " + abbreviate(command)
                    + ". It may have left side effects (partial writes, started services) behind.",
                    Map.of("timeoutSec", seconds)));
        } catch (IOException e) {
            log.warn("Failed to run command '{}': {}", abbreviate(command), e.toString());
            return ToolResult.failed(ToolError.Kind.IO_ERROR,
                    "Error running command '" + abbreviate(command) + "': " + e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Argument-list path
    // ------------------------------------------------------------------

    /**
     * Runs {@code argv} in {@code workdir} with the project's virtualenv, if
     * any, activated.
     *
     * @throws CommandTimeoutException if the bound elapses; the tree is already destroyed
     * @throws IOException             if the process cannot be started or its output read
     */
    public CommandResult execute(List<String> argv, Path workdir, Duration timeout)
            throws IOException, CommandTimeoutException {
        long startedAt = System.nanoTime();
        long deadline  = startedAt + timeout.toNanos();

        Process process = spawner.start(withVirtualEnv(argv, workdir));
        process.getOutputStream().close();

        ExecutorService drains = Executors.newFixedThreadPool(2);
        try {
            Future<String> stdout = drains.submit(() -> readStream(process.getInputStream()));
            Future<String> stderr = drains.submit(() -> readStream(process.getErrorStream()));

            if (!process.waitFor(remaining(deadline), TimeUnit.NANOSECONDS)) {
                destroyTree(process);
                throw new CommandTimeoutException(String.join(" ", argv), timeout);
            }
            String out = await(process, stdout, deadline, argv, timeout);
            String err = await(process, stderr, deadline, argv, timeout);
            long elapsedMs = Duration.ofNanos(System.nanoTime() - startedAt).toMillis();
            return new CommandResult(process.exitValue(), out, err, elapsedMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process);
            throw new InterruptedIOException("Interrupted while waiting for " + argv.get(0));
        } finally {
            drains.shutdownNow();
        }
    }

    private ProcessRequest withVirtualEnv(List<String> argv, Path workdir) {
        Map<String, String> env = new HashMap<>();
        for (String dir : VENV_DIRS) {
            Path bin = workdir.resolve(dir).resolve("bin");
            if (Files.isDirectory(bin)) {
                String inherited = System.getenv().getOrDefault("PATH", "");
                env.put("PATH", bin.toAbsolutePath() + File.pathSeparator + inherited);
                env.put("VIRTUAL_ENV", workdir.toAbsolutePath().resolve(dir).toString());
                log.debug("Activated virtualenv at {}", bin);
                return new ProcessRequest(argv, workdir, env, Set.of("PYTHONHOME"));
            }
        }
        return new ProcessRequest(argv, workdir, env, Set.of());
    }

    // A shell that exited can still leave a background child holding the pipes open.
    private String await(Process process, Future<String> stream, long deadline, List<String> argv,
                         Duration timeout) throws IOException, InterruptedException, CommandTimeoutException {
        try {
            return stream.get(remaining(deadline), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            stream.cancel(true);
            process.getInputStream().close();
            process.getErrorStream().close();
            throw new CommandTimeoutException(String.join(" ", argv), timeout);
        } catch (ExecutionException e) {
            throw new IOException("Failed to read output of " + argv.get(0), e.getCause());
        }
    }

    private static void destroyTree(Process process) {
        List<ProcessHandle> descendants = process.descendants().toList();
        descendants.forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        log.warn("Destroyed timed-out process {} and {} descendant(s)", process.pid(), descendants.size());
        try {
            process.waitFor(REAP_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String readStream(InputStream stream) throws IOException {
        try (InputStream input = stream) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static long remaining(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    private static String abbreviate(String command) {
        return command.length() <= MAX_ECHO_CHARS ? command : command.substring(0, MAX_ECHO_CHARS) + "...";
    }
}

package com.trustgate.guard.process;

import com.trustgate.guard.audit.AuditKind;
import com.trustgate.guard.audit.RecordingAuditEmitter;
import com.trustgate.guard.command.CommandGuard;
import com.trustgate.guard.command.CommandRules;
import com.trustgate.guard.tool.ToolError;
import com.trustgate.guard.tool.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ProcessLauncherTest {

    @TempDir Path workdir;

    RecordingAuditEmitter audit;
    CommandGuard          guard;

    @BeforeEach
    void setUp() {
        audit = new RecordingAuditEmitter();
        guard = new CommandGuard(CommandRules.defaults(".trustgate"), audit);
    }

    private ProcessLauncher launcher(ProcessSpawner spawner, Duration timeout) {
        return new ProcessLauncher(guard, spawner, audit, "/bin/sh", timeout);
    }

    private ProcessLauncher local() {
        return launcher(new LocalProcessSpawner(), Duration.ofSeconds(30));
    }

    // ------------------------------------------------------------------
    // Guarded shell path
    // ------------------------------------------------------------------

    @Test
    void runBash_blockedCommand_neverSpawns() throws Exception {
        ProcessSpawner spawner = mock(ProcessSpawner.class);

        ToolResult result = launcher(spawner, Duration.ofSeconds(5)).runBash("rm -rf /", workdir);

        assertThat(result.failedWith(ToolError.Kind.COMMAND_BLOCKED)).isTrue();
        assertThat(result.render()).contains("blocked by safety filter").contains("Pattern matched:");
        assertThat(result.error().details()).containsKeys("pattern", "description");
        verify(spawner, never()).start(any());
        assertThat(audit.kinds()).containsExactly(AuditKind.WARNING);
    }

    @Test
    void runBash_echo_returnsObservationWithExitCode() {
        ToolResult result = local().runBash("echo hello; echo oops >&2", workdir);

        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo("Stdout:\nhello\n\nStderr:\noops\n\nExit Code: 0");
        assertThat(audit.kinds()).containsExactly(AuditKind.BASH);
        assertThat(audit.events().get(0).body()).isEqualTo("$ echo hello; echo oops >&2");
    }

    @Test
    void runBash_nonZeroExit_isStillAnObservation() {
        ToolResult result = local().runBash("exit 3", workdir);

        assertThat(result.success()).isTrue();
        assertThat(result.output()).endsWith("Exit Code: 3");
    }

    @Test
    void runBash_runsInWorkdir() throws Exception {
        Files.writeString(workdir.resolve("marker.txt"), "here");

        ToolResult result = local().runBash("cat marker.txt", workdir);

        assertThat(result.output()).startsWith("Stdout:\nhere\n");
    }

    @Test
    void runBash_stdinIsClosed() {
        ToolResult result = local().runBash("cat; echo done", workdir);

        assertThat(result.output()).contains("done").endsWith("Exit Code: 0");
    }

    @Test
    void runBash_timeout_killsAndReportsTimeout() {
        ProcessLauncher launcher = launcher(new LocalProcessSpawner(), Duration.ofSeconds(1));
        long started = System.nanoTime();

        ToolResult result = launcher.runBash("sleep 30", workdir);

        assertThat(result.failedWith(ToolError.Kind.TIMEOUT)).isTrue();
        assertThat(result.render()).contains("timed out after 1s");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(15));
    }

    @Test
    void runBash_timeout_killsBackgroundChildren() throws Exception {
        ProcessLauncher launcher = launcher(new LocalProcessSpawner(), Duration.ofSeconds(1));

        ToolResult result = launcher.runBash("(sleep 3; touch marker) & sleep 30", workdir);
        Thread.sleep(5_000);

        assertThat(result.failedWith(ToolError.Kind.TIMEOUT)).isTrue();
        assertThat(Files.exists(workdir.resolve("marker"))).isFalse();
    }

    @Test
    void runBash_globbedRemovalThroughSymlink_blockedAndNothingDeleted(@TempDir Path base) throws Exception {
        Path victim = Files.createDirectories(base.resolve("outside/victim"));
        Files.createDirectories(base.resolve("outside/sub"));
        Path work = Files.createDirectories(base.resolve("work"));
        Files.createSymbolicLink(work.resolve("lnk"), base.resolve("outside/sub"));

        ToolResult result = local().runBash("rm -rf ln*/../victim", work);

        assertThat(result.failedWith(ToolError.Kind.COMMAND_BLOCKED)).isTrue();
        assertThat(Files.isDirectory(victim)).isTrue();
    }

    @Test
    void runBash_braceExpandedRemoval_blockedAndNothingDeleted(@TempDir Path base) throws Exception {
        Path victim = Files.createDirectories(base.resolve("victim2"));
        Path work   = Files.createDirectories(base.resolve("work"));
        Files.createDirectories(work.resolve("build"));

        ToolResult result = local().runBash("rm -rf {build,../victim2}", work);

        assertThat(result.failedWith(ToolError.Kind.COMMAND_BLOCKED)).isTrue();
        assertThat(Files.isDirectory(victim)).isTrue();
    }

    @Test
    void runBash_spawnFailure_ioError() {
        ProcessSpawner failing = request -> { throw new java.io.IOException("no such shell"); };

        ToolResult result = launcher(failing, Duration.ofSeconds(5)).runBash("ls", workdir);

        assertThat(result.failedWith(ToolError.Kind.IO_ERROR)).isTrue();
        assertThat(result.render()).contains("no such shell");
    }

    // ------------------------------------------------------------------
    // Argument-list path
    // ------------------------------------------------------------------

    @Test
    void execute_argumentsAreNotShellParsed() throws Exception {
        CommandResult result = local().execute(List.of("echo", "$(whoami); rm -rf /"), workdir, Duration.ofSeconds(10));

        assertThat(result.exitCode()).isZero();
        assertThat(result.stdout()).isEqualTo("$(whoami); rm -rf /\n");
    }

    @Test
    void execute_timeout_throwsWithTimeout() {
        assertThatThrownBy(() -> local().execute(List.of("sleep", "30"), workdir, Duration.ofMillis(500)))
                .isInstanceOf(CommandTimeoutException.class)
                .satisfies(e -> assertThat(((CommandTimeoutException) e).getTimeout()).isEqualTo(Duration.ofMillis(500)));
    }

    @Test
    void execute_virtualEnvPresent_prependsBinAndUnsetsPythonHome() throws Exception {
        Files.createDirectories(workdir.resolve(".venv/bin"));
        AtomicReference<ProcessRequest> seen = new AtomicReference<>();
        ProcessSpawner recording = request -> {
            seen.set(request);
            return new LocalProcessSpawner().start(request);
        };

        launcher(recording, Duration.ofSeconds(10)).execute(List.of("true"), workdir, Duration.ofSeconds(10));

        ProcessRequest request = seen.get();
        assertThat(request.environment().get("PATH")).startsWith(workdir.resolve(".venv/bin").toAbsolutePath().toString());
        assertThat(request.environment()).containsEntry("VIRTUAL_ENV", workdir.resolve(".venv").toAbsolutePath().toString());
        assertThat(request.unset()).containsExactly("PYTHONHOME");
    }

    @Test
    void execute_noVirtualEnv_inheritsEnvironment() throws Exception {
        AtomicReference<ProcessRequest> seen = new AtomicReference<>();
        ProcessSpawner recording = request -> {
            seen.set(request);
            return new LocalProcessSpawner().start(request);
        };

        launcher(recording, Duration.ofSeconds(10)).execute(List.of("true"), workdir, Duration.ofSeconds(10));

        assertThat(seen.get().environment()).isEmpty();
        assertThat(seen.get().unset()).isEmpty();
    }
}

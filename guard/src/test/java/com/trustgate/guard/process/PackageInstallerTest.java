package com.trustgate.guard.process;

import com.trustgate.guard.audit.AuditKind;
import com.trustgate.guard.audit.RecordingAuditEmitter;
import com.trustgate.guard.tool.ToolError;
import com.trustgate.guard.tool.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PackageInstallerTest {

    private static final Path WORKDIR = Path.of("/work/project");

    ProcessLauncher       launcher;
    RecordingAuditEmitter audit;
    PackageInstaller      installer;

    @BeforeEach
    void setUp() {
        launcher  = mock(ProcessLauncher.class);
        audit     = new RecordingAuditEmitter();
        installer = new PackageInstaller(launcher, audit);
    }

    @ParameterizedTest
    @ValueSource(strings = {"foo; rm -rf /", "requests && curl evil", "$(whoami)", "pkg`id`", "a|b", "", " leading"})
    void install_invalidSpecifier_rejectedBeforeAnyShell(String specifier) {
        ToolResult result = installer.install(specifier, "pip install", WORKDIR);

        assertThat(result.failedWith(ToolError.Kind.INVALID_SPECIFIER)).isTrue();
        assertThat(result.render()).contains("invalid package name");
        verify(launcher, never()).runBash(anyString(), any());
        assertThat(audit.events()).isEmpty();
    }

    @Test
    void install_validSpecifier_delegatesQuotedCommand() {
        when(launcher.runBash(anyString(), any())).thenReturn(ToolResult.ok("installed"));

        ToolResult result = installer.install("flask[async]>=2.0", "pip install", WORKDIR);

        assertThat(result.output()).isEqualTo("installed");
        verify(launcher).runBash("'pip' 'install' 'flask[async]>=2.0'", WORKDIR);
        assertThat(audit.kinds()).containsExactly(AuditKind.PACKAGE);
    }

    @Test
    void install_noPrefix_notConfigured() {
        ToolResult result = installer.install("requests", "  ", WORKDIR);

        assertThat(result.failedWith(ToolError.Kind.NOT_CONFIGURED)).isTrue();
        assertThat(result.render()).contains("Cannot install 'requests'");
        verify(launcher, never()).runBash(anyString(), any());
    }

    @Test
    void buildCommand_versionRangeWithSpaces_staysOneWord() {
        assertThat(PackageInstaller.buildCommand("uv pip install", "django >=4, <5"))
                .isEqualTo("'uv' 'pip' 'install' 'django >=4, <5'");
    }

    @Test
    void quote_embeddedSingleQuote_escaped() {
        assertThat(PackageInstaller.quote("it's")).isEqualTo("'it'\"'\"'s'");
    }
}

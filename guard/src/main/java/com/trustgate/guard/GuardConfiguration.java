package com.trustgate.guard;

import com.trustgate.guard.audit.AuditEmitter;
import com.trustgate.guard.command.CommandGuard;
import com.trustgate.guard.command.CommandRules;
import com.trustgate.guard.process.ContentSearch;
import com.trustgate.guard.process.LocalProcessSpawner;
import com.trustgate.guard.process.PackageInstaller;
import com.trustgate.guard.process.ProcessLauncher;
import com.trustgate.guard.process.ProcessSpawner;
import com.trustgate.guard.quota.QuotaLimits;
import com.trustgate.guard.quota.ReadQuotaEnforcer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the process-wide guard components from {@code trustgate.*}
 * properties. Per-role components (path access, mutations) are built per
 * session by {@link com.trustgate.guard.tool.ToolSessionManager}.
 */
@Configuration
public class GuardConfiguration {

    @Bean
    public QuotaLimits quotaLimits(
            @Value("${trustgate.quota.max-read-file-bytes:1048576}")  long maxReadFileBytes,
            @Value("${trustgate.quota.max-batch-file-bytes:1048576}") long maxBatchFileBytes,
            @Value("${trustgate.quota.max-batch-files:100}")          int  maxBatchFiles,
            @Value("${trustgate.quota.max-glob-results:1000}")        int  maxGlobResults) {
        return new QuotaLimits(maxReadFileBytes, maxBatchFileBytes, maxBatchFiles, maxGlobResults);
    }

    @Bean
    public ReadQuotaEnforcer readQuotaEnforcer(QuotaLimits limits, AuditEmitter audit) {
        return new ReadQuotaEnforcer(limits, audit);
    }

    @Bean
    public CommandGuard commandGuard(
            @Value("${trustgate.state-dir-name:.trustgate}") String stateDirName,
            AuditEmitter audit) {
        return new CommandGuard(CommandRules.defaults(stateDirName), audit);
    }

    @Bean
    public ProcessSpawner processSpawner() {
        return new LocalProcessSpawner();
    }

    @Bean
    public ProcessLauncher processLauncher(
            CommandGuard guard,
            ProcessSpawner spawner,
            AuditEmitter audit,
            @Value("${trustgate.process.shell:/bin/sh}")       String shell,
            @Value("${trustgate.process.bash-timeout-sec:120}") int    bashTimeoutSec) {
        return new ProcessLauncher(guard, spawner, audit, shell, Duration.ofSeconds(bashTimeoutSec));
    }

    @Bean
    public ContentSearch contentSearch(
            ProcessLauncher launcher,
            QuotaLimits limits,
            AuditEmitter audit,
            @Value("${trustgate.process.search-timeout-sec:60}") int searchTimeoutSec) {
        return new ContentSearch(launcher, limits, audit, Duration.ofSeconds(searchTimeoutSec));
    }

    @Bean
    public PackageInstaller packageInstaller(ProcessLauncher launcher, AuditEmitter audit) {
        return new PackageInstaller(launcher, audit);
    }
}

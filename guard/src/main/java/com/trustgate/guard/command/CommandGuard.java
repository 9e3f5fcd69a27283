package com.trustgate.guard.command;

import com.trustgate.guard.audit.AuditEmitter;
import com.trustgate.guard.audit.AuditKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Screens a shell command string before it is spawned.
 *
 * Single pass over the {@link CommandRuleSet}: the first matching rule
 * decides. Overrides precede blocks in the table, so a command that matches
 * both is allowed. Pure apart from the audit warning on a block.
 */
public class CommandGuard {

    private static final Logger log = LoggerFactory.getLogger(CommandGuard.class);

    private static final int MAX_AUDIT_COMMAND_CHARS = 200;

    private final CommandRuleSet rules;
    private final AuditEmitter   audit;

    public CommandGuard(CommandRuleSet rules, AuditEmitter audit) {
        this.rules = rules;
        this.audit = audit;
    }

    public CommandRuleSet rules() { return rules; }

    public CommandVerdict evaluate(String command) {
        return evaluate(command, null);
    }

    /** {@code workdir} enables the project-scoped rm override; may be null. */
    public CommandVerdict evaluate(String command, Path workdir) {
        for (CommandRule rule : rules.rules()) {
            if (!rule.matches(command, workdir)) {
                continue;
            }
            if (rule.type() == CommandRule.Type.OVERRIDE) {
                log.debug("Command allowed by override '{}': {}", rule.pattern(), command);
                return CommandVerdict.allowedBy(rule);
            }
            log.warn("Blocked command ({}): {}", rule.description(), command);
            audit.emit(AuditKind.WARNING, "BLOCKED dangerous command: " + abbreviate(command));
            return CommandVerdict.blocked(rule);
        }
        return CommandVerdict.unmatched();
    }

    private static String abbreviate(String command) {
        return command.length() <= MAX_AUDIT_COMMAND_CHARS
                ? command
                : command.substring(0, MAX_AUDIT_COMMAND_CHARS) + "...";
    }
}

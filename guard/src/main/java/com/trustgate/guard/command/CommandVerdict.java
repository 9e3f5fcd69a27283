package com.trustgate.guard.command;

/**
 * Result of {@link CommandGuard#evaluate}. {@code rule} is the override that
 * allowed the command, the block rule that refused it, or null when no rule
 * matched.
 */
public record CommandVerdict(boolean allowed, CommandRule rule) {

    private static final CommandVerdict UNMATCHED = new CommandVerdict(true, null);

    /** No rule matched; the command is allowed. */
    public static CommandVerdict unmatched() { return UNMATCHED; }

    public static CommandVerdict allowedBy(CommandRule override) {
        return new CommandVerdict(true, override);
    }

    public static CommandVerdict blocked(CommandRule rule) {
        return new CommandVerdict(false, rule);
    }

    public boolean blocked() { return !allowed; }

    /** Pattern source of the matching block rule; null unless blocked. */
    public String matchedPattern() {
        return blocked() ? rule.pattern() : null;
    }
}

package com.trustgate.guard.command;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One entry of the command rule table.
 *
 * @param type        whether a match allows ({@code OVERRIDE}) or refuses ({@code BLOCK}) the command
 * @param pattern     regex source, or a symbolic name for non-regex rules; reported back on a block
 * @param description what the rule guards against (or why the override is safe)
 * @param matcher     the actual test
 */
public record CommandRule(Type type, String pattern, String description, Matcher matcher) {

    public enum Type { OVERRIDE, BLOCK }

    /** Tests a raw command string; {@code workdir} may be null. */
    @FunctionalInterface
    public interface Matcher {
        boolean matches(String command, Path workdir);
    }

    public CommandRule {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(matcher, "matcher");
    }

    /** Case-insensitive regex block rule. */
    public static CommandRule block(String regex, String description) {
        return new CommandRule(Type.BLOCK, regex, description, regexMatcher(regex));
    }

    /** Case-insensitive regex override rule. */
    public static CommandRule override(String regex, String description) {
        return new CommandRule(Type.OVERRIDE, regex, description, regexMatcher(regex));
    }

    public static CommandRule override(String name, String description, Matcher matcher) {
        return new CommandRule(Type.OVERRIDE, name, description, matcher);
    }

    public boolean matches(String command, Path workdir) {
        return matcher.matches(command, workdir);
    }

    private static Matcher regexMatcher(String regex) {
        Pattern compiled = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        return (command, workdir) -> compiled.matcher(command).find();
    }
}

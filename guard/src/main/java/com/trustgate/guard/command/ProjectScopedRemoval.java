package com.trustgate.guard.command;

import com.trustgate.guard.policy.PathCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Recognises a recursive {@code rm} whose every target resolves strictly
 * inside the working directory, e.g. {@code rm -rf build/ dist/} run from the
 * project root.
 *
 * <p>A match skips the blocklist entirely, so anything that could smuggle a
 * second command or widen the target set rejects the match and leaves the
 * command to the block rules: shell operators, substitutions, redirects,
 * home or variable expansion, the working directory itself, and the
 * internal state directory. Targets are resolved from their literal text,
 * so any glob or brace character rejects the match as well: the shell would
 * expand {@code ln*}{@code /../x} through a symlink, or {@code {a,../b}} into
 * two words, before {@code rm} sees them. Quoted glob characters are
 * rejected too.
 */
public class ProjectScopedRemoval {

    private static final Logger log = LoggerFactory.getLogger(ProjectScopedRemoval.class);

    private static final Pattern RECURSIVE_RM = Pattern.compile("\\brm\\s+-\\S*r", Pattern.CASE_INSENSITIVE);
    private static final Pattern SHELL_META   = Pattern.compile("[;&|<>`\\n]|\\$\\(");
    private static final Pattern EXPANSION    = Pattern.compile("[*?\\[\\]{}]");

    private final String stateDirName;

    public ProjectScopedRemoval(String stateDirName) {
        this.stateDirName = stateDirName;
    }

    public boolean matches(String command, Path workdir) {
        if (workdir == null || !RECURSIVE_RM.matcher(command).find()
                || SHELL_META.matcher(command).find() || EXPANSION.matcher(command).find()) {
            return false;
        }
        List<String> words;
        try {
            words = ShellWords.split(command);
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable rm command '{}': {}", command, e.getMessage());
            return false;
        }
        if (words.isEmpty() || !isRm(words.get(0))) {
            return false;
        }

        List<String> targets = new ArrayList<>();
        for (String word : words.subList(1, words.size())) {
            if (!word.startsWith("-")) {
                targets.add(word);
            }
        }
        if (targets.isEmpty()) {
            return false;
        }

        try {
            Path root = PathCanonicalizer.canonicalize(workdir);
            for (String target : targets) {
                if (!isScopedTarget(target, root)) {
                    return false;
                }
            }
            return true;
        } catch (IOException | InvalidPathException e) {
            log.debug("Cannot resolve rm targets of '{}': {}", command, e.getMessage());
            return false;
        }
    }

    private boolean isScopedTarget(String target, Path root) throws IOException {
        if (target.isEmpty() || target.startsWith("~") || target.contains("$")) {
            return false;
        }
        Path literal = Path.of(target);
        for (Path name : literal) {
            String part = name.toString();
            if (part.equals(stateDirName)) {
                return false;
            }
        }
        Path resolved = PathCanonicalizer.canonicalize(root.resolve(literal));
        for (Path name : resolved) {
            if (name.toString().equals(stateDirName)) {
                return false;
            }
        }
        return resolved.startsWith(root) && !resolved.equals(root);
    }

    private static boolean isRm(String word) {
        return word.equals("rm") || word.endsWith("/rm");
    }
}

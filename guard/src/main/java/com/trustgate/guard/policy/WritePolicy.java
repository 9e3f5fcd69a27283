package com.trustgate.guard.policy;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Write policy of one agent-role instance. Immutable once built; every path
 * it holds is canonical.
 *
 * @param ownership        owned-file allowlist, or unrestricted
 * @param deniedFiles      always write-denied, whatever the ownership says
 * @param denyTestPatterns deny any path that looks like a test file
 */
public record WritePolicy(Ownership ownership, Set<Path> deniedFiles, boolean denyTestPatterns) {

    public WritePolicy {
        if (ownership == null) {
            ownership = Ownership.unrestricted();
        }
        deniedFiles = deniedFiles == null ? Set.of() : Set.copyOf(deniedFiles);
    }

    public static WritePolicy unrestricted() {
        return new WritePolicy(Ownership.unrestricted(), Set.of(), false);
    }

    /**
     * Build a policy from caller-supplied paths, canonicalizing each one.
     *
     * @param ownedFiles  null for an unrestricted role; otherwise the allowlist (possibly empty)
     * @param deniedFiles null or empty for no explicit denials
     * @throws IOException if a path cannot be resolved (e.g. a symlink loop)
     */
    public static WritePolicy of(Collection<String> ownedFiles,
                                 Collection<String> deniedFiles,
                                 boolean denyTestPatterns) throws IOException {
        Ownership ownership = ownedFiles == null
                ? Ownership.unrestricted()
                : Ownership.restrictedTo(canonicalizeAll(ownedFiles));
        Set<Path> denied = deniedFiles == null ? Set.of() : canonicalizeAll(deniedFiles);
        return new WritePolicy(ownership, denied, denyTestPatterns);
    }

    private static Set<Path> canonicalizeAll(Collection<String> paths) throws IOException {
        Set<Path> out = new HashSet<>();
        for (String p : paths) {
            out.add(PathCanonicalizer.canonicalize(Path.of(p)));
        }
        return out;
    }
}

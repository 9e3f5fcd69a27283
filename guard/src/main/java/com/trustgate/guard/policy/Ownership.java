package com.trustgate.guard.policy;

import java.nio.file.Path;
import java.util.Set;
import java.util.TreeSet;

/**
 * Write ownership of an agent role: either {@link Unrestricted} (trusted
 * roles) or {@link RestrictedTo} an explicit set of canonical paths.
 *
 * An empty {@code RestrictedTo} denies every write; it is never read as
 * "no restriction".
 */
public abstract sealed class Ownership permits Ownership.Unrestricted, Ownership.RestrictedTo {

    private Ownership() {}

    public static Ownership unrestricted() {
        return Unrestricted.INSTANCE;
    }

    /** @param canonicalPaths paths already in canonical form */
    public static Ownership restrictedTo(Set<Path> canonicalPaths) {
        return new RestrictedTo(canonicalPaths);
    }

    public abstract boolean permits(Path canonicalPath);

    public abstract boolean isUnrestricted();

    public static final class Unrestricted extends Ownership {

        private static final Unrestricted INSTANCE = new Unrestricted();

        private Unrestricted() {}

        @Override public boolean permits(Path canonicalPath) { return true; }
        @Override public boolean isUnrestricted()            { return true; }
        @Override public String  toString()                  { return "Unrestricted"; }
    }

    public static final class RestrictedTo extends Ownership {

        private final Set<Path> paths;

        private RestrictedTo(Set<Path> paths) {
            this.paths = Set.copyOf(paths);
        }

        /** Owned paths, sorted for stable error messages. */
        public Set<Path> paths() {
            return new TreeSet<>(paths);
        }

        @Override public boolean permits(Path canonicalPath) { return paths.contains(canonicalPath); }
        @Override public boolean isUnrestricted()            { return false; }
        @Override public String  toString()                  { return "RestrictedTo" + paths(); }
    }
}

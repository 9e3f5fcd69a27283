package com.trustgate.guard.policy;

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Resolves a path to its canonical form: absolute, with every symlink
 * component followed, including paths whose final components do not exist
 * yet (a write target) and dangling links (resolved to where they point).
 *
 * Components are resolved left to right so that {@code link/..} means the
 * parent of the link's target, not the directory holding the link.
 */
public final class PathCanonicalizer {

    private static final int MAX_LINK_HOPS = 40;

    private PathCanonicalizer() {}

    public static Path canonicalize(Path path) throws IOException {
        Path absolute = path.toAbsolutePath();
        Path resolved = absolute.getRoot();

        Deque<String> pending = new ArrayDeque<>();
        for (Path name : absolute) {
            pending.addLast(name.toString());
        }

        int hops = 0;
        while (!pending.isEmpty()) {
            String name = pending.removeFirst();
            if (name.isEmpty() || name.equals(".")) {
                continue;
            }
            if (name.equals("..")) {
                if (resolved.getParent() != null) {
                    resolved = resolved.getParent();
                }
                continue;
            }
            Path next = resolved.resolve(name);
            if (!Files.isSymbolicLink(next)) {
                resolved = next;
                continue;
            }
            if (++hops > MAX_LINK_HOPS) {
                throw new FileSystemException(path.toString(), null, "Too many levels of symbolic links");
            }
            Path target = Files.readSymbolicLink(next);
            if (target.isAbsolute()) {
                resolved = target.getRoot();
            }
            Deque<String> targetNames = new ArrayDeque<>();
            for (Path part : target) {
                targetNames.addLast(part.toString());
            }
            while (!targetNames.isEmpty()) {
                pending.addFirst(targetNames.removeLast());
            }
        }
        return resolved;
    }
}

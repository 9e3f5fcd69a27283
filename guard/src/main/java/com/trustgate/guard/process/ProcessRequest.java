package com.trustgate.guard.process;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything needed to spawn one child process.
 *
 * @param argv        program and arguments; never re-parsed by a shell unless argv[0] is one
 * @param workdir     working directory of the child
 * @param environment variables set on top of the inherited environment
 * @param unset       inherited variables removed from the child's environment
 */
public record ProcessRequest(List<String> argv, Path workdir, Map<String, String> environment, Set<String> unset) {

    public ProcessRequest {
        argv        = List.copyOf(argv);
        environment = Map.copyOf(environment);
        unset       = Set.copyOf(unset);
    }
}

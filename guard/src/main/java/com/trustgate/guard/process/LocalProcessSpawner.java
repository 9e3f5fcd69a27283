package com.trustgate.guard.process;

import java.io.IOException;
import java.util.Map;

/** {@link ProcessSpawner} backed by {@link ProcessBuilder}. */
public class LocalProcessSpawner implements ProcessSpawner {

    @Override
    public Process start(ProcessRequest request) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(request.argv())
                .directory(request.workdir().toFile());
        Map<String, String> env = builder.environment();
        env.keySet().removeAll(request.unset());
        env.putAll(request.environment());
        return builder.start();
    }
}

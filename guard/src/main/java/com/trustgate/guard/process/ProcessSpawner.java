package com.trustgate.guard.process;

import java.io.IOException;

/** The single point where a child process is created. */
@FunctionalInterface
public interface ProcessSpawner {

    Process start(ProcessRequest request) throws IOException;
}

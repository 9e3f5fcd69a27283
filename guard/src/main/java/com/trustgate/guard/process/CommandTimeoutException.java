package com.trustgate.guard.process;

import java.time.Duration;

/**
 * Thrown when a child process outlives its wall-clock bound. By the time
 * this is thrown the process tree has already been destroyed.
 */
public class CommandTimeoutException extends Exception {

    private final Duration timeout;

    public CommandTimeoutException(String command, Duration timeout) {
        super("Command timed out after " + timeout.toSeconds() + "s: " + command);
        this.timeout = timeout;
    }

    public Duration getTimeout() { return timeout; }
}

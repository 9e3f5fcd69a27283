package com.trustgate.guard.process;

/**
 * Completed process. A non-zero exit code is data, not failure; interpreting
 * it is the caller's job.
 */
public record CommandResult(
        int    exitCode,
        String stdout,
        String stderr,
        long   elapsedMs) {

    public boolean success() {
        return exitCode == 0;
    }

    /** The observation string the agent reads on its next turn; all three parts always present. */
    public String toObservation() {
        return "Stdout:\n" + stdout + "\nStderr:\n" + stderr + "\nExit Code: " + exitCode;
    }
}

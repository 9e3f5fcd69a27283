package com.trustgate.guard.tool;

/** What a tool may do to the host; used as the {@code access} metric tag. */
public enum ToolAccess {
    /** Reads files, bounded by the read quotas. */
    READ,
    /** Mutates files through the path access controller. */
    WRITE,
    /** Spawns processes, screened by the command guard. */
    EXECUTE,
    /** Talks to a human. */
    INTERACT
}

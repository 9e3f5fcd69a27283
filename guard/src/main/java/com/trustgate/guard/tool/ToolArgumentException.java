package com.trustgate.guard.tool;

/** Thrown when a tool call's arguments are missing or of the wrong type. */
public class ToolArgumentException extends RuntimeException {

    public ToolArgumentException(String message) {
        super(message);
    }
}

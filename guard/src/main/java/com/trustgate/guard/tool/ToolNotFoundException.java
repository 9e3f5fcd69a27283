package com.trustgate.guard.tool;

public class ToolNotFoundException extends RuntimeException {

    public ToolNotFoundException(String toolName) {
        super("No tool registered with name: " + toolName);
    }
}

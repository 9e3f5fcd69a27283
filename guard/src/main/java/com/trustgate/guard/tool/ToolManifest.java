package com.trustgate.guard.tool;

import java.util.List;

/**
 * Identity and documentation contract for a tool.
 *
 * @param name        unique name the agent calls the tool by (e.g. "edit_file")
 * @param version     semantic version of the tool's contract
 * @param description one or two sentences shown to the agent in the function definition
 * @param access      what the tool may do to the host
 * @param parameters  arguments, in the order they are documented
 */
public record ToolManifest(
        String              name,
        String              version,
        String              description,
        ToolAccess          access,
        List<ToolParameter> parameters) {

    public ToolManifest {
        parameters = List.copyOf(parameters);
    }
}

package com.trustgate.guard.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.trustgate.guard.process.PackageInstaller;
import com.trustgate.guard.tool.*;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class InstallPackageTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "install_package", "1.0.0",
            "Install one package with the project's package manager, e.g. 'requests' or 'flask[async]>=2.0'.",
            ToolAccess.EXECUTE,
            List.of(ToolParameter.required("package_name", "string", "Package specifier.")));

    private final PackageInstaller installer;

    public InstallPackageTool(PackageInstaller installer) {
        this.installer = installer;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public ToolResult execute(JsonNode args, ToolSession session) {
        return installer.install(
                ToolArguments.requireString(args, "package_name"),
                session.installPrefix(),
                session.workdir());
    }
}

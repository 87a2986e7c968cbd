package com.changeguard.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * The project tree the pipeline operates on.
 */
@Component
@ConfigurationProperties(prefix = "changeguard")
public class WorkspaceProperties {

    private String root = ".";

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public Path rootPath() {
        return Path.of(root).toAbsolutePath().normalize();
    }

    /** Resolves {@code path} against the root unless it is already absolute. */
    public Path resolve(String path) {
        Path p = Path.of(path);
        return (p.isAbsolute() ? p : rootPath().resolve(p)).normalize();
    }
}

package com.changeguard.core.indexer;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "changeguard.indexer")
public class IndexerProperties {

    /** Directory names (or root-relative directory paths) skipped during the walk. */
    private List<String> excludedDirs = List.of(
            ".git", "node_modules", "target", "build", "dist", "out", "coverage",
            ".next", ".vercel", ".turbo", ".idea", ".vscode", "__pycache__", ".gradle", ".mvn",
            ".changeguard"
    );

    private List<String> excludedFiles = List.of(
            "package-lock.json", "yarn.lock", "pnpm-lock.yaml", ".env", ".env.local", ".DS_Store", "Thumbs.db"
    );

    private List<String> includedExtensions = List.of(
            ".ts", ".tsx", ".js", ".jsx", ".mjs", ".cjs", ".java", ".py", ".json", ".md", ".prisma",
            ".yml", ".yaml"
    );

    private long maxFileSizeBytes = 1024 * 1024;

    public List<String> getExcludedDirs() {
        return excludedDirs;
    }

    public void setExcludedDirs(List<String> excludedDirs) {
        this.excludedDirs = excludedDirs;
    }

    public List<String> getExcludedFiles() {
        return excludedFiles;
    }

    public void setExcludedFiles(List<String> excludedFiles) {
        this.excludedFiles = excludedFiles;
    }

    public List<String> getIncludedExtensions() {
        return includedExtensions;
    }

    public void setIncludedExtensions(List<String> includedExtensions) {
        this.includedExtensions = includedExtensions;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }
}

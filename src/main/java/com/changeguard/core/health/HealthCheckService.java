package com.changeguard.core.health;

import com.changeguard.core.change.ChangeRepository;
import com.changeguard.core.safety.SafetySystem;
import com.changeguard.core.vcs.GitClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SafetySystem safetySystem;
    private final ChangeRepository repository;
    private final GitClient gitClient;
    private final String apiKey;

    public HealthCheckService(SafetySystem safetySystem, ChangeRepository repository, GitClient gitClient,
                              @Value("${spring.ai.openai.api-key:}") String apiKey) {
        this.safetySystem = safetySystem;
        this.repository = repository;
        this.gitClient = gitClient;
        this.apiKey = apiKey;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkBackups());
        results.add(checkChangeStore());
        results.add(checkGit());
        results.add(checkChatModel());
        return results;
    }

    HealthStatus checkBackups() {
        try {
            Path dir = safetySystem.backupDirectory();
            if (!safetySystem.backupsEnabled()) {
                return new HealthStatus("backups", HealthStatus.Status.DEGRADED,
                        "Backups are disabled; writes are not protected", Map.of("dir", dir.toString()));
            }
            if (Files.isDirectory(dir) && Files.isWritable(dir)) {
                return new HealthStatus("backups", HealthStatus.Status.UP,
                        "Backup directory writable", Map.of("dir", dir.toString(),
                        "count", String.valueOf(safetySystem.listBackups().size())));
            }
            return new HealthStatus("backups", HealthStatus.Status.DOWN,
                    "Backup directory not writable", Map.of("dir", dir.toString()));
        } catch (Exception e) {
            log.warn("Backup health check failed: {}", e.getMessage());
            return new HealthStatus("backups", HealthStatus.Status.DOWN,
                    "Backup error: " + e.getMessage(), Map.of());
        }
    }

    HealthStatus checkChangeStore() {
        try {
            int count = repository.findAll().size();
            return new HealthStatus("change-store", HealthStatus.Status.UP,
                    "Change store readable", Map.of("location", repository.location(),
                    "records", String.valueOf(count)));
        } catch (Exception e) {
            log.warn("Change store health check failed: {}", e.getMessage());
            return new HealthStatus("change-store", HealthStatus.Status.DOWN,
                    "Change store error: " + e.getMessage(), Map.of());
        }
    }

    HealthStatus checkGit() {
        if (gitClient.isAvailable()) {
            return new HealthStatus("git", HealthStatus.Status.UP, "git available", Map.of());
        }
        return new HealthStatus("git", HealthStatus.Status.DEGRADED,
                "git not available; review publishing disabled", Map.of());
    }

    HealthStatus checkChatModel() {
        if (apiKey == null || apiKey.isBlank() || "not-set".equals(apiKey)) {
            return new HealthStatus("chat-model", HealthStatus.Status.DEGRADED,
                    "No API key configured; code generation unavailable", Map.of());
        }
        return new HealthStatus("chat-model", HealthStatus.Status.UP, "API key configured", Map.of());
    }
}

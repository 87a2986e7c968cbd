package com.changeguard.dispatch.cli;

import com.changeguard.core.safety.SafetyProperties;
import com.changeguard.core.safety.SafetySystem;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;

@Command(name = "backups", mixinStandardHelpOptions = true, description = "List or prune backup files")
@Component
public class BackupsCommand extends CommandSupport {

    @Option(names = "--clean", description = "Delete backups older than --days")
    private boolean clean;

    @Option(names = "--days", description = "Retention in days (default: changeguard.safety.retention-days)")
    private Integer days;

    private final SafetySystem safetySystem;
    private final SafetyProperties properties;

    public BackupsCommand(SafetySystem safetySystem, SafetyProperties properties) {
        this.safetySystem = safetySystem;
        this.properties = properties;
    }

    @Override
    protected int execute() {
        if (clean) {
            int retention = days != null ? days : properties.getRetentionDays();
            int removed = safetySystem.cleanOldBackups(retention);
            ConsoleOutput.success("Removed %d backup(s) older than %d day(s)".formatted(removed, retention));
            return 0;
        }
        List<Path> backups = safetySystem.listBackups();
        ConsoleOutput.info("%d backup(s) in %s".formatted(backups.size(), safetySystem.backupDirectory()));
        backups.forEach(b -> System.out.println("  " + b.getFileName()));
        return 0;
    }
}

package com.changeguard.core.safety;

import com.changeguard.core.config.WorkspaceProperties;
import com.changeguard.core.exception.FileAccessException;
import com.changeguard.core.exception.NoBackupAvailableException;
import com.changeguard.core.exception.RollbackFailedException;
import com.changeguard.core.exception.WriteFailedException;
import com.changeguard.core.metrics.ChangeguardMetrics;
import com.changeguard.core.model.BackupRecord;
import com.changeguard.core.model.ChangeKind;
import com.changeguard.core.model.ChangeRecord;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Stream;

/**
 * Backup-before-write guarantee for changes applied to the working tree.
 * <p>
 * Every write follows the same order: a byte-exact copy of the current content is written to the
 * backup directory and forced to stable storage, then the new content replaces the original
 * through a temporary file and a rename. If the write fails, the original is restored before the
 * error reaches the caller, so the target holds either the full new content or the full original
 * content. Only when backups are disabled in configuration is a file written without a backup.
 * <p>
 * Backups are named {@code {originalFileName}.{epochMillis}.backup} and are removed only by
 * {@link #cleanOldBackups(int)}.
 */
@Service
public class SafetySystem {

    private static final Logger log = LoggerFactory.getLogger(SafetySystem.class);

    static final String BACKUP_SUFFIX = ".backup";

    private final SafetyProperties properties;
    private final WorkspaceProperties workspace;
    private final ChangeguardMetrics metrics;
    private final Clock clock;

    private Path backupDir;

    public SafetySystem(SafetyProperties properties, WorkspaceProperties workspace,
                        ChangeguardMetrics metrics, Clock clock) {
        this.properties = properties;
        this.workspace = workspace;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Resolves and creates the backup directory.
     *
     * @throws FileAccessException if the directory cannot be created
     */
    @PostConstruct
    public void initialize() {
        Path dir = workspace.resolve(properties.getBackupDir());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new FileAccessException(dir, "Cannot create backup directory", e);
        }
        backupDir = dir;
        log.info("Backup directory ready at {} (backups {})", dir,
                properties.isBackupsEnabled() ? "enabled" : "DISABLED");
    }

    public Path backupDirectory() {
        return requireInitialized();
    }

    public boolean backupsEnabled() {
        return properties.isBackupsEnabled();
    }

    // ── Backup / restore ────────────────────────────────────────────

    /**
     * Copies the current content of {@code target} into the backup directory and forces it to
     * disk before returning. For a file that does not exist yet, no copy is written and the
     * returned record says so.
     *
     * @throws FileAccessException if the original cannot be read or the copy cannot be written
     */
    public BackupRecord createBackup(Path target) {
        Path dir = requireInitialized();
        Path original = target.toAbsolutePath().normalize();
        Instant now = clock.instant();
        if (!Files.exists(original)) {
            log.debug("No backup needed for absent file {}", original);
            return new BackupRecord(original.toString(), null, now, false, 0, null);
        }

        byte[] content;
        try {
            content = Files.readAllBytes(original);
        } catch (IOException e) {
            throw new FileAccessException(original, "Cannot read file for backup", e);
        }

        long stamp = now.toEpochMilli();
        while (true) {
            Path backup = dir.resolve(original.getFileName() + "." + stamp + BACKUP_SUFFIX);
            try (FileChannel channel = FileChannel.open(backup,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
                log.info("Backed up {} to {}", original, backup);
                return new BackupRecord(original.toString(), backup.toString(), now, true,
                        content.length, sha256(content));
            } catch (FileAlreadyExistsException e) {
                stamp++;
            } catch (IOException e) {
                throw new FileAccessException(backup, "Cannot write backup", e);
            }
        }
    }

    /**
     * Puts the backed-up content back in place, or removes the file if it did not exist when the
     * backup was taken.
     *
     * @throws FileAccessException if the backup is missing or the restore fails
     */
    public void restore(BackupRecord backup) {
        Path original = Path.of(backup.originalPath());
        try {
            if (!backup.originalExisted()) {
                Files.deleteIfExists(original);
                log.info("Removed {} (did not exist before the change)", original);
                return;
            }
            Path source = Path.of(backup.backupPath());
            if (!Files.exists(source)) {
                throw new FileAccessException(source, "Backup file is missing", null);
            }
            replaceContent(original, Files.readAllBytes(source));
            log.info("Restored {} from {}", original, source);
        } catch (IOException e) {
            throw new FileAccessException(original, "Restore failed", e);
        }
    }

    // ── Apply / rollback ────────────────────────────────────────────

    /**
     * Backs up, writes and marks the change applied.
     *
     * @throws FileAccessException     if the backup fails; nothing was written
     * @throws WriteFailedException    if the write fails; the original has been restored
     * @throws RollbackFailedException if the write fails and the restore fails too
     */
    public ChangeRecord applyChange(ChangeRecord change) {
        BackupRecord backup = writeWithBackup(change);
        return change.applied(backup, null, clock.instant());
    }

    /**
     * Backs up and writes one change without touching its status. Used directly by batch
     * workflows that mark records only after the whole batch succeeds.
     *
     * @return the backup taken, or {@code null} when backups are disabled
     */
    public BackupRecord writeWithBackup(ChangeRecord change) {
        Path target = Path.of(change.filePath()).toAbsolutePath().normalize();
        BackupRecord backup = properties.isBackupsEnabled() ? createBackup(target) : null;
        if (backup == null) {
            log.warn("Backups disabled, writing {} without a backup", target);
        }

        try {
            write(target, change);
            log.info("Wrote {} change to {}", change.kind(), target);
            return backup;
        } catch (IOException | RuntimeException writeError) {
            if (backup == null) {
                throw new FileAccessException(target, "Write failed and no backup exists", writeError);
            }
            log.warn("Write to {} failed, restoring original: {}", target, writeError.getMessage());
            try {
                restore(backup);
            } catch (RuntimeException rollbackError) {
                log.error("Rollback of {} from {} FAILED, manual intervention required",
                        target, backup.backupPath(), rollbackError);
                throw new RollbackFailedException(target.toString(), backup.backupPath(), writeError, rollbackError);
            }
            throw new WriteFailedException(target, backup, writeError);
        }
    }

    /**
     * Restores the file behind an applied change from its backup and marks it rolled back.
     *
     * @throws NoBackupAvailableException if the change has no backup attached; the file is untouched
     */
    public ChangeRecord rollbackChange(ChangeRecord change, String reason) {
        if (change.backup() == null) {
            throw new NoBackupAvailableException(change.id());
        }
        ChangeRecord rolledBack = change.rolledBack(reason, clock.instant());
        restore(change.backup());
        return rolledBack;
    }

    private void write(Path target, ChangeRecord change) throws IOException {
        if (change.kind() == ChangeKind.DELETE) {
            deleteFile(target);
            return;
        }
        writeContent(target, change.newContent().getBytes(StandardCharsets.UTF_8));
    }

    /** Replaces the target's content. Overridden in tests to simulate write failures. */
    void writeContent(Path target, byte[] content) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        replaceContent(target, content);
    }

    void deleteFile(Path target) throws IOException {
        Files.deleteIfExists(target);
    }

    private static void replaceContent(Path target, byte[] content) throws IOException {
        Path temp = target.resolveSibling("." + target.getFileName() + ".changeguard.tmp");
        try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    // ── Retention ───────────────────────────────────────────────────

    /** Backup files currently in the backup directory, sorted by name. */
    public List<Path> listBackups() {
        Path dir = requireInitialized();
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(BACKUP_SUFFIX))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new FileAccessException(dir, "Cannot list backups", e);
        }
    }

    /**
     * Deletes backups last modified more than {@code daysToKeep} days ago. A backup that cannot be
     * deleted is logged and skipped.
     *
     * @return number of backups deleted
     */
    public int cleanOldBackups(int daysToKeep) {
        if (daysToKeep < 0) {
            throw new IllegalArgumentException("daysToKeep must not be negative: " + daysToKeep);
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(daysToKeep));
        var deleted = new ArrayList<Path>();
        for (Path backup : listBackups()) {
            try {
                if (Files.getLastModifiedTime(backup).toInstant().isBefore(cutoff)) {
                    Files.delete(backup);
                    deleted.add(backup);
                }
            } catch (IOException e) {
                log.warn("Could not delete old backup {}: {}", backup, e.getMessage());
            }
        }
        log.info("Retention sweep removed {} backups older than {} days", deleted.size(), daysToKeep);
        metrics.recordBackupsCleaned(deleted.size());
        return deleted.size();
    }

    private Path requireInitialized() {
        if (backupDir == null) {
            throw new IllegalStateException("SafetySystem not initialized");
        }
        return backupDir;
    }

    static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

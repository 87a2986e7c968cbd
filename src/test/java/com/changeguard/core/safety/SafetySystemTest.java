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
import com.changeguard.core.model.ChangeStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SafetySystem}.
 * <p>
 * Write failures are simulated by subclassing and overriding {@code writeContent}.
 */
class SafetySystemTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private SafetyProperties properties;
    private SimpleMeterRegistry registry;
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        properties = new SafetyProperties();
        registry = new SimpleMeterRegistry();
    }

    private SafetySystem newSystem() {
        return init(new SafetySystem(properties, workspace(), new ChangeguardMetrics(registry), clock));
    }

    private WorkspaceProperties workspace() {
        var workspace = new WorkspaceProperties();
        workspace.setRoot(tempDir.toString());
        return workspace;
    }

    private static SafetySystem init(SafetySystem system) {
        system.initialize();
        return system;
    }

    private static ChangeRecord approved(ChangeKind kind, Path file, String content) {
        return ChangeRecord.proposed(kind, file.toString(), "test", content, "test-model", null, NOW)
                .approved(NOW);
    }

    /** Write fails after leaving a partial file behind. */
    private class FailingWriteSystem extends SafetySystem {
        FailingWriteSystem() {
            super(properties, workspace(), new ChangeguardMetrics(registry), clock);
        }

        @Override
        void writeContent(Path target, byte[] content) throws IOException {
            Files.writeString(target, "PARTIAL");
            throw new IOException("disk full");
        }
    }

    // ── Backups ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("backups")
    class Backups {

        @Test
        @DisplayName("creates the backup directory under the workspace root")
        void createsBackupDir() {
            SafetySystem system = newSystem();
            assertEquals(tempDir.resolve(".changeguard/backups").normalize(), system.backupDirectory());
            assertTrue(Files.isDirectory(system.backupDirectory()));
        }

        @Test
        @DisplayName("backup is a byte-exact copy named {file}.{millis}.backup")
        void byteExactCopy() throws IOException {
            SafetySystem system = newSystem();
            byte[] original = {0x01, 0x02, (byte) 0xFF, '\r', '\n'};
            Path file = Files.write(tempDir.resolve("data.bin"), original);

            BackupRecord backup = system.createBackup(file);

            assertTrue(backup.originalExisted());
            assertEquals(original.length, backup.sizeBytes());
            assertEquals("data.bin." + NOW.toEpochMilli() + ".backup", Path.of(backup.backupPath()).getFileName().toString());
            assertArrayEquals(original, Files.readAllBytes(Path.of(backup.backupPath())));
            assertEquals(SafetySystem.sha256(original), backup.sha256());
        }

        @Test
        @DisplayName("backups taken in the same millisecond get distinct names")
        void distinctNames() throws IOException {
            SafetySystem system = newSystem();
            Path file = Files.writeString(tempDir.resolve("a.txt"), "one");

            BackupRecord first = system.createBackup(file);
            Files.writeString(file, "two");
            BackupRecord second = system.createBackup(file);

            assertNotEquals(first.backupPath(), second.backupPath());
            assertEquals("one", Files.readString(Path.of(first.backupPath())));
            assertEquals("two", Files.readString(Path.of(second.backupPath())));
            assertEquals(2, system.listBackups().size());
        }

        @Test
        @DisplayName("an absent target yields a record without a backup file")
        void absentTarget() {
            SafetySystem system = newSystem();

            BackupRecord backup = system.createBackup(tempDir.resolve("new.txt"));

            assertFalse(backup.originalExisted());
            assertNull(backup.backupPath());
            assertTrue(system.listBackups().isEmpty());
        }
    }

    // ── Apply / rollback ─────────────────────────────────────────────

    @Nested
    @DisplayName("apply and rollback")
    class ApplyAndRollback {

        @Test
        @DisplayName("apply then rollback restores the original bytes")
        void roundTrip() throws IOException {
            SafetySystem system = newSystem();
            Path file = Files.writeString(tempDir.resolve("util.js"), "const a = 1;\r\n");

            ChangeRecord applied = system.applyChange(approved(ChangeKind.UPDATE, file, "const a = 2;\n"));

            assertEquals(ChangeStatus.APPLIED, applied.status());
            assertNotNull(applied.backup());
            assertEquals("const a = 2;\n", Files.readString(file));

            ChangeRecord rolledBack = system.rollbackChange(applied, "undo");

            assertEquals(ChangeStatus.REJECTED, rolledBack.status());
            assertEquals("undo", rolledBack.rejectReason());
            assertEquals("const a = 1;\r\n", Files.readString(file));
        }

        @Test
        @DisplayName("the backup is on disk before the write starts")
        void backupBeforeWrite() throws IOException {
            Path file = Files.writeString(tempDir.resolve("a.js"), "old");
            var system = init(new SafetySystem(properties, workspace(), new ChangeguardMetrics(registry), clock) {
                @Override
                void writeContent(Path target, byte[] content) throws IOException {
                    assertEquals(1, listBackups().size(), "backup must exist before the write");
                    assertEquals("old", Files.readString(listBackups().get(0)));
                    super.writeContent(target, content);
                }
            });

            system.applyChange(approved(ChangeKind.UPDATE, file, "new"));

            assertEquals("new", Files.readString(file));
        }

        @Test
        @DisplayName("a failed write leaves the original content in place")
        void failedWriteRestoresOriginal() throws IOException {
            SafetySystem system = init(new FailingWriteSystem());
            Path file = Files.writeString(tempDir.resolve("a.js"), "original");

            WriteFailedException e = assertThrows(WriteFailedException.class,
                    () -> system.applyChange(approved(ChangeKind.UPDATE, file, "new")));

            assertEquals("original", Files.readString(file));
            assertNotNull(e.getBackup());
            assertTrue(Files.exists(Path.of(e.getBackup().backupPath())), "backup is kept after a failed write");
        }

        @Test
        @DisplayName("a failed write of a new file removes the partial file")
        void failedCreateRemovesFile() {
            SafetySystem system = init(new FailingWriteSystem());
            Path file = tempDir.resolve("new.js");

            assertThrows(WriteFailedException.class,
                    () -> system.applyChange(approved(ChangeKind.CREATE, file, "new")));

            assertFalse(Files.exists(file));
        }

        @Test
        @DisplayName("a failed write whose restore also fails needs manual intervention")
        void doubleFailure() throws IOException {
            Path file = Files.writeString(tempDir.resolve("a.js"), "original");
            var system = init(new SafetySystem(properties, workspace(), new ChangeguardMetrics(registry), clock) {
                @Override
                void writeContent(Path target, byte[] content) throws IOException {
                    for (Path backup : listBackups()) {
                        Files.delete(backup);
                    }
                    throw new IOException("disk full");
                }
            });

            RollbackFailedException e = assertThrows(RollbackFailedException.class,
                    () -> system.applyChange(approved(ChangeKind.UPDATE, file, "new")));

            assertNotNull(e.getBackupPath());
            assertEquals(1, e.getSuppressed().length);
            assertTrue(e.getMessage().contains("manual intervention"));
        }

        @Test
        @DisplayName("creating a file and rolling it back removes it")
        void createThenRollback() throws IOException {
            SafetySystem system = newSystem();
            Path file = tempDir.resolve("src/new.js");

            ChangeRecord applied = system.applyChange(approved(ChangeKind.CREATE, file, "x\n"));
            assertEquals("x\n", Files.readString(file));

            system.rollbackChange(applied, "undo");

            assertFalse(Files.exists(file));
        }

        @Test
        @DisplayName("a delete can be rolled back")
        void deleteThenRollback() throws IOException {
            SafetySystem system = newSystem();
            Path file = Files.writeString(tempDir.resolve("gone.js"), "keep me");

            ChangeRecord applied = system.applyChange(approved(ChangeKind.DELETE, file, null));
            assertFalse(Files.exists(file));

            system.rollbackChange(applied, "undo");

            assertEquals("keep me", Files.readString(file));
        }

        @Test
        @DisplayName("rollback without a backup fails and leaves the file untouched")
        void rollbackWithoutBackup() throws IOException {
            properties.setBackupsEnabled(false);
            SafetySystem system = newSystem();
            Path file = Files.writeString(tempDir.resolve("a.js"), "old");

            ChangeRecord applied = system.applyChange(approved(ChangeKind.UPDATE, file, "new"));
            assertNull(applied.backup());

            assertThrows(NoBackupAvailableException.class, () -> system.rollbackChange(applied, "undo"));
            assertEquals("new", Files.readString(file));
        }

        @Test
        @DisplayName("with backups disabled a failed write cannot be undone")
        void disabledBackupsFailedWrite() throws IOException {
            properties.setBackupsEnabled(false);
            SafetySystem system = init(new FailingWriteSystem());
            Path file = Files.writeString(tempDir.resolve("a.js"), "old");

            var e = assertThrows(FileAccessException.class,
                    () -> system.applyChange(approved(ChangeKind.UPDATE, file, "new")));
            assertFalse(e instanceof WriteFailedException);
        }
    }

    // ── Retention ────────────────────────────────────────────────────

    @Nested
    @DisplayName("retention")
    class Retention {

        private Path backupAged(SafetySystem system, String name, Duration age) throws IOException {
            Path backup = Files.writeString(system.backupDirectory().resolve(name), "x");
            Files.setLastModifiedTime(backup, FileTime.from(NOW.minus(age)));
            return backup;
        }

        @Test
        @DisplayName("deletes only backups older than the retention period")
        void cleansOldBackups() throws IOException {
            SafetySystem system = newSystem();
            Path old = backupAged(system, "a.js.1.backup", Duration.ofDays(40));
            Path recent = backupAged(system, "b.js.2.backup", Duration.ofDays(5));
            Path other = Files.writeString(system.backupDirectory().resolve("notes.txt"), "x");
            Files.setLastModifiedTime(other, FileTime.from(NOW.minus(Duration.ofDays(400))));

            int removed = system.cleanOldBackups(30);

            assertEquals(1, removed);
            assertFalse(Files.exists(old));
            assertTrue(Files.exists(recent));
            assertTrue(Files.exists(other), "only backup files are swept");
            assertEquals(1.0, registry.get("changeguard.backups.cleaned").counter().count());
        }

        @Test
        @DisplayName("zero days removes every backup older than now")
        void zeroDays() throws IOException {
            SafetySystem system = newSystem();
            backupAged(system, "a.js.1.backup", Duration.ofMinutes(1));

            assertEquals(1, system.cleanOldBackups(0));
        }

        @Test
        @DisplayName("negative retention is rejected")
        void negativeDays() {
            SafetySystem system = newSystem();
            assertThrows(IllegalArgumentException.class, () -> system.cleanOldBackups(-1));
        }
    }
}

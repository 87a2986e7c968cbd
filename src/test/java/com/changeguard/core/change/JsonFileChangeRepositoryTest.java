package com.changeguard.core.change;

import com.changeguard.core.exception.FileAccessException;
import com.changeguard.core.model.BackupRecord;
import com.changeguard.core.model.ChangeKind;
import com.changeguard.core.model.ChangeRecord;
import com.changeguard.core.model.ChangeStatus;
import com.changeguard.core.model.Recommendation;
import com.changeguard.core.model.RiskAssessment;
import com.changeguard.core.model.RiskCategory;
import com.changeguard.core.model.RiskFactor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileChangeRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private Path storeFile;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        storeFile = tempDir.resolve(".changeguard/changes.json");
    }

    private static ChangeRecord assessedRecord(String path, Instant at) {
        var assessment = new RiskAssessment(2, RiskCategory.LOW, Recommendation.AUTO_APPLY,
                List.of(new RiskFactor("change-kind", 1, "update"), new RiskFactor("change-magnitude", 1, "12 lines")));
        return ChangeRecord.proposed(ChangeKind.UPDATE, path, "tidy", "new\n", "cli", "because", at)
                .assessed(assessment, "@@ -1 +1 @@\n- old\n+ new", at);
    }

    @Test
    @DisplayName("starts empty when no store file exists")
    void startsEmpty() {
        var repository = new JsonFileChangeRepository(storeFile, objectMapper);

        assertTrue(repository.findAll().isEmpty());
        assertFalse(Files.exists(storeFile));
        assertEquals(storeFile.toAbsolutePath().normalize().toString(), repository.location());
    }

    @Test
    @DisplayName("records survive a reload with every field intact")
    void survivesReload() {
        var repository = new JsonFileChangeRepository(storeFile, objectMapper);
        ChangeRecord record = assessedRecord("/w/a.js", T0);
        var backup = new BackupRecord("/w/a.js", "/w/.changeguard/backups/a.js.1.backup", T0, true, 4, "abc");
        ChangeRecord applied = record.approved(T0.plusSeconds(1)).applied(backup, null, T0.plusSeconds(2));
        repository.save(applied);

        var reloaded = new JsonFileChangeRepository(storeFile, objectMapper);

        assertEquals(applied, reloaded.findById(applied.id()).orElseThrow());
        assertEquals(List.of(applied), reloaded.findByStatus(ChangeStatus.APPLIED));
        assertFalse(Files.exists(storeFile.resolveSibling("changes.json.tmp")), "temporary file is renamed away");
    }

    @Test
    @DisplayName("saving an existing id replaces it, and findAll orders by creation time")
    void replaceAndOrder() {
        var repository = new JsonFileChangeRepository(storeFile, objectMapper);
        ChangeRecord later = assessedRecord("/w/b.js", T0.plusSeconds(60));
        ChangeRecord earlier = assessedRecord("/w/a.js", T0);
        repository.save(later);
        repository.save(earlier);
        repository.save(earlier.rejected("no", T0.plusSeconds(120)));

        List<ChangeRecord> all = repository.findAll();

        assertEquals(2, all.size());
        assertEquals(earlier.id(), all.get(0).id());
        assertEquals(ChangeStatus.REJECTED, all.get(0).status());
        assertEquals(later.id(), all.get(1).id());
    }

    @Test
    @DisplayName("a corrupt store file is reported instead of silently discarded")
    void corruptStore() throws IOException {
        Files.createDirectories(storeFile.getParent());
        Files.writeString(storeFile, "{not json");

        assertThrows(FileAccessException.class, () -> new JsonFileChangeRepository(storeFile, objectMapper));
    }

    @Test
    @DisplayName("a save that cannot be written leaves the previous view in place")
    void failedSaveKeepsPreviousView() throws IOException {
        var repository = new JsonFileChangeRepository(storeFile, objectMapper);
        ChangeRecord record = assessedRecord("/w/a.js", T0);
        repository.save(record);
        // a directory where the temporary file goes makes the next write fail
        Files.createDirectories(storeFile.resolveSibling("changes.json.tmp"));

        assertThrows(FileAccessException.class, () -> repository.save(record.rejected("no", T0.plusSeconds(5))));

        assertEquals(ChangeStatus.PENDING, repository.findById(record.id()).orElseThrow().status());
        assertEquals(List.of(record), new JsonFileChangeRepository(storeFile, objectMapper).findAll());
    }
}

package com.changeguard.core.risk;

import com.changeguard.core.model.BackupRecord;
import com.changeguard.core.model.ChangeKind;
import com.changeguard.core.model.ChangeRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeHistoryTest {

    private final OutcomeHistory history = new OutcomeHistory();

    @Test
    @DisplayName("groups outcomes by change kind and file extension")
    void groupsByKindAndExtension() {
        history.recordSuccess(ChangeKind.UPDATE, "/src/a.ts");
        history.recordFailure(ChangeKind.UPDATE, "/lib/b.ts");
        history.recordFailure(ChangeKind.UPDATE, "/lib/c.py");
        history.recordSuccess(ChangeKind.DELETE, "/src/d.ts");

        assertEquals(2, history.samples(ChangeKind.UPDATE, "/other/x.TS"));
        assertEquals(1, history.samples(ChangeKind.UPDATE, "/x.py"));
        assertEquals(1, history.samples(ChangeKind.DELETE, "/x.ts"));
    }

    @Test
    @DisplayName("success rate is empty below the minimum sample count")
    void minimumSamples() {
        history.recordSuccess(ChangeKind.UPDATE, "a.js");
        history.recordFailure(ChangeKind.UPDATE, "b.js");

        assertTrue(history.successRate(ChangeKind.UPDATE, "c.js", 3).isEmpty());

        history.recordFailure(ChangeKind.UPDATE, "d.js");
        assertEquals(1.0 / 3, history.successRate(ChangeKind.UPDATE, "c.js", 3).getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("a rollback turns a recorded success into a failure")
    void rollbackConvertsSuccess() {
        history.recordSuccess(ChangeKind.UPDATE, "a.js");
        history.recordRollback(ChangeKind.UPDATE, "a.js");

        assertEquals(1, history.samples(ChangeKind.UPDATE, "a.js"));
        assertEquals(0.0, history.successRate(ChangeKind.UPDATE, "a.js", 1).getAsDouble());
    }

    @Test
    @DisplayName("rebuild derives tallies from the audit trail")
    void rebuild() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        var backup = new BackupRecord("/a.js", "/b/a.js.1.backup", now, true, 1, "x");
        var applied = ChangeRecord.proposed(ChangeKind.UPDATE, "/a.js", "d", "x", "m", null, now)
                .approved(now).applied(backup, null, now);
        var failed = ChangeRecord.proposed(ChangeKind.UPDATE, "/b.js", "d", "x", "m", null, now)
                .approved(now).failed("boom", backup, now);
        var rolledBack = ChangeRecord.proposed(ChangeKind.UPDATE, "/c.js", "d", "x", "m", null, now)
                .approved(now).applied(backup, null, now).rolledBack("undo", now);
        var rejected = ChangeRecord.proposed(ChangeKind.UPDATE, "/d.js", "d", "x", "m", null, now)
                .rejected("no", now);
        var pending = ChangeRecord.proposed(ChangeKind.UPDATE, "/e.js", "d", "x", "m", null, now);

        history.recordSuccess(ChangeKind.CREATE, "/stale.js");
        history.rebuild(List.of(applied, failed, rolledBack, rejected, pending));

        assertEquals(3, history.samples(ChangeKind.UPDATE, "/x.js"));
        assertEquals(1.0 / 3, history.successRate(ChangeKind.UPDATE, "/x.js", 3).getAsDouble(), 1e-9);
        assertEquals(0, history.samples(ChangeKind.CREATE, "/stale.js"));
    }
}

package com.changeguard.core.change;

import com.changeguard.core.config.WorkspaceProperties;
import com.changeguard.core.exception.AssessmentException;
import com.changeguard.core.exception.ChangeNotFoundException;
import com.changeguard.core.exception.FileAccessException;
import com.changeguard.core.exception.IllegalTransitionException;
import com.changeguard.core.exception.NoBackupAvailableException;
import com.changeguard.core.exception.RollbackFailedException;
import com.changeguard.core.exception.WriteFailedException;
import com.changeguard.core.llm.CodeGenerationService;
import com.changeguard.core.logging.MdcContext;
import com.changeguard.core.metrics.ChangeguardMetrics;
import com.changeguard.core.model.BackupRecord;
import com.changeguard.core.model.ChangeKind;
import com.changeguard.core.model.ChangeRecord;
import com.changeguard.core.model.ChangeStatistics;
import com.changeguard.core.model.ChangeStatus;
import com.changeguard.core.model.CleanupOpportunity;
import com.changeguard.core.model.PublishResult;
import com.changeguard.core.model.Recommendation;
import com.changeguard.core.model.RiskAssessment;
import com.changeguard.core.model.RiskCategory;
import com.changeguard.core.risk.LineDiff;
import com.changeguard.core.risk.OutcomeHistory;
import com.changeguard.core.risk.RiskAssessor;
import com.changeguard.core.safety.PublishWorkflow;
import com.changeguard.core.safety.SafetySystem;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Owns the change registry and drives every change through its lifecycle.
 * <p>
 * Transitions on one change id are serialized, and so are operations that read or write one
 * file path: a proposal is always assessed against the content on disk at that moment, never
 * against a copy cached before another change to the same file was applied. Failures are
 * recorded on the change itself (status {@code FAILED} plus a message) and returned, except the
 * double failure of a write and its rollback, which is recorded and rethrown.
 */
@Service
public class ChangeManager {

    private static final Logger log = LoggerFactory.getLogger(ChangeManager.class);

    static final String CLEANUP_ORIGIN = "cleanup-engine";

    private final ChangeRepository repository;
    private final RiskAssessor riskAssessor;
    private final OutcomeHistory history;
    private final SafetySystem safetySystem;
    private final PublishWorkflow publishWorkflow;
    private final CodeGenerationService codeGeneration;
    private final WorkspaceProperties workspace;
    private final ChangeProperties properties;
    private final ChangeguardMetrics metrics;
    private final Clock clock;
    private final LockRegistry locks;

    public ChangeManager(ChangeRepository repository, RiskAssessor riskAssessor, OutcomeHistory history,
                         SafetySystem safetySystem, PublishWorkflow publishWorkflow,
                         CodeGenerationService codeGeneration, WorkspaceProperties workspace,
                         ChangeProperties properties, ChangeguardMetrics metrics, Clock clock) {
        this.repository = repository;
        this.riskAssessor = riskAssessor;
        this.history = history;
        this.safetySystem = safetySystem;
        this.publishWorkflow = publishWorkflow;
        this.codeGeneration = codeGeneration;
        this.workspace = workspace;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.locks = new LockRegistry(Duration.ofSeconds(properties.getLockTimeoutSeconds()));
    }

    @PostConstruct
    public void initialize() {
        history.rebuild(repository.findAll());
        log.info("Change manager ready, store at {}", repository.location());
    }

    // ── Proposals ───────────────────────────────────────────────────

    /**
     * Records a new change as pending and assesses it against the file's current content.
     * When the assessment recommends auto-apply and auto-approval is enabled, the change is
     * approved straight away; it is still only written by {@link #executeChange}.
     *
     * @param filePath    target file, absolute or relative to the workspace root
     * @param newContent  full new content; ignored (may be {@code null}) for deletes
     * @return the stored record, carrying its assessment
     * @throws AssessmentException if the change is malformed
     */
    public ChangeRecord proposeChange(String filePath, ChangeKind kind, String description,
                                      String newContent, String originModel, String rationale) {
        return propose(filePath, kind, description, newContent, originModel, rationale, true);
    }

    /**
     * Turns a cleanup finding into a pending change. Only findings flagged {@code autoApply}
     * may be approved automatically.
     */
    public ChangeRecord proposeCleanup(CleanupOpportunity opportunity) {
        if (opportunity.proposedContent() == null) {
            throw new AssessmentException(
                    "Cleanup '%s' for %s has no mechanical fix".formatted(opportunity.type(), opportunity.filePath()));
        }
        return propose(opportunity.filePath(), ChangeKind.UPDATE, opportunity.description(),
                opportunity.proposedContent(), CLEANUP_ORIGIN,
                "Automated cleanup: " + opportunity.type(), opportunity.autoApply());
    }

    /**
     * Asks the code-generation model for new content, then proposes it. A timeout or model
     * failure is thrown before any record is created.
     */
    public ChangeRecord proposeGeneratedChange(String filePath, ChangeKind kind, String instruction, String model) {
        if (kind == ChangeKind.DELETE) {
            throw new AssessmentException("Deletes do not need generated content");
        }
        if (filePath == null || filePath.isBlank()) {
            throw new AssessmentException("Change has no target path");
        }
        Path target = resolve(filePath);
        String content = codeGeneration.generate(target, instruction, model);
        return propose(target.toString(), kind, instruction, content, codeGeneration.modelId(model),
                instruction, true);
    }

    private ChangeRecord propose(String filePath, ChangeKind kind, String description, String newContent,
                                 String originModel, String rationale, boolean mayAutoApprove) {
        if (filePath == null || filePath.isBlank()) {
            throw new AssessmentException("Change has no target path");
        }
        if (kind == null) {
            throw new AssessmentException("Change for " + filePath + " has no kind");
        }
        Path target = resolve(filePath);
        String content = kind == ChangeKind.DELETE ? null : newContent;
        ChangeRecord created = ChangeRecord.proposed(kind, target.toString(), description, content,
                originModel, rationale, clock.instant());

        return locks.withLocks(List.of(idKey(created.id()), pathKey(target)), () -> {
            MdcContext.setChange(created.id(), target.toString());
            try {
                ChangeRecord assessed = assess(created);
                repository.save(assessed);
                metrics.recordProposal(assessed.assessment().category());
                metrics.recordRiskScore(assessed.riskScore());
                log.info("Proposed {} of {}: score {} ({}), {}", kind, target, assessed.riskScore(),
                        assessed.assessment().category(), assessed.assessment().recommendation());
                return maybeAutoApprove(assessed, mayAutoApprove);
            } finally {
                MdcContext.clear();
            }
        });
    }

    private ChangeRecord maybeAutoApprove(ChangeRecord record, boolean mayAutoApprove) {
        if (mayAutoApprove && properties.isAutoApprove()
                && record.assessment().recommendation() == Recommendation.AUTO_APPLY) {
            ChangeRecord approved = record.approved(clock.instant());
            repository.save(approved);
            log.info("Auto-approved change {}", record.id());
            return approved;
        }
        return record;
    }

    /** Assesses a pending record against what is on disk now. Caller holds the path lock. */
    private ChangeRecord assess(ChangeRecord record) {
        String current = readCurrent(Path.of(record.filePath()));
        String diff = LineDiff.diff(current, record.newContent());
        RiskAssessment assessment = riskAssessor.assessRisk(record, diff);
        return record.assessed(assessment, diff, clock.instant());
    }

    private static String readCurrent(Path target) {
        if (!Files.exists(target)) {
            return null;
        }
        try {
            return Files.readString(target);
        } catch (IOException e) {
            throw new FileAccessException(target, "Cannot read current content", e);
        }
    }

    // ── Decisions ───────────────────────────────────────────────────

    /**
     * Approves a pending change after refreshing its assessment against current content.
     */
    public ChangeRecord approveChange(String id) {
        return withChangeAndPath(id, record -> {
            if (record.status() != ChangeStatus.PENDING) {
                throw new IllegalTransitionException(id, record.status(), ChangeStatus.APPROVED);
            }
            ChangeRecord approved = assess(record).approved(clock.instant());
            repository.save(approved);
            log.info("Approved change {} (score {})", id, approved.riskScore());
            return approved;
        });
    }

    /** Rejects a pending or approved change. Nothing is written. */
    public ChangeRecord rejectChange(String id, String reason) {
        return locks.withLock(idKey(id), () -> {
            ChangeRecord rejected = load(id).rejected(
                    reason == null || reason.isBlank() ? "Rejected" : reason, clock.instant());
            repository.save(rejected);
            log.info("Rejected change {}: {}", id, rejected.rejectReason());
            return rejected;
        });
    }

    // ── Execution ───────────────────────────────────────────────────

    /**
     * Writes an approved change through the safety system.
     * <p>
     * On success the record is {@code APPLIED} with its backup attached. If the backup or the
     * write fails, the file holds its original content and the returned record is
     * {@code FAILED} with the reason. If the {@code APPLIED} record cannot be stored, the file is
     * restored from its backup before the failure is recorded.
     *
     * @throws IllegalTransitionException if the change is not approved
     * @throws RollbackFailedException    if the write (or storing its result) failed and the
     *                                    restore failed too
     */
    public ChangeRecord executeChange(String id) {
        return withChangeAndPath(id, record -> {
            if (record.status() != ChangeStatus.APPROVED) {
                throw new IllegalTransitionException(id, record.status(), "execute");
            }
            long start = System.currentTimeMillis();
            ChangeRecord applied;
            try {
                applied = safetySystem.applyChange(record);
            } catch (WriteFailedException e) {
                return markFailed(record, e.getBackup(), "failed", start, e);
            } catch (RollbackFailedException e) {
                markFailed(record, null, "rollback-failed", start, e);
                throw e;
            } catch (FileAccessException e) {
                return markFailed(record, null, "failed", start, e);
            }
            try {
                repository.save(applied);
            } catch (FileAccessException e) {
                return undoUnrecordedWrite(record, applied.backup(), start, e);
            }
            history.recordSuccess(record.kind(), record.filePath());
            metrics.recordExecution("applied", System.currentTimeMillis() - start);
            log.info("Applied change {} to {}", id, record.filePath());
            return applied;
        });
    }

    /**
     * The file was written but the APPLIED record could not be stored. Puts the original
     * content back so the file matches the stored state, then records the failure.
     */
    private ChangeRecord undoUnrecordedWrite(ChangeRecord record, BackupRecord backup, long start,
                                             FileAccessException storeError) {
        log.error("Change {} was written to {} but could not be recorded; restoring", record.id(),
                record.filePath(), storeError);
        if (backup == null) {
            metrics.recordExecution("rollback-failed", System.currentTimeMillis() - start);
            throw new RollbackFailedException(("Change %s was written to %s but could not be recorded (%s) and no "
                    + "backup was taken; manual intervention required")
                    .formatted(record.id(), record.filePath(), storeError.getMessage()), "(none)");
        }
        try {
            safetySystem.restore(backup);
        } catch (RuntimeException restoreError) {
            metrics.recordExecution("rollback-failed", System.currentTimeMillis() - start);
            throw new RollbackFailedException(record.filePath(), backup.backupPath(), storeError, restoreError);
        }
        return markFailed(record, backup, "failed", start, storeError);
    }

    private ChangeRecord markFailed(ChangeRecord record, BackupRecord backup, String outcome, long start,
                                    RuntimeException cause) {
        ChangeRecord failed = record.failed(cause.getMessage(), backup, clock.instant());
        repository.save(failed);
        history.recordFailure(record.kind(), record.filePath());
        metrics.recordExecution(outcome, System.currentTimeMillis() - start);
        log.warn("Change {} failed: {}", record.id(), cause.getMessage(), cause);
        return failed;
    }

    /**
     * Restores the file behind an applied change and moves the change to {@code REJECTED}.
     *
     * @throws NoBackupAvailableException if the change carries no backup; nothing is touched
     */
    public ChangeRecord rollbackChange(String id, String reason) {
        return withChangeAndPath(id, record -> {
            if (record.backup() == null) {
                throw new NoBackupAvailableException(id);
            }
            try {
                ChangeRecord rolledBack = safetySystem.rollbackChange(record,
                        reason == null || reason.isBlank() ? "Rolled back" : reason);
                repository.save(rolledBack);
                history.recordRollback(record.kind(), record.filePath());
                metrics.recordRollback(true);
                log.info("Rolled back change {} on {}", id, record.filePath());
                return rolledBack;
            } catch (FileAccessException e) {
                metrics.recordRollback(false);
                throw e;
            }
        });
    }

    /** Sends a failed change back to pending with a fresh assessment. */
    public ChangeRecord retryChange(String id) {
        return withChangeAndPath(id, record -> {
            ChangeRecord pending = assess(record.retried(clock.instant()));
            repository.save(pending);
            log.info("Retrying change {}: score {}", id, pending.riskScore());
            return maybeAutoApprove(pending, !CLEANUP_ORIGIN.equals(record.originModel()));
        });
    }

    // ── Review publishing ───────────────────────────────────────────

    /**
     * Writes the given changes onto a new branch and opens a review request for them.
     * Each change must be approved, or pending with a recommendation other than manual approval.
     * On success all become {@code APPLIED} with the review URL; on failure every written file is
     * restored and all become {@code FAILED} with the failed step in the message.
     *
     * @throws RollbackFailedException if some written files could not be restored; every record is
     *                                 stored as {@code FAILED} naming those files first
     */
    public PublishResult publishChanges(List<String> ids, String branch, String title, String description) {
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("No changes to publish");
        }
        List<ChangeRecord> batch = ids.stream().distinct().map(this::load).toList();
        var keys = new ArrayList<String>();
        var paths = new HashSet<String>();
        for (ChangeRecord record : batch) {
            if (!paths.add(record.filePath())) {
                throw new IllegalArgumentException("More than one change in the batch targets " + record.filePath());
            }
            keys.add(idKey(record.id()));
            keys.add(pathKey(Path.of(record.filePath())));
        }

        return locks.withLocks(keys, () -> {
            List<ChangeRecord> current = batch.stream().map(r -> load(r.id())).toList();
            for (ChangeRecord record : current) {
                boolean eligible = record.status() == ChangeStatus.APPROVED
                        || (record.status() == ChangeStatus.PENDING && record.isAssessed()
                        && record.assessment().recommendation() != Recommendation.MANUAL_APPROVAL_REQUIRED);
                if (!eligible) {
                    throw new IllegalTransitionException(record.id(), record.status(), "publish");
                }
            }

            PublishResult result;
            try {
                result = publishWorkflow.applyChangesWithPR(current, branch, title, description);
            } catch (RollbackFailedException e) {
                current.forEach(r -> repository.save(r.failed(e.getMessage(), null, clock.instant())));
                throw e;
            }

            String failure = null;
            if (!result.success()) {
                failure = "Publish failed at %s: %s".formatted(result.failedStep(), result.failureReason());
                if (!result.rolledBack()) {
                    failure += "; restore incomplete, manual intervention required: "
                            + String.join("; ", result.restoreFailures());
                }
            }
            for (ChangeRecord record : current) {
                ChangeRecord updated;
                if (result.success()) {
                    updated = record.applied(result.backups().get(record.id()), result.reviewUrl(), clock.instant());
                    history.recordSuccess(record.kind(), record.filePath());
                } else {
                    updated = record.failed(failure, result.backups().get(record.id()), clock.instant());
                    history.recordFailure(record.kind(), record.filePath());
                }
                repository.save(updated);
            }
            if (!result.success() && !result.rolledBack()) {
                throw new RollbackFailedException(failure, safetySystem.backupDirectory().toString());
            }
            return result;
        });
    }

    // ── Queries ─────────────────────────────────────────────────────

    public ChangeRecord getChange(String id) {
        return load(id);
    }

    public List<ChangeRecord> getPendingChanges() {
        return repository.findByStatus(ChangeStatus.PENDING);
    }

    public List<ChangeRecord> getAppliedChanges() {
        return repository.findByStatus(ChangeStatus.APPLIED);
    }

    public List<ChangeRecord> getAllChanges() {
        return repository.findAll();
    }

    public ChangeStatistics getStatistics() {
        Map<ChangeStatus, Long> byStatus = new EnumMap<>(ChangeStatus.class);
        Map<RiskCategory, Long> byCategory = new EnumMap<>(RiskCategory.class);
        List<ChangeRecord> all = repository.findAll();
        for (ChangeRecord record : all) {
            byStatus.merge(record.status(), 1L, Long::sum);
            if (record.isAssessed()) {
                byCategory.merge(record.assessment().category(), 1L, Long::sum);
            }
        }
        return new ChangeStatistics(all.size(), byStatus, byCategory);
    }

    // ── Helpers ─────────────────────────────────────────────────────

    private ChangeRecord load(String id) {
        return repository.findById(id).orElseThrow(() -> new ChangeNotFoundException(id));
    }

    /** Runs {@code action} holding the change's id lock and its target path lock. */
    private ChangeRecord withChangeAndPath(String id, Function<ChangeRecord, ChangeRecord> action) {
        Path target = Path.of(load(id).filePath());
        return locks.withLocks(List.of(idKey(id), pathKey(target)), () -> {
            ChangeRecord record = load(id);
            MdcContext.setChange(id, record.filePath());
            try {
                return action.apply(record);
            } finally {
                MdcContext.clear();
            }
        });
    }

    private Path resolve(String filePath) {
        return workspace.resolve(filePath);
    }

    private static String idKey(String id) {
        return "change:" + id;
    }

    private static String pathKey(Path path) {
        return "path:" + path.toAbsolutePath().normalize();
    }
}

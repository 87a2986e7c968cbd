package com.changeguard.core.model;

import com.changeguard.core.exception.IllegalTransitionException;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * One proposed modification to one file, kept as an audit trail entry.
 * <p>
 * Instances are immutable. Every state change goes through one of the transition methods
 * below, which check the status graph in {@link ChangeStatus} and are the only places the
 * optional fields get populated: the assessment is set while pending, the backup only by the
 * applied / failed paths, and the remote reference only by {@link #applied} once the review
 * request exists.
 *
 * @param id              unique identifier
 * @param createdAt       proposal time
 * @param updatedAt       time of the last transition
 * @param kind            create / update / delete / refactor
 * @param filePath        absolute path of the target file
 * @param description     what the change does
 * @param diff            line diff against the on-disk content at assessment time (nullable)
 * @param newContent      full proposed content; {@code null} for deletes
 * @param originModel     identifier of the proposer (model id or "cleanup-engine")
 * @param rationale       why the proposer wants the change
 * @param riskScore       danger score in [0,10], {@code null} until assessed
 * @param assessment      full assessment, {@code null} until assessed
 * @param status          lifecycle status
 * @param backup          pre-write backup, set by the apply path
 * @param remoteReference review request URL, set only after the remote commit exists
 * @param errorMessage    human-readable failure reason when status is FAILED
 * @param rejectReason    reason given when the change was rejected or rolled back
 */
public record ChangeRecord(
    String id,
    Instant createdAt,
    Instant updatedAt,
    ChangeKind kind,
    String filePath,
    String description,
    String diff,
    String newContent,
    String originModel,
    String rationale,
    Integer riskScore,
    RiskAssessment assessment,
    ChangeStatus status,
    BackupRecord backup,
    String remoteReference,
    String errorMessage,
    String rejectReason
) implements Serializable {

    public static ChangeRecord proposed(ChangeKind kind, String filePath, String description,
                                        String newContent, String originModel, String rationale,
                                        Instant now) {
        return new ChangeRecord(UUID.randomUUID().toString(), now, now, kind, filePath, description,
                null, newContent, originModel, rationale, null, null,
                ChangeStatus.PENDING, null, null, null, null);
    }

    @JsonIgnore
    public boolean isAssessed() {
        return assessment != null;
    }

    /** Attaches a fresh assessment and the diff it was computed from. Only legal while pending. */
    public ChangeRecord assessed(RiskAssessment newAssessment, String newDiff, Instant now) {
        if (status != ChangeStatus.PENDING) {
            throw new IllegalTransitionException(id, status, "assessment");
        }
        return new ChangeRecord(id, createdAt, now, kind, filePath, description, newDiff, newContent,
                originModel, rationale, newAssessment.score(), newAssessment, status, backup,
                remoteReference, errorMessage, rejectReason);
    }

    public ChangeRecord approved(Instant now) {
        return withStatus(ChangeStatus.APPROVED, now, backup, remoteReference, errorMessage, rejectReason);
    }

    public ChangeRecord rejected(String reason, Instant now) {
        return withStatus(ChangeStatus.REJECTED, now, backup, remoteReference, errorMessage, reason);
    }

    /**
     * Marks the change as written. The backup may be {@code null} only when backups have been
     * explicitly disabled.
     */
    public ChangeRecord applied(BackupRecord appliedBackup, String reviewUrl, Instant now) {
        return withStatus(ChangeStatus.APPLIED, now, appliedBackup, reviewUrl, null, rejectReason);
    }

    public ChangeRecord failed(String error, BackupRecord attemptBackup, Instant now) {
        return withStatus(ChangeStatus.FAILED, now, attemptBackup != null ? attemptBackup : backup,
                remoteReference, error, rejectReason);
    }

    /** Undo of an applied change: the backup stays attached for the audit trail. */
    public ChangeRecord rolledBack(String reason, Instant now) {
        if (status != ChangeStatus.APPLIED) {
            throw new IllegalTransitionException(id, status, "rollback");
        }
        return withStatus(ChangeStatus.REJECTED, now, backup, remoteReference, errorMessage, reason);
    }

    /** Sends a failed change back to pending. The caller must re-assess it. */
    public ChangeRecord retried(Instant now) {
        if (status != ChangeStatus.FAILED) {
            throw new IllegalTransitionException(id, status, "retry");
        }
        return new ChangeRecord(id, createdAt, now, kind, filePath, description, null, newContent,
                originModel, rationale, null, null, ChangeStatus.PENDING, backup,
                remoteReference, null, rejectReason);
    }

    private ChangeRecord withStatus(ChangeStatus target, Instant now, BackupRecord newBackup,
                                    String newRemoteReference, String newError, String newRejectReason) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalTransitionException(id, status, target);
        }
        return new ChangeRecord(id, createdAt, now, kind, filePath, description, diff, newContent,
                originModel, rationale, riskScore, assessment, target, newBackup,
                newRemoteReference, newError, newRejectReason);
    }
}

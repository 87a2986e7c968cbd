package com.changeguard.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a review-publish run.
 * <p>
 * A failed run names the step that failed and why, lists the steps that completed before it,
 * and reports whether every file written in the batch was restored.
 *
 * @param success         true when all steps completed
 * @param completedSteps  steps that finished, in order
 * @param failedStep      step that failed, {@code null} on success
 * @param failureReason   error text of the failed step, {@code null} on success
 * @param backups         backups taken per written change id, in batch order; a value is {@code null} when
 *                        backups are disabled
 * @param commitSha       commit created on the review branch, {@code null} if none
 * @param reviewUrl       URL of the review request, {@code null} unless published
 * @param rolledBack      true when every written file was restored after a failure
 * @param restoreFailures one entry per written file that could not be restored, naming the file, its backup
 *                        and the restore error; empty when {@code rolledBack} or on success
 */
public record PublishResult(
    boolean success,
    List<PublishStep> completedSteps,
    PublishStep failedStep,
    String failureReason,
    Map<String, BackupRecord> backups,
    String commitSha,
    String reviewUrl,
    boolean rolledBack,
    List<String> restoreFailures
) {

    public PublishResult {
        restoreFailures = restoreFailures == null ? List.of() : List.copyOf(restoreFailures);
    }

    public static PublishResult succeeded(List<PublishStep> completedSteps, Map<String, BackupRecord> backups,
                                          String commitSha, String reviewUrl) {
        return new PublishResult(true, List.copyOf(completedSteps), null, null,
                Collections.unmodifiableMap(new LinkedHashMap<>(backups)),
                commitSha, reviewUrl, false, List.of());
    }

    public static PublishResult failed(List<PublishStep> completedSteps, PublishStep failedStep,
                                       String failureReason, Map<String, BackupRecord> backups,
                                       String commitSha, List<String> restoreFailures) {
        return new PublishResult(false, List.copyOf(completedSteps), failedStep, failureReason,
                Collections.unmodifiableMap(new LinkedHashMap<>(backups)), commitSha, null,
                restoreFailures.isEmpty(), restoreFailures);
    }
}

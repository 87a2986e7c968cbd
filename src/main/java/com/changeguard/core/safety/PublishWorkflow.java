package com.changeguard.core.safety;

import com.changeguard.core.exception.ChangeguardException;
import com.changeguard.core.exception.RollbackFailedException;
import com.changeguard.core.logging.MdcContext;
import com.changeguard.core.metrics.ChangeguardMetrics;
import com.changeguard.core.model.BackupRecord;
import com.changeguard.core.model.ChangeRecord;
import com.changeguard.core.model.PublishResult;
import com.changeguard.core.model.PublishStep;
import com.changeguard.core.vcs.GitClient;
import com.changeguard.core.vcs.PublishProperties;
import com.changeguard.core.vcs.ReviewRequestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a batch of changes and publishes them for review on a new branch.
 * <p>
 * Steps run strictly in order: apply every change (backup then write), create the branch,
 * commit, push, open the review request. The first failing step stops the run; every file
 * written by the batch is then restored from its own backup and the result names the step
 * that failed. When the review branch had been created, the branch that was checked out before
 * the run is checked out again first. Remote side effects of completed steps (a pushed branch,
 * for instance) are left in place. On success the review branch stays checked out.
 */
@Service
public class PublishWorkflow {

    private static final Logger log = LoggerFactory.getLogger(PublishWorkflow.class);

    private final SafetySystem safetySystem;
    private final GitClient gitClient;
    private final ReviewRequestClient reviewClient;
    private final PublishProperties properties;
    private final ChangeguardMetrics metrics;

    public PublishWorkflow(SafetySystem safetySystem, GitClient gitClient, ReviewRequestClient reviewClient,
                           PublishProperties properties, ChangeguardMetrics metrics) {
        this.safetySystem = safetySystem;
        this.gitClient = gitClient;
        this.reviewClient = reviewClient;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Runs the full apply-and-publish sequence. Statuses of the given records are not changed
     * here; the caller marks them from the returned result.
     *
     * @throws RollbackFailedException if a write failed and its own restore failed too; the other
     *                                 written files have been restored before this is thrown
     */
    public PublishResult applyChangesWithPR(List<ChangeRecord> changes, String branch,
                                            String title, String description) {
        if (changes.isEmpty()) {
            throw new IllegalArgumentException("No changes to publish");
        }
        MdcContext.setBranch(branch);
        try {
            return run(changes, branch, title, description);
        } finally {
            MdcContext.clear();
        }
    }

    private PublishResult run(List<ChangeRecord> changes, String branch, String title, String description) {
        var completed = new ArrayList<PublishStep>();
        Map<String, BackupRecord> written = new LinkedHashMap<>();
        log.info("Publishing {} change(s) on branch '{}'", changes.size(), branch);

        // ── APPLY ───────────────────────────────────────────────────
        for (ChangeRecord change : changes) {
            try {
                written.put(change.id(), safetySystem.writeWithBackup(change));
            } catch (RollbackFailedException e) {
                restoreAll(written);
                metrics.recordPublish(PublishStep.APPLY, changes.size());
                throw e;
            } catch (ChangeguardException e) {
                return fail(completed, PublishStep.APPLY,
                        "Change " + change.id() + ": " + e.getMessage(), written, null, null, changes.size());
            }
        }
        completed.add(PublishStep.APPLY);

        List<Path> files = changes.stream().map(c -> Path.of(c.filePath())).toList();
        String commitSha = null;
        String originalBranch = null;
        PublishStep step = PublishStep.CREATE_BRANCH;
        try {
            originalBranch = gitClient.currentBranch();
            gitClient.createBranch(branch);
            completed.add(step);

            step = PublishStep.COMMIT;
            commitSha = gitClient.commitChanges(title, files);
            completed.add(step);

            step = PublishStep.PUSH;
            gitClient.pushChanges(branch);
            completed.add(step);

            step = PublishStep.PUBLISH;
            String reviewUrl = reviewClient.publishForReview(branch, properties.getBaseBranch(), title, description);
            completed.add(step);

            log.info("Published {} change(s) as {} (commit {})", changes.size(), reviewUrl, commitSha);
            metrics.recordPublish(null, changes.size());
            return PublishResult.succeeded(completed, written, commitSha, reviewUrl);
        } catch (RuntimeException e) {
            String returnTo = completed.contains(PublishStep.CREATE_BRANCH) ? originalBranch : null;
            return fail(completed, step, e.getMessage(), written, commitSha, returnTo, changes.size());
        }
    }

    /**
     * Stops the run: switches back to {@code returnTo} when the review branch was already
     * checked out, then restores every written file.
     */
    private PublishResult fail(List<PublishStep> completed, PublishStep step, String reason,
                               Map<String, BackupRecord> written, String commitSha, String returnTo,
                               int batchSize) {
        log.warn("Publish failed at {}: {}; restoring {} written file(s)", step, reason, written.size());
        var failures = new ArrayList<String>();
        if (returnTo != null) {
            try {
                gitClient.checkoutBranch(returnTo);
            } catch (RuntimeException e) {
                log.error("Could not return to branch '{}' after failed publish", returnTo, e);
                failures.add("checkout of '%s' failed: %s".formatted(returnTo, e.getMessage()));
            }
        }
        failures.addAll(restoreAll(written));
        metrics.recordPublish(step, batchSize);
        return PublishResult.failed(completed, step, reason, written, commitSha, failures);
    }

    /** Restores written files newest first. Returns one entry per file that could not be restored. */
    private List<String> restoreAll(Map<String, BackupRecord> written) {
        var entries = new ArrayList<>(written.entrySet());
        var failures = new ArrayList<String>();
        for (int i = entries.size() - 1; i >= 0; i--) {
            var entry = entries.get(i);
            BackupRecord backup = entry.getValue();
            if (backup == null) {
                log.error("Change {} was written without a backup and cannot be restored", entry.getKey());
                failures.add("change %s has no backup".formatted(entry.getKey()));
                continue;
            }
            try {
                safetySystem.restore(backup);
            } catch (RuntimeException e) {
                log.error("Restore of {} for change {} FAILED, manual intervention required (backup {})",
                        backup.originalPath(), entry.getKey(), backup.backupPath(), e);
                failures.add("%s not restored from %s: %s".formatted(
                        backup.originalPath(), backup.backupPath(), e.getMessage()));
            }
        }
        return failures;
    }
}

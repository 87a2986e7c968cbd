package com.changeguard.core.metrics;

import com.changeguard.core.model.PublishStep;
import com.changeguard.core.model.RiskCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for the change pipeline.
 */
@Service
public class ChangeguardMetrics {

    private final MeterRegistry registry;

    public ChangeguardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordProposal(RiskCategory category) {
        Counter.builder("changeguard.proposals.total")
                .tag("category", tag(category.name()))
                .register(registry)
                .increment();
    }

    public void recordRiskScore(int score) {
        DistributionSummary.builder("changeguard.risk.score")
                .description("Danger score of assessed changes (0 safest, 10 most dangerous)")
                .register(registry)
                .record(score);
    }

    /**
     * @param outcome "applied", "failed" or "rollback-failed"
     */
    public void recordExecution(String outcome, long ms) {
        Counter.builder("changeguard.executions.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("changeguard.execution.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRollback(boolean success) {
        Counter.builder("changeguard.rollbacks.total")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    /**
     * Records a review-publish run.
     *
     * @param failedStep step that failed, {@code null} on success
     */
    public void recordPublish(PublishStep failedStep, int changeCount) {
        Counter.builder("changeguard.publish.total")
                .description("Review-publish runs by failed step")
                .tag("failed_step", failedStep == null ? "none" : tag(failedStep.name()))
                .register(registry)
                .increment();
        DistributionSummary.builder("changeguard.publish.batch_size")
                .register(registry)
                .record(changeCount);
    }

    public void recordBackupsCleaned(int count) {
        Counter.builder("changeguard.backups.cleaned")
                .description("Backups deleted by the retention sweep")
                .register(registry)
                .increment(count);
    }

    private static String tag(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}

package com.changeguard.core.risk;

import com.changeguard.core.exception.AssessmentException;
import com.changeguard.core.model.ChangeKind;
import com.changeguard.core.model.ChangeRecord;
import com.changeguard.core.model.RiskAssessment;
import com.changeguard.core.model.RiskCategory;
import com.changeguard.core.model.RiskFactor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Scores a proposed change on the 0 (safest) to 10 (most dangerous) scale.
 * <p>
 * The score is the sum of four factor contributions clamped to [0,10]:
 * <ul>
 *   <li>file sensitivity: security-related path, or else configuration path</li>
 *   <li>change magnitude: changed-line count bucketed small / medium / large</li>
 *   <li>change kind: delete &gt; refactor &gt; update &gt; create</li>
 *   <li>historical outcome: penalty when similar changes have mostly failed</li>
 * </ul>
 * No file is read here; the caller supplies the diff against current content. Given the same
 * change, diff and outcome history the result is always identical.
 */
@Service
public class RiskAssessor {

    private final RiskProperties properties;
    private final OutcomeHistory history;

    public RiskAssessor(RiskProperties properties, OutcomeHistory history) {
        properties.validate();
        this.properties = properties;
        this.history = history;
    }

    /** Assesses the change against the diff it already carries. */
    public RiskAssessment assessRisk(ChangeRecord change) {
        return assessRisk(change, change.diff());
    }

    /**
     * Assesses the change against {@code diff}.
     *
     * @throws AssessmentException if the change is missing its kind, path or content
     */
    public RiskAssessment assessRisk(ChangeRecord change, String diff) {
        validate(change);

        var factors = new ArrayList<RiskFactor>();
        factors.add(sensitivity(change.filePath()));
        factors.add(magnitude(change, diff));
        factors.add(kind(change.kind()));
        factors.add(historicalOutcome(change));

        int raw = factors.stream().mapToInt(RiskFactor::impact).sum();
        int score = Math.max(0, Math.min(10, raw));
        RiskCategory category = categoryFor(score);
        return new RiskAssessment(score, category, category.recommendation(), factors);
    }

    /** Maps a score onto its band using the configured inclusive upper bounds. */
    public RiskCategory categoryFor(int score) {
        if (score < 0 || score > 10) {
            throw new IllegalArgumentException("Risk score out of range [0,10]: " + score);
        }
        if (score <= properties.getSafeMax()) {
            return RiskCategory.SAFE;
        }
        if (score <= properties.getLowMax()) {
            return RiskCategory.LOW;
        }
        if (score <= properties.getMediumMax()) {
            return RiskCategory.MEDIUM;
        }
        if (score <= properties.getHighMax()) {
            return RiskCategory.HIGH;
        }
        return RiskCategory.CRITICAL;
    }

    private void validate(ChangeRecord change) {
        if (change == null) {
            throw new AssessmentException("Change must not be null");
        }
        if (change.kind() == null) {
            throw new AssessmentException("Change " + change.id() + " has no kind");
        }
        if (change.filePath() == null || change.filePath().isBlank()) {
            throw new AssessmentException("Change " + change.id() + " has no target path");
        }
        if (change.kind() != ChangeKind.DELETE && change.newContent() == null) {
            throw new AssessmentException("Change " + change.id() + " (" + change.kind() + ") has no content");
        }
    }

    // ── Factors ─────────────────────────────────────────────────────

    private RiskFactor sensitivity(String filePath) {
        String path = filePath.toLowerCase(Locale.ROOT).replace('\\', '/');
        for (String pattern : properties.getSensitivePatterns()) {
            if (path.contains(pattern.toLowerCase(Locale.ROOT))) {
                return new RiskFactor("file-sensitivity", properties.getSensitiveWeight(),
                        "Path matches security-sensitive pattern '" + pattern + "'");
            }
        }
        for (String pattern : properties.getConfigPatterns()) {
            if (path.contains(pattern.toLowerCase(Locale.ROOT))) {
                return new RiskFactor("file-sensitivity", properties.getConfigWeight(),
                        "Path matches configuration pattern '" + pattern + "'");
            }
        }
        return new RiskFactor("file-sensitivity", 0, "Ordinary source file");
    }

    private RiskFactor magnitude(ChangeRecord change, String diff) {
        int changed = diff != null
                ? LineDiff.changedLines(diff)
                : (int) (change.newContent() == null ? 0 : change.newContent().lines().count());
        if (changed < properties.getSmallChangeLines()) {
            return new RiskFactor("change-magnitude", 0, "Small change (%d lines)".formatted(changed));
        }
        if (changed <= properties.getLargeChangeLines()) {
            return new RiskFactor("change-magnitude", properties.getMediumChangeWeight(),
                    "Medium change (%d lines)".formatted(changed));
        }
        return new RiskFactor("change-magnitude", properties.getLargeChangeWeight(),
                "Large change (%d lines)".formatted(changed));
    }

    private RiskFactor kind(ChangeKind kind) {
        return new RiskFactor("change-kind", properties.kindWeight(kind),
                kind.name().toLowerCase(Locale.ROOT) + " operation");
    }

    private RiskFactor historicalOutcome(ChangeRecord change) {
        OptionalDouble rate = history.successRate(change.kind(), change.filePath(), properties.getHistoryMinSamples());
        if (rate.isEmpty()) {
            return new RiskFactor("historical-outcome", 0, "Not enough history for similar changes");
        }
        double r = rate.getAsDouble();
        String pct = "%.0f%%".formatted(r * 100);
        if (r < properties.getHistoryPoorRate()) {
            return new RiskFactor("historical-outcome", properties.getHistoryPenalty(),
                    "Similar changes succeeded only " + pct + " of the time");
        }
        return new RiskFactor("historical-outcome", 0, "Similar changes succeeded " + pct + " of the time");
    }
}

package com.changeguard.core.risk;

import com.changeguard.core.model.ChangeKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weights and thresholds for risk scoring. Scores run from 0 (safest) to 10 (most dangerous).
 */
@Component
@ConfigurationProperties(prefix = "changeguard.risk")
public class RiskProperties {

    /** Case-insensitive path fragments marking security-sensitive files. */
    private List<String> sensitivePatterns = List.of(
            "auth", "security", "password", "secret", "credential", "token", ".env", "login",
            "session", "crypto", "permission"
    );

    /** Case-insensitive path fragments marking configuration files. */
    private List<String> configPatterns = List.of(
            "config", "settings", ".yml", ".yaml", ".properties", "package.json", "pom.xml"
    );

    private int sensitiveWeight = 4;
    private int configWeight = 2;

    /** Changed-line counts below this are small. */
    private int smallChangeLines = 10;
    /** Changed-line counts above this are large. */
    private int largeChangeLines = 100;
    private int mediumChangeWeight = 2;
    private int largeChangeWeight = 4;

    private Map<ChangeKind, Integer> kindWeights = new EnumMap<>(Map.of(
            ChangeKind.DELETE, 4,
            ChangeKind.REFACTOR, 2,
            ChangeKind.UPDATE, 1,
            ChangeKind.CREATE, 0
    ));

    private int historyMinSamples = 3;
    private double historyPoorRate = 0.5;
    private int historyPenalty = 1;

    // Inclusive upper bounds of each band; CRITICAL runs from highMax + 1 to 10.
    private int safeMax = 1;
    private int lowMax = 3;
    private int mediumMax = 6;
    private int highMax = 8;

    /**
     * Checks that the category bounds partition [0,10] and that weights are in range.
     *
     * @throws IllegalStateException on an invalid configuration
     */
    public void validate() {
        if (!(0 <= safeMax && safeMax < lowMax && lowMax < mediumMax && mediumMax < highMax && highMax < 10)) {
            throw new IllegalStateException(
                    "Risk category bounds must satisfy 0 <= safe-max < low-max < medium-max < high-max < 10, got %d/%d/%d/%d"
                            .formatted(safeMax, lowMax, mediumMax, highMax));
        }
        if (smallChangeLines < 1 || largeChangeLines < smallChangeLines) {
            throw new IllegalStateException("Change size buckets must satisfy 1 <= small-change-lines <= large-change-lines");
        }
        for (ChangeKind kind : ChangeKind.values()) {
            int weight = kindWeight(kind);
            if (weight < 0 || weight > 10) {
                throw new IllegalStateException("Weight for " + kind + " out of range [0,10]: " + weight);
            }
        }
        for (int weight : new int[] {sensitiveWeight, configWeight, mediumChangeWeight, largeChangeWeight, historyPenalty}) {
            if (weight < 0 || weight > 10) {
                throw new IllegalStateException("Risk weight out of range [0,10]: " + weight);
            }
        }
    }

    public int kindWeight(ChangeKind kind) {
        return kindWeights.getOrDefault(kind, 0);
    }

    public List<String> getSensitivePatterns() {
        return sensitivePatterns;
    }

    public void setSensitivePatterns(List<String> sensitivePatterns) {
        this.sensitivePatterns = sensitivePatterns;
    }

    public List<String> getConfigPatterns() {
        return configPatterns;
    }

    public void setConfigPatterns(List<String> configPatterns) {
        this.configPatterns = configPatterns;
    }

    public int getSensitiveWeight() {
        return sensitiveWeight;
    }

    public void setSensitiveWeight(int sensitiveWeight) {
        this.sensitiveWeight = sensitiveWeight;
    }

    public int getConfigWeight() {
        return configWeight;
    }

    public void setConfigWeight(int configWeight) {
        this.configWeight = configWeight;
    }

    public int getSmallChangeLines() {
        return smallChangeLines;
    }

    public void setSmallChangeLines(int smallChangeLines) {
        this.smallChangeLines = smallChangeLines;
    }

    public int getLargeChangeLines() {
        return largeChangeLines;
    }

    public void setLargeChangeLines(int largeChangeLines) {
        this.largeChangeLines = largeChangeLines;
    }

    public int getMediumChangeWeight() {
        return mediumChangeWeight;
    }

    public void setMediumChangeWeight(int mediumChangeWeight) {
        this.mediumChangeWeight = mediumChangeWeight;
    }

    public int getLargeChangeWeight() {
        return largeChangeWeight;
    }

    public void setLargeChangeWeight(int largeChangeWeight) {
        this.largeChangeWeight = largeChangeWeight;
    }

    public Map<ChangeKind, Integer> getKindWeights() {
        return kindWeights;
    }

    public void setKindWeights(Map<ChangeKind, Integer> kindWeights) {
        this.kindWeights = new EnumMap<>(kindWeights);
    }

    public int getHistoryMinSamples() {
        return historyMinSamples;
    }

    public void setHistoryMinSamples(int historyMinSamples) {
        this.historyMinSamples = historyMinSamples;
    }

    public double getHistoryPoorRate() {
        return historyPoorRate;
    }

    public void setHistoryPoorRate(double historyPoorRate) {
        this.historyPoorRate = historyPoorRate;
    }

    public int getHistoryPenalty() {
        return historyPenalty;
    }

    public void setHistoryPenalty(int historyPenalty) {
        this.historyPenalty = historyPenalty;
    }

    public int getSafeMax() {
        return safeMax;
    }

    public void setSafeMax(int safeMax) {
        this.safeMax = safeMax;
    }

    public int getLowMax() {
        return lowMax;
    }

    public void setLowMax(int lowMax) {
        this.lowMax = lowMax;
    }

    public int getMediumMax() {
        return mediumMax;
    }

    public void setMediumMax(int mediumMax) {
        this.mediumMax = mediumMax;
    }

    public int getHighMax() {
        return highMax;
    }

    public void setHighMax(int highMax) {
        this.highMax = highMax;
    }
}

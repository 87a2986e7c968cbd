package com.changeguard.core.model;

/**
 * Coarse danger band derived from a risk score. Ordered from least to most dangerous.
 */
public enum RiskCategory {
    SAFE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** Maps a category onto the action the pipeline recommends for it. */
    public Recommendation recommendation() {
        return switch (this) {
            case SAFE, LOW -> Recommendation.AUTO_APPLY;
            case MEDIUM -> Recommendation.CREATE_REVIEW;
            case HIGH, CRITICAL -> Recommendation.MANUAL_APPROVAL_REQUIRED;
        };
    }
}

package com.changeguard.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a {@link ChangeRecord}.
 * <p>
 * Allowed transitions:
 * <pre>
 *   PENDING  → APPROVED | REJECTED | APPLIED | FAILED
 *   APPROVED → APPLIED | FAILED | REJECTED
 *   FAILED   → PENDING (retry) | REJECTED
 *   APPLIED  → REJECTED (rollback)
 *   REJECTED → (terminal)
 * </pre>
 * {@code PENDING → APPLIED} and {@code PENDING → FAILED} are taken only by the review-publish
 * path, which writes a batch of changes onto a review branch without individual approval.
 */
public enum ChangeStatus {
    PENDING,
    APPROVED,
    APPLIED,
    REJECTED,
    FAILED;

    public Set<ChangeStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(APPROVED, REJECTED, APPLIED, FAILED);
            case APPROVED -> EnumSet.of(APPLIED, FAILED, REJECTED);
            case FAILED -> EnumSet.of(PENDING, REJECTED);
            case APPLIED -> EnumSet.of(REJECTED);
            case REJECTED -> EnumSet.noneOf(ChangeStatus.class);
        };
    }

    public boolean canTransitionTo(ChangeStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == REJECTED;
    }
}

package com.changeguard.core.model;

/**
 * What the pipeline recommends doing with an assessed change.
 */
public enum Recommendation {
    /** Approve and apply without human confirmation. */
    AUTO_APPLY,
    /** Package onto a review branch for human sign-off. */
    CREATE_REVIEW,
    /** Leave pending; no write is attempted until a human approves. */
    MANUAL_APPROVAL_REQUIRED
}

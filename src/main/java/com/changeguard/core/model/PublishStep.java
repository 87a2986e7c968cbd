package com.changeguard.core.model;

/**
 * Steps of the review-publish sequence, in execution order.
 */
public enum PublishStep {
    APPLY,
    CREATE_BRANCH,
    COMMIT,
    PUSH,
    PUBLISH
}

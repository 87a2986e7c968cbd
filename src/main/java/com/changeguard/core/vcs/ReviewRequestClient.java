package com.changeguard.core.vcs;

/**
 * Opens a review request (pull request) on the remote host for a pushed branch.
 */
public interface ReviewRequestClient {

    /**
     * @return URL of the created review request
     * @throws com.changeguard.core.exception.ExternalServiceException if the host rejects the request
     */
    String publishForReview(String branch, String baseBranch, String title, String description);
}

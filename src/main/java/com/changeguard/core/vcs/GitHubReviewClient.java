package com.changeguard.core.vcs;

import com.changeguard.core.exception.ExternalServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Creates pull requests through the GitHub REST API.
 * <p>
 * Uses {@code POST /repos/{owner}/{repo}/pulls} with a bearer token from
 * {@link PublishProperties.GitHub#getToken()} and returns the pull request's {@code html_url}.
 */
@Component
public class GitHubReviewClient implements ReviewRequestClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubReviewClient.class);

    private final PublishProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Autowired
    public GitHubReviewClient(PublishProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    GitHubReviewClient(PublishProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    @Override
    public String publishForReview(String branch, String baseBranch, String title, String description) {
        var github = properties.getGithub();
        if (!github.isConfigured()) {
            throw new ExternalServiceException("github",
                    "changeguard.publish.github owner, repo and token must be set to open pull requests");
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("title", title);
        body.put("head", branch);
        body.put("base", baseBranch);
        body.put("body", description == null ? "" : description);

        String path = "/repos/%s/%s/pulls".formatted(github.getOwner(), github.getRepo());
        JsonNode response = post(path, body.toString());
        JsonNode url = response.get("html_url");
        if (url == null || url.asText().isBlank()) {
            throw new ExternalServiceException("github", "Pull request response had no html_url");
        }
        log.info("Opened pull request {} for branch '{}'", url.asText(), branch);
        return url.asText();
    }

    JsonNode post(String path, String body) {
        var github = properties.getGithub();
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(github.getApiUrl() + path))
                    .header("Authorization", "Bearer " + github.getToken())
                    .header("Accept", "application/vnd.github+json")
                    .header("Content-Type", "application/json")
                    .timeout(Duration.ofSeconds(30))
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new ExternalServiceException("github", "POST %s failed (HTTP %d): %s"
                        .formatted(path, response.statusCode(), response.body()));
            }
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new ExternalServiceException("github", "Request failed: POST " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("github", "Interrupted: POST " + path, e);
        }
    }
}

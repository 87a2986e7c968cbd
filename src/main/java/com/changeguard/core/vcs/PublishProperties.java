package com.changeguard.core.vcs;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "changeguard.publish")
public class PublishProperties {

    private String remote = "origin";
    private String baseBranch = "main";
    private int gitTimeoutSeconds = 120;
    private final GitHub github = new GitHub();

    public String getRemote() {
        return remote;
    }

    public void setRemote(String remote) {
        this.remote = remote;
    }

    public String getBaseBranch() {
        return baseBranch;
    }

    public void setBaseBranch(String baseBranch) {
        this.baseBranch = baseBranch;
    }

    public int getGitTimeoutSeconds() {
        return gitTimeoutSeconds;
    }

    public void setGitTimeoutSeconds(int gitTimeoutSeconds) {
        this.gitTimeoutSeconds = gitTimeoutSeconds;
    }

    public GitHub getGithub() {
        return github;
    }

    public static class GitHub {

        private String apiUrl = "https://api.github.com";
        private String owner = "";
        private String repo = "";
        private String token = "";

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getOwner() {
            return owner;
        }

        public void setOwner(String owner) {
            this.owner = owner;
        }

        public String getRepo() {
            return repo;
        }

        public void setRepo(String repo) {
            this.repo = repo;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public boolean isConfigured() {
            return !owner.isBlank() && !repo.isBlank() && !token.isBlank();
        }
    }
}

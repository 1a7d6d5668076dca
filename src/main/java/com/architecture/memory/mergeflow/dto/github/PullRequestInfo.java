package com.architecture.memory.mergeflow.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A pull request, from GitHub's Get a pull request API.
 * GET /repos/{owner}/{repo}/pulls/{pull_number}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PullRequestInfo {

    private int number;
    private String title;
    private String state;       // open, closed
    private boolean draft;
    private boolean merged;
    private GitRef head;
    private GitRef base;
    private GitHubAccount user;

    public boolean isClosed() {
        return "closed".equalsIgnoreCase(state);
    }

    public String headSha() {
        return head != null ? head.getSha() : null;
    }

    public String baseRef() {
        return base != null ? base.getRef() : null;
    }

    public String authorLogin() {
        return user != null ? user.getLogin() : null;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GitRef {
        private String ref;
        private String sha;
    }
}

package com.architecture.memory.mergeflow.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * GET /repos/{owner}/{repo}/pulls/{pull_number}/reviews
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PullRequestReview {

    public static final String APPROVED = "APPROVED";
    public static final String CHANGES_REQUESTED = "CHANGES_REQUESTED";

    private long id;
    private GitHubAccount user;
    private String state;       // APPROVED, CHANGES_REQUESTED, COMMENTED, DISMISSED, PENDING

    @JsonProperty("submitted_at")
    private String submittedAt;

    public String reviewerLogin() {
        return user != null ? user.getLogin() : null;
    }
}

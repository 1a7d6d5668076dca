package com.architecture.memory.mergeflow.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * PUT /repos/{owner}/{repo}/pulls/{pull_number}/merge
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MergeResult {
    private String sha;
    private boolean merged;
    private String message;
}

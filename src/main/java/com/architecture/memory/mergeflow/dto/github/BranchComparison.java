package com.architecture.memory.mergeflow.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * GET /repos/{owner}/{repo}/compare/{base}...{head}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BranchComparison {

    private String status;      // ahead, behind, diverged, identical

    @JsonProperty("ahead_by")
    private int aheadBy;

    @JsonProperty("behind_by")
    private int behindBy;
}

package com.architecture.memory.mergeflow.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * GET /repos/{owner}/{repo}/commits/{ref}/status
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CombinedCommitStatus {

    private String state;       // success, pending, failure, error

    @JsonProperty("total_count")
    private int totalCount;

    @Builder.Default
    private List<Object> statuses = new ArrayList<>();
}

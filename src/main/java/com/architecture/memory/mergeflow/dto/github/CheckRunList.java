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
 * GET /repos/{owner}/{repo}/commits/{ref}/check-runs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CheckRunList {

    @JsonProperty("total_count")
    private int totalCount;

    @JsonProperty("check_runs")
    @Builder.Default
    private List<CheckRun> checkRuns = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CheckRun {
        private String name;
        private String status;      // queued, in_progress, completed
        private String conclusion;  // success, failure, neutral, cancelled, skipped, timed_out, action_required
    }
}

package com.architecture.memory.mergeflow.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What the graph would look like once a PR is merged. Nothing is persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeSimulationResponse {

    private String workflowId;

    @Builder.Default
    private List<UnblockedPR> unblocked = new ArrayList<>();

    @Builder.Default
    private List<String> newCriticalPath = new ArrayList<>();

    @Builder.Default
    private List<List<String>> newConflicts = new ArrayList<>();

    private String summary;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UnblockedPR {
        private String prId;
        private int prNumber;
        private String title;
    }
}

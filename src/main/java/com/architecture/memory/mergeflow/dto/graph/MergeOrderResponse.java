package com.architecture.memory.mergeflow.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeOrderResponse {

    private String repositoryId;
    private boolean hasConflicts;

    @Builder.Default
    private List<String> conflictDetails = new ArrayList<>();

    @Builder.Default
    private List<Entry> order = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        private Integer position;       // 1-based; null for PRs in a cycle
        private String prId;
        private int prNumber;
        private String title;
        private int blockedBy;
        private int blocks;
        private RiskLevel estimatedRisk;
        private boolean inCycle;
        private String reason;
    }
}

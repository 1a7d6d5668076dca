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
public class ImpactReport {

    private String prId;
    private int prNumber;

    @Builder.Default
    private List<String> directlyBlocks = new ArrayList<>();

    @Builder.Default
    private List<String> transitivelyBlocks = new ArrayList<>();

    @Builder.Default
    private List<String> blockedBy = new ArrayList<>();

    private int impactScore;
    private Integer mergeOrderPosition;     // 0-based; null when the PR is in a cycle

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();
}

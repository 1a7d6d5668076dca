package com.architecture.memory.mergeflow.dto.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * A PR as a node of the dependency graph. Rebuilt on every graph build.
 */
@Value
@Builder
public class PRNode {
    String id;
    int prNumber;
    String title;
    String branch;
    String baseBranch;
    String author;
    String status;
    RiskLevel riskLevel;
    @Singular("fileChanged")
    Set<String> filesChanged;
    LocalDateTime createdAt;
}

package com.architecture.memory.mergeflow.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Point-in-time dependency graph of the active PRs of one repository.
 * Built per query and never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyGraph {

    private String repositoryId;

    @Builder.Default
    private List<PRNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<DependencyEdge> edges = new ArrayList<>();

    @Builder.Default
    private List<List<String>> cycles = new ArrayList<>();

    @Builder.Default
    private List<String> criticalPath = new ArrayList<>();

    @Builder.Default
    private Set<String> cyclicNodeIds = new HashSet<>();

    private boolean fileConflictsSkipped;

    private LocalDateTime generatedAt;

    public Optional<PRNode> findNode(String nodeId) {
        return nodes.stream().filter(n -> n.getId().equals(nodeId)).findFirst();
    }

    /**
     * PRs whose head branch the given PR is stacked on.
     */
    public Set<String> blockedBy(String nodeId) {
        Set<String> result = new LinkedHashSet<>();
        for (DependencyEdge edge : edges) {
            if (edge.getType() == EdgeType.BRANCH_DEPENDENCY && edge.getSource().equals(nodeId)) {
                result.add(edge.getTarget());
            }
        }
        return result;
    }

    /**
     * PRs stacked on the given PR's head branch.
     */
    public Set<String> dependents(String nodeId) {
        Set<String> result = new LinkedHashSet<>();
        for (DependencyEdge edge : edges) {
            if (edge.getType() == EdgeType.BRANCH_DEPENDENCY && edge.getTarget().equals(nodeId)) {
                result.add(edge.getSource());
            }
        }
        return result;
    }

    public List<FileConflictEdge> fileConflictsOf(String nodeId) {
        List<FileConflictEdge> result = new ArrayList<>();
        for (DependencyEdge edge : edges) {
            if (edge instanceof FileConflictEdge conflict && conflict.touches(nodeId)) {
                result.add(conflict);
            }
        }
        return result;
    }

    public boolean isCyclic(String nodeId) {
        return cyclicNodeIds.contains(nodeId);
    }

    /**
     * 0-based index in the critical path, or null for PRs caught in a cycle.
     */
    public Integer mergeOrderPosition(String nodeId) {
        if (isCyclic(nodeId)) {
            return null;
        }
        int index = criticalPath.indexOf(nodeId);
        return index >= 0 ? index : null;
    }

    public String describeNode(String nodeId) {
        return findNode(nodeId).map(n -> "PR #" + n.getPrNumber()).orElse(nodeId);
    }
}

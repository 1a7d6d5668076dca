package com.architecture.memory.mergeflow.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Response for the dependency graph of a repository.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyGraphResponse {

    private String repositoryId;
    private GraphStats stats;

    @Builder.Default
    private List<NodeSummary> nodes = new ArrayList<>();

    @Builder.Default
    private List<DependencyEdge> edges = new ArrayList<>();

    @Builder.Default
    private List<CircularDependency> cycles = new ArrayList<>();

    @Builder.Default
    private List<PathEntry> criticalPath = new ArrayList<>();

    private boolean fileConflictsSkipped;
    private LocalDateTime generatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GraphStats {
        private int totalNodes;
        private int totalEdges;
        private int cycleCount;
        private boolean hasCycles;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NodeSummary {
        private String id;
        private int prNumber;
        private String title;
        private String branch;
        private String baseBranch;
        private String author;
        private String status;
        private RiskLevel riskLevel;
        private int filesChangedCount;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PathEntry {
        private Integer position;       // 1-based, null for cyclic PRs
        private String prId;
        private int prNumber;
        private String title;
    }

    public static DependencyGraphResponse from(DependencyGraph graph) {
        List<NodeSummary> nodes = new ArrayList<>();
        for (PRNode node : graph.getNodes()) {
            nodes.add(NodeSummary.builder()
                    .id(node.getId())
                    .prNumber(node.getPrNumber())
                    .title(node.getTitle())
                    .branch(node.getBranch())
                    .baseBranch(node.getBaseBranch())
                    .author(node.getAuthor())
                    .status(node.getStatus())
                    .riskLevel(node.getRiskLevel())
                    .filesChangedCount(node.getFilesChanged().size())
                    .build());
        }

        List<CircularDependency> cycles = new ArrayList<>();
        for (List<String> cycle : graph.getCycles()) {
            cycles.add(CircularDependency.fromCycle(cycle, graph));
        }

        List<PathEntry> path = new ArrayList<>();
        for (String id : graph.getCriticalPath()) {
            Integer position = graph.mergeOrderPosition(id);
            PRNode node = graph.findNode(id).orElse(null);
            path.add(PathEntry.builder()
                    .position(position != null ? position + 1 : null)
                    .prId(id)
                    .prNumber(node != null ? node.getPrNumber() : 0)
                    .title(node != null ? node.getTitle() : "")
                    .build());
        }

        return DependencyGraphResponse.builder()
                .repositoryId(graph.getRepositoryId())
                .stats(GraphStats.builder()
                        .totalNodes(graph.getNodes().size())
                        .totalEdges(graph.getEdges().size())
                        .cycleCount(graph.getCycles().size())
                        .hasCycles(!graph.getCycles().isEmpty())
                        .build())
                .nodes(nodes)
                .edges(graph.getEdges())
                .cycles(cycles)
                .criticalPath(path)
                .fileConflictsSkipped(graph.isFileConflictsSkipped())
                .generatedAt(graph.getGeneratedAt())
                .build();
    }
}

package com.architecture.memory.mergeflow.service.graph;

import com.architecture.memory.mergeflow.dto.graph.DependencyGraph;
import com.architecture.memory.mergeflow.dto.graph.FileConflictEdge;
import com.architecture.memory.mergeflow.dto.graph.ImpactReport;
import com.architecture.memory.mergeflow.dto.graph.PRNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes what a single PR blocks, what blocks it, and how much merging it matters.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ImpactAnalysisService {

    private static final int DIRECT_WEIGHT = 10;
    private static final int TRANSITIVE_WEIGHT = 3;
    private static final int HIGH_IMPACT_THRESHOLD = 2;

    private final DependencyGraphBuilder graphBuilder;

    public ImpactReport getImpactAnalysis(String workflowId) {
        DependencyGraph graph = graphBuilder.buildGraphForWorkflow(workflowId);
        ImpactReport report = analyze(graph, workflowId);
        log.info("Impact analysis for workflow {}: blocks {} directly, {} transitively, score {}",
                workflowId, report.getDirectlyBlocks().size(), report.getTransitivelyBlocks().size(),
                report.getImpactScore());
        return report;
    }

    ImpactReport analyze(DependencyGraph graph, String prId) {
        PRNode node = graph.findNode(prId).orElseThrow();

        Set<String> blockedBy = graph.blockedBy(prId);

        Set<String> directlyBlocks = new LinkedHashSet<>(graph.dependents(prId));
        for (FileConflictEdge conflict : graph.fileConflictsOf(prId)) {
            directlyBlocks.add(conflict.getSource().equals(prId) ? conflict.getTarget() : conflict.getSource());
        }

        Set<String> transitivelyBlocks = transitiveDependents(graph, prId, directlyBlocks);

        int impactScore = DIRECT_WEIGHT * directlyBlocks.size()
                + TRANSITIVE_WEIGHT * transitivelyBlocks.size()
                + node.getRiskLevel().getWeight();

        return ImpactReport.builder()
                .prId(prId)
                .prNumber(node.getPrNumber())
                .directlyBlocks(new ArrayList<>(directlyBlocks))
                .transitivelyBlocks(new ArrayList<>(transitivelyBlocks))
                .blockedBy(new ArrayList<>(blockedBy))
                .impactScore(impactScore)
                .mergeOrderPosition(graph.mergeOrderPosition(prId))
                .recommendations(recommendations(graph, node, directlyBlocks, blockedBy))
                .build();
    }

    /**
     * BFS over stacked PRs starting from the directly blocked ones.
     */
    private Set<String> transitiveDependents(DependencyGraph graph, String prId, Set<String> directlyBlocks) {
        Set<String> visited = new LinkedHashSet<>(directlyBlocks);
        visited.add(prId);
        Set<String> result = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(directlyBlocks);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String dependent : graph.dependents(current)) {
                if (visited.add(dependent)) {
                    result.add(dependent);
                    queue.add(dependent);
                }
            }
        }
        return result;
    }

    private List<String> recommendations(DependencyGraph graph, PRNode node,
                                         Set<String> directlyBlocks, Set<String> blockedBy) {
        List<String> recommendations = new ArrayList<>();
        int dependents = graph.dependents(node.getId()).size();

        if (dependents > 0) {
            recommendations.add("Merging this PR unblocks " + dependents + " dependent PR(s)");
        }
        if (!blockedBy.isEmpty()) {
            recommendations.add("Wait for " + blockedBy.size() + " blocking PR(s) to merge first");
        }
        if (directlyBlocks.size() > HIGH_IMPACT_THRESHOLD) {
            recommendations.add("High-impact PR - consider expedited review");
        }
        if (node.getRiskLevel().isHighOrAbove()) {
            recommendations.add("High-risk PR - ensure thorough review before merge");
        }
        if (graph.isCyclic(node.getId())) {
            recommendations.add("Part of a circular dependency - resolve before proceeding");
        }
        List<FileConflictEdge> conflicts = graph.fileConflictsOf(node.getId());
        if (!conflicts.isEmpty()) {
            recommendations.add("Potential file conflicts with " + conflicts.size() + " PR(s) - coordinate merge order");
        }
        if (directlyBlocks.isEmpty() && blockedBy.isEmpty()) {
            recommendations.add("Independent PR - safe to merge at any time");
        }
        return recommendations;
    }
}

package com.architecture.memory.mergeflow.service.graph;

import com.architecture.memory.mergeflow.dto.graph.DependencyGraph;
import com.architecture.memory.mergeflow.dto.graph.FileConflictEdge;
import com.architecture.memory.mergeflow.dto.graph.MergeCheckResponse;
import com.architecture.memory.mergeflow.dto.graph.MergeOrderResponse;
import com.architecture.memory.mergeflow.dto.graph.PRNode;
import com.architecture.memory.mergeflow.dto.graph.RiskLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recommended merge order for a repository and merge readiness of single PRs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MergeOrderService {

    private static final int WARNING_FILE_LIMIT = 3;

    private final DependencyGraphBuilder graphBuilder;

    public MergeOrderResponse getMergeOrder(String repositoryId) {
        DependencyGraph graph = graphBuilder.buildGraph(repositoryId);

        List<String> conflictDetails = new ArrayList<>();
        for (List<String> cycle : graph.getCycles()) {
            String chain = cycle.stream().map(graph::describeNode).collect(Collectors.joining(" → "));
            conflictDetails.add("Circular dependency detected: " + chain + " → " + graph.describeNode(cycle.get(0)));
        }

        List<MergeOrderResponse.Entry> order = new ArrayList<>();
        for (String prId : graph.getCriticalPath()) {
            PRNode node = graph.findNode(prId).orElseThrow();
            Integer position = graph.mergeOrderPosition(prId);
            int blockedBy = graph.blockedBy(prId).size();
            int blocks = graph.dependents(prId).size();
            boolean inCycle = graph.isCyclic(prId);

            order.add(MergeOrderResponse.Entry.builder()
                    .position(position != null ? position + 1 : null)
                    .prId(prId)
                    .prNumber(node.getPrNumber())
                    .title(node.getTitle())
                    .blockedBy(blockedBy)
                    .blocks(blocks)
                    .estimatedRisk(node.getRiskLevel())
                    .inCycle(inCycle)
                    .reason(reason(node, inCycle, blockedBy, blocks))
                    .build());
        }

        log.info("Merge order for repository {}: {} PRs, {} cycles", repositoryId, order.size(), conflictDetails.size());
        return MergeOrderResponse.builder()
                .repositoryId(repositoryId)
                .hasConflicts(!graph.getCycles().isEmpty())
                .conflictDetails(conflictDetails)
                .order(order)
                .build();
    }

    public MergeCheckResponse checkMerge(String workflowId) {
        DependencyGraph graph = graphBuilder.buildGraphForWorkflow(workflowId);
        List<String> blockers = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Set<String> blockedBy = graph.blockedBy(workflowId);
        for (String baseId : blockedBy) {
            graph.findNode(baseId).ifPresent(base ->
                    blockers.add("Blocked by PR #" + base.getPrNumber() + " (" + base.getTitle() + ")"));
        }

        for (FileConflictEdge conflict : graph.fileConflictsOf(workflowId)) {
            String otherId = conflict.getSource().equals(workflowId) ? conflict.getTarget() : conflict.getSource();
            graph.findNode(otherId).ifPresent(other -> {
                List<String> files = conflict.getConflictFiles();
                String shown = String.join(", ", files.subList(0, Math.min(WARNING_FILE_LIMIT, files.size())));
                warnings.add("Potential conflict with PR #" + other.getPrNumber() + ": " + shown
                        + (files.size() > WARNING_FILE_LIMIT ? "..." : ""));
            });
        }

        if (graph.isCyclic(workflowId)) {
            blockers.add("Part of a circular dependency - manual resolution required");
        }

        boolean canMerge = blockers.isEmpty();
        String summary;
        if (!canMerge) {
            summary = "Blocked by " + blockers.size() + " issue(s)";
        } else if (!warnings.isEmpty()) {
            summary = "Can merge with warnings";
        } else {
            summary = "Ready to merge";
        }

        log.debug("Merge check for workflow {}: {}", workflowId, summary);
        return MergeCheckResponse.builder()
                .workflowId(workflowId)
                .canMerge(canMerge)
                .blockers(blockers)
                .warnings(warnings)
                .summary(summary)
                .build();
    }

    private String reason(PRNode node, boolean inCycle, int blockedBy, int blocks) {
        if (inCycle) {
            return "Part of a circular dependency - resolve before merging";
        }
        if (blocks > 0) {
            return "Blocks " + blocks + " other PR(s)";
        }
        if (blockedBy > 0) {
            return "Waits for " + blockedBy + " base PR(s)";
        }
        if (node.getRiskLevel() == RiskLevel.LOW) {
            return "Low risk, safe to merge";
        }
        return "Standard priority";
    }
}

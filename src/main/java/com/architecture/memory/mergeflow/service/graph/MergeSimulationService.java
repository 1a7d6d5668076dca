package com.architecture.memory.mergeflow.service.graph;

import com.architecture.memory.mergeflow.dto.graph.DependencyEdge;
import com.architecture.memory.mergeflow.dto.graph.DependencyGraph;
import com.architecture.memory.mergeflow.dto.graph.MergeSimulationResponse;
import com.architecture.memory.mergeflow.dto.graph.PRNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects the graph as if a PR had been merged. Nothing is persisted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MergeSimulationService {

    private final DependencyGraphBuilder graphBuilder;

    public MergeSimulationResponse simulateMerge(String workflowId) {
        DependencyGraph before = graphBuilder.buildGraphForWorkflow(workflowId);
        PRNode merged = before.findNode(workflowId).orElseThrow();

        List<PRNode> remainingNodes = new ArrayList<>();
        for (PRNode node : before.getNodes()) {
            if (!node.getId().equals(workflowId)) {
                remainingNodes.add(node);
            }
        }
        List<DependencyEdge> remainingEdges = new ArrayList<>();
        for (DependencyEdge edge : before.getEdges()) {
            if (!edge.touches(workflowId)) {
                remainingEdges.add(edge);
            }
        }

        DependencyGraph after = graphBuilder.derive(before.getRepositoryId(), remainingNodes, remainingEdges,
                before.isFileConflictsSkipped());

        List<MergeSimulationResponse.UnblockedPR> unblocked = new ArrayList<>();
        for (String dependentId : before.dependents(workflowId)) {
            if (after.blockedBy(dependentId).isEmpty()) {
                after.findNode(dependentId).ifPresent(node -> unblocked.add(
                        MergeSimulationResponse.UnblockedPR.builder()
                                .prId(node.getId())
                                .prNumber(node.getPrNumber())
                                .title(node.getTitle())
                                .build()));
            }
        }

        List<List<String>> newConflicts = new ArrayList<>();
        for (List<String> cycle : after.getCycles()) {
            if (cycle.stream().anyMatch(id -> !before.isCyclic(id))) {
                newConflicts.add(cycle);
            }
        }

        String summary = "Merging PR #" + merged.getPrNumber() + " unblocks " + unblocked.size() + " PR(s)"
                + (newConflicts.isEmpty() ? "" : " and leaves " + newConflicts.size() + " new circular dependency(ies)");
        log.info("Simulated merge of workflow {}: {}", workflowId, summary);

        return MergeSimulationResponse.builder()
                .workflowId(workflowId)
                .unblocked(unblocked)
                .newCriticalPath(after.getCriticalPath())
                .newConflicts(newConflicts)
                .summary(summary)
                .build();
    }
}

package com.architecture.memory.mergeflow.service.graph;

import com.architecture.memory.mergeflow.dto.graph.CriticalPath;
import com.architecture.memory.mergeflow.dto.graph.DependencyEdge;
import com.architecture.memory.mergeflow.dto.graph.EdgeType;
import com.architecture.memory.mergeflow.dto.graph.PRNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Orders PRs for merging with Kahn's algorithm over branch dependencies: a base PR always
 * comes before the PRs stacked on it. Among PRs that are free to go, lower risk goes first,
 * then the older PR, then the lower PR number. PRs caught in a cycle are appended at the end.
 */
@Component
@Slf4j
public class CriticalPathPlanner {

    static final Comparator<PRNode> READY_ORDER = Comparator
            .comparingInt((PRNode n) -> n.getRiskLevel().getRank())
            .thenComparing(PRNode::getCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparingInt(PRNode::getPrNumber);

    public CriticalPath plan(List<PRNode> nodes, List<DependencyEdge> edges, Set<String> cyclicNodeIds) {
        Map<String, PRNode> byId = new HashMap<>();
        for (PRNode node : nodes) {
            byId.put(node.getId(), node);
        }

        // Count of unmerged bases per PR, and base -> dependents
        Map<String, Integer> pendingBases = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        Set<String> seen = new LinkedHashSet<>();
        for (DependencyEdge edge : edges) {
            if (edge.getType() != EdgeType.BRANCH_DEPENDENCY) continue;
            String dependent = edge.getSource();
            String base = edge.getTarget();
            if (!byId.containsKey(dependent) || !byId.containsKey(base)) continue;
            if (cyclicNodeIds.contains(dependent) || cyclicNodeIds.contains(base)) continue;
            if (!seen.add(dependent + "->" + base)) continue;
            pendingBases.merge(dependent, 1, Integer::sum);
            dependents.computeIfAbsent(base, k -> new ArrayList<>()).add(dependent);
        }

        PriorityQueue<PRNode> ready = new PriorityQueue<>(READY_ORDER);
        for (PRNode node : nodes) {
            if (!cyclicNodeIds.contains(node.getId()) && pendingBases.getOrDefault(node.getId(), 0) == 0) {
                ready.add(node);
            }
        }

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            PRNode next = ready.poll();
            order.add(next.getId());
            for (String dependent : dependents.getOrDefault(next.getId(), List.of())) {
                int remaining = pendingBases.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(byId.get(dependent));
                }
            }
        }

        // Anything Kahn could not emit sits on a cycle the detector did not enumerate
        Set<String> cyclic = new LinkedHashSet<>(cyclicNodeIds);
        Set<String> emitted = new LinkedHashSet<>(order);
        for (PRNode node : nodes) {
            if (!emitted.contains(node.getId()) && cyclic.add(node.getId())) {
                log.debug("PR #{} left unordered, treating it as cyclic", node.getPrNumber());
            }
        }

        List<PRNode> cyclicNodes = new ArrayList<>();
        for (String id : cyclic) {
            PRNode node = byId.get(id);
            if (node != null) {
                cyclicNodes.add(node);
            }
        }
        cyclicNodes.sort(Comparator.comparingInt(PRNode::getPrNumber));
        for (PRNode node : cyclicNodes) {
            order.add(node.getId());
        }

        return new CriticalPath(order, cyclic);
    }
}

package com.architecture.memory.mergeflow.service.graph;

import com.architecture.memory.mergeflow.dto.graph.DependencyEdge;
import com.architecture.memory.mergeflow.dto.graph.EdgeType;
import com.architecture.memory.mergeflow.dto.graph.PRNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Detects circular chains of stacked PRs in the branch dependency sub-graph.
 *
 * Uses an iterative DFS with explicit frames so deep stacks cannot overflow the call stack.
 * Every strongly connected component with more than one node yields at least one cycle;
 * overlapping cycles inside one component are not all enumerated.
 */
@Component
@Slf4j
public class CircularDependencyDetector {

    private enum Colour { WHITE, GRAY, BLACK }

    private static final class Frame {
        private final String node;
        private int cursor;

        private Frame(String node) {
            this.node = node;
        }
    }

    /**
     * Find cycles among the given nodes. Each cycle is listed in traversal order without
     * repeating its first node. Nodes are visited in input order, neighbours in edge order.
     */
    public List<List<String>> detectCycles(List<PRNode> nodes, List<DependencyEdge> edges) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (PRNode node : nodes) {
            adjacency.put(node.getId(), new ArrayList<>());
        }
        for (DependencyEdge edge : edges) {
            if (edge.getType() != EdgeType.BRANCH_DEPENDENCY) continue;
            List<String> out = adjacency.get(edge.getSource());
            if (out != null && adjacency.containsKey(edge.getTarget())) {
                out.add(edge.getTarget());
            }
        }

        List<List<String>> cycles = new ArrayList<>();
        Set<String> reportedCycles = new HashSet<>();
        Map<String, Colour> colours = new HashMap<>();

        for (String start : adjacency.keySet()) {
            if (colours.getOrDefault(start, Colour.WHITE) != Colour.WHITE) continue;

            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            stack.push(new Frame(start));
            path.add(start);
            colours.put(start, Colour.GRAY);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                List<String> neighbours = adjacency.get(frame.node);

                if (frame.cursor >= neighbours.size()) {
                    colours.put(frame.node, Colour.BLACK);
                    path.remove(path.size() - 1);
                    stack.pop();
                    continue;
                }

                String next = neighbours.get(frame.cursor++);
                Colour colour = colours.getOrDefault(next, Colour.WHITE);
                if (colour == Colour.WHITE) {
                    colours.put(next, Colour.GRAY);
                    path.add(next);
                    stack.push(new Frame(next));
                } else if (colour == Colour.GRAY) {
                    // Back edge: the path from next to the current node closes a cycle
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    if (reportedCycles.add(normalizeCycleKey(cycle))) {
                        cycles.add(cycle);
                    }
                }
            }
        }

        if (!cycles.isEmpty()) {
            log.debug("Detected {} circular dependencies among {} PRs", cycles.size(), nodes.size());
        }
        return cycles;
    }

    /**
     * Same cycle entered from a different node gives the same key.
     */
    static String normalizeCycleKey(List<String> cycle) {
        if (cycle.size() <= 1) return cycle.toString();
        int minIdx = cycle.indexOf(Collections.min(cycle));
        List<String> normalized = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            normalized.add(cycle.get((minIdx + i) % cycle.size()));
        }
        return normalized.toString();
    }
}

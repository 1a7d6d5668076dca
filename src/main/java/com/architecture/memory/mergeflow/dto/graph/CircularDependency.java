package com.architecture.memory.mergeflow.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A circular chain of stacked PRs as shown to clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircularDependency {

    private List<String> nodeIds;       // cycle in traversal order, not closed
    private List<Integer> prNumbers;
    private String display;             // e.g. "PR #3 → PR #5 → PR #3"

    public static CircularDependency fromCycle(List<String> cycle, DependencyGraph graph) {
        List<Integer> numbers = new ArrayList<>();
        for (String id : cycle) {
            graph.findNode(id).ifPresent(n -> numbers.add(n.getPrNumber()));
        }
        String chain = cycle.stream().map(graph::describeNode).collect(Collectors.joining(" → "));
        String display = cycle.isEmpty() ? chain : chain + " → " + graph.describeNode(cycle.get(0));
        return CircularDependency.builder()
                .nodeIds(cycle)
                .prNumbers(numbers)
                .display(display)
                .build();
    }
}

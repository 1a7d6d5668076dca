package com.architecture.memory.mergeflow.service.graph;

import com.architecture.memory.mergeflow.dto.graph.CriticalPath;
import com.architecture.memory.mergeflow.dto.graph.DependencyEdge;
import com.architecture.memory.mergeflow.dto.graph.PRNode;
import com.architecture.memory.mergeflow.dto.graph.RiskLevel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.architecture.memory.mergeflow.service.graph.GraphFixtures.node;
import static com.architecture.memory.mergeflow.service.graph.GraphFixtures.stackedOn;
import static org.assertj.core.api.Assertions.assertThat;

class CriticalPathPlannerTest {

    private final CriticalPathPlanner planner = new CriticalPathPlanner();

    @Test
    void placesBaseBeforeDependent_evenWhenDependentIsLowerRisk() {
        List<PRNode> nodes = List.of(node("dep", 2, RiskLevel.LOW, 0), node("base", 1, RiskLevel.CRITICAL, 5));
        List<DependencyEdge> edges = List.of(stackedOn("dep", "base"));

        CriticalPath path = planner.plan(nodes, edges, Set.of());

        assertThat(path.getOrder()).containsExactly("base", "dep");
    }

    @Test
    void ordersIndependentPRsByRiskThenAgeThenNumber() {
        List<PRNode> nodes = List.of(
                node("high", 1, RiskLevel.HIGH, 0),
                node("mediumNew", 2, RiskLevel.MEDIUM, 10),
                node("mediumOld", 3, RiskLevel.MEDIUM, 5),
                node("low", 4, RiskLevel.LOW, 20));

        CriticalPath path = planner.plan(nodes, List.of(), Set.of());

        assertThat(path.getOrder()).containsExactly("low", "mediumOld", "mediumNew", "high");
    }

    @Test
    void appendsCyclicNodesByPrNumber_withoutTheirEdges() {
        List<PRNode> nodes = List.of(node("x", 9, RiskLevel.LOW, 0), node("y", 3, RiskLevel.LOW, 1),
                node("free", 5, RiskLevel.HIGH, 2), node("tail", 7, RiskLevel.LOW, 3));
        List<DependencyEdge> edges = List.of(stackedOn("x", "y"), stackedOn("y", "x"), stackedOn("tail", "x"));

        CriticalPath path = planner.plan(nodes, edges, Set.of("x", "y"));

        assertThat(path.getOrder()).containsExactly("tail", "free", "y", "x");
        assertThat(path.getCyclicNodeIds()).containsExactlyInAnyOrder("x", "y");
    }

    @Test
    void treatsUnorderableNodesAsCyclic() {
        // The caller did not flag the cycle, the planner still terminates and reports it
        List<PRNode> nodes = List.of(node("a", 1, RiskLevel.LOW, 0), node("b", 2, RiskLevel.LOW, 1),
                node("c", 3, RiskLevel.LOW, 2));
        List<DependencyEdge> edges = List.of(stackedOn("a", "b"), stackedOn("b", "a"));

        CriticalPath path = planner.plan(nodes, edges, Set.of());

        assertThat(path.getOrder()).containsExactly("c", "a", "b");
        assertThat(path.getCyclicNodeIds()).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void keepsEveryNodeExactlyOnce_inDiamond() {
        List<PRNode> nodes = List.of(node("root", 1, RiskLevel.MEDIUM, 0), node("left", 2, RiskLevel.LOW, 1),
                node("right", 3, RiskLevel.LOW, 2), node("top", 4, RiskLevel.LOW, 3));
        List<DependencyEdge> edges = List.of(stackedOn("left", "root"), stackedOn("right", "root"),
                stackedOn("top", "left"), stackedOn("top", "right"));

        CriticalPath path = planner.plan(nodes, edges, Set.of());

        assertThat(path.getOrder()).containsExactly("root", "left", "right", "top");
    }
}

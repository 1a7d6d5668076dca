package com.architecture.memory.mergeflow.service.graph;

import com.architecture.memory.mergeflow.dto.graph.BranchDependencyEdge;
import com.architecture.memory.mergeflow.dto.graph.DependencyEdge;
import com.architecture.memory.mergeflow.dto.graph.PRNode;
import com.architecture.memory.mergeflow.dto.graph.RiskLevel;
import com.architecture.memory.mergeflow.model.PRWorkflow;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

final class GraphFixtures {

    static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 1, 9, 0);

    private GraphFixtures() {
    }

    static PRWorkflow workflow(String id, int prNumber, String head, String base, String risk,
                               int minutesAfterT0, String... files) {
        return PRWorkflow.builder()
                .id(id)
                .repositoryId("repo-1")
                .prNumber(prNumber)
                .prTitle("PR " + prNumber)
                .headBranch(head)
                .baseBranch(base)
                .authorLogin("dev" + prNumber)
                .status(PRWorkflow.Status.REVIEWING)
                .analysis(PRWorkflow.Analysis.builder()
                        .riskLevel(risk)
                        .impactRadius(PRWorkflow.ImpactRadius.builder().affectedFiles(List.of(files)).build())
                        .build())
                .createdAt(T0.plusMinutes(minutesAfterT0))
                .build();
    }

    static PRNode node(String id, int prNumber, RiskLevel risk, int minutesAfterT0) {
        return PRNode.builder()
                .id(id)
                .prNumber(prNumber)
                .title("PR " + prNumber)
                .branch("feature/" + id)
                .baseBranch("main")
                .riskLevel(risk)
                .filesChanged(Set.of())
                .createdAt(T0.plusMinutes(minutesAfterT0))
                .build();
    }

    static DependencyEdge stackedOn(String dependent, String base) {
        return new BranchDependencyEdge(dependent, base, 1.0, dependent + " on " + base);
    }
}

package com.architecture.memory.mergeflow.controller;

import com.architecture.memory.mergeflow.dto.graph.DependencyGraph;
import com.architecture.memory.mergeflow.dto.graph.DependencyGraphResponse;
import com.architecture.memory.mergeflow.dto.graph.ImpactReport;
import com.architecture.memory.mergeflow.dto.graph.MergeCheckResponse;
import com.architecture.memory.mergeflow.dto.graph.MergeOrderResponse;
import com.architecture.memory.mergeflow.dto.graph.MergeSimulationResponse;
import com.architecture.memory.mergeflow.service.graph.DependencyGraphBuilder;
import com.architecture.memory.mergeflow.service.graph.ImpactAnalysisService;
import com.architecture.memory.mergeflow.service.graph.MergeOrderService;
import com.architecture.memory.mergeflow.service.graph.MergeSimulationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only queries over the PR dependency graph. Cycles are reported as data, never as errors.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class DependencyGraphController {

    private final DependencyGraphBuilder graphBuilder;
    private final ImpactAnalysisService impactAnalysisService;
    private final MergeOrderService mergeOrderService;
    private final MergeSimulationService mergeSimulationService;

    @GetMapping("/repositories/{repositoryId}/dependency-graph")
    public ResponseEntity<DependencyGraphResponse> getDependencyGraph(@PathVariable String repositoryId) {
        log.info("Getting dependency graph for repository: {}", repositoryId);
        DependencyGraph graph = graphBuilder.buildGraph(repositoryId);
        return ResponseEntity.ok(DependencyGraphResponse.from(graph));
    }

    @GetMapping("/workflows/{workflowId}/impact")
    public ResponseEntity<ImpactReport> getImpact(@PathVariable String workflowId) {
        log.info("Getting impact analysis for workflow: {}", workflowId);
        return ResponseEntity.ok(impactAnalysisService.getImpactAnalysis(workflowId));
    }

    @GetMapping("/repositories/{repositoryId}/merge-order")
    public ResponseEntity<MergeOrderResponse> getMergeOrder(@PathVariable String repositoryId) {
        log.info("Getting merge order for repository: {}", repositoryId);
        return ResponseEntity.ok(mergeOrderService.getMergeOrder(repositoryId));
    }

    @GetMapping("/workflows/{workflowId}/merge-check")
    public ResponseEntity<MergeCheckResponse> checkMerge(@PathVariable String workflowId) {
        log.info("Checking merge readiness for workflow: {}", workflowId);
        return ResponseEntity.ok(mergeOrderService.checkMerge(workflowId));
    }

    @PostMapping("/workflows/{workflowId}/simulate-merge")
    public ResponseEntity<MergeSimulationResponse> simulateMerge(@PathVariable String workflowId) {
        log.info("Simulating merge of workflow: {}", workflowId);
        return ResponseEntity.ok(mergeSimulationService.simulateMerge(workflowId));
    }
}

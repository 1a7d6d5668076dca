package com.architecture.memory.mergeflow.service.graph;

import com.architecture.memory.mergeflow.dto.graph.BranchDependencyEdge;
import com.architecture.memory.mergeflow.dto.graph.CriticalPath;
import com.architecture.memory.mergeflow.dto.graph.DependencyEdge;
import com.architecture.memory.mergeflow.dto.graph.DependencyGraph;
import com.architecture.memory.mergeflow.dto.graph.ExplicitDependencyEdge;
import com.architecture.memory.mergeflow.dto.graph.FileConflictEdge;
import com.architecture.memory.mergeflow.dto.graph.PRNode;
import com.architecture.memory.mergeflow.dto.graph.RiskLevel;
import com.architecture.memory.mergeflow.dto.graph.SemanticDependencyEdge;
import com.architecture.memory.mergeflow.exception.ResourceNotFoundException;
import com.architecture.memory.mergeflow.model.DeclaredDependency;
import com.architecture.memory.mergeflow.model.PRWorkflow;
import com.architecture.memory.mergeflow.repository.DeclaredDependencyRepository;
import com.architecture.memory.mergeflow.repository.PRWorkflowRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the dependency graph of a repository's active PRs from the workflow store.
 *
 * Edges:
 * 1. branch_dependency: a PR whose base branch is another PR's head branch depends on it
 * 2. file_conflict: two PRs touching at least one common file
 * 3. explicit / semantic_dependency: declared by collaborators and merged in as-is
 */
@Service
@Slf4j
public class DependencyGraphBuilder {

    private final PRWorkflowRepository workflowRepository;
    private final DeclaredDependencyRepository declaredDependencyRepository;
    private final CircularDependencyDetector circularDependencyDetector;
    private final CriticalPathPlanner criticalPathPlanner;

    @Value("${mergeflow.graph.max-nodes-for-file-conflicts:500}")
    private int maxNodesForFileConflicts = 500;

    public DependencyGraphBuilder(PRWorkflowRepository workflowRepository,
                                  DeclaredDependencyRepository declaredDependencyRepository,
                                  CircularDependencyDetector circularDependencyDetector,
                                  CriticalPathPlanner criticalPathPlanner) {
        this.workflowRepository = workflowRepository;
        this.declaredDependencyRepository = declaredDependencyRepository;
        this.circularDependencyDetector = circularDependencyDetector;
        this.criticalPathPlanner = criticalPathPlanner;
    }

    public DependencyGraph buildGraph(String repositoryId) {
        List<PRWorkflow> workflows = workflowRepository
                .findByRepositoryIdAndStatusNotInOrderByCreatedAtAsc(repositoryId, PRWorkflow.Status.INACTIVE);

        List<PRNode> nodes = new ArrayList<>();
        for (PRWorkflow workflow : workflows) {
            nodes.add(toNode(workflow));
        }

        Map<String, DependencyEdge> edges = new LinkedHashMap<>();
        addBranchDependencies(nodes, edges);

        boolean fileConflictsSkipped = nodes.size() > maxNodesForFileConflicts;
        if (fileConflictsSkipped) {
            log.warn("Repository {} has {} active PRs (cap {}), skipping file conflict detection",
                    repositoryId, nodes.size(), maxNodesForFileConflicts);
        } else {
            addFileConflicts(nodes, edges);
        }

        addDeclaredDependencies(repositoryId, nodes, edges);

        DependencyGraph graph = derive(repositoryId, nodes, new ArrayList<>(edges.values()), fileConflictsSkipped);
        log.info("Built dependency graph for repository {}: {} nodes, {} edges, {} cycles",
                repositoryId, graph.getNodes().size(), graph.getEdges().size(), graph.getCycles().size());
        return graph;
    }

    /**
     * Run cycle detection and merge ordering over an already assembled set of nodes and edges.
     */
    public DependencyGraph derive(String repositoryId, List<PRNode> nodes, List<DependencyEdge> edges,
                                  boolean fileConflictsSkipped) {
        List<List<String>> cycles = circularDependencyDetector.detectCycles(nodes, edges);
        Set<String> cyclicNodeIds = new HashSet<>();
        cycles.forEach(cyclicNodeIds::addAll);

        CriticalPath criticalPath = criticalPathPlanner.plan(nodes, edges, cyclicNodeIds);

        return DependencyGraph.builder()
                .repositoryId(repositoryId)
                .nodes(nodes)
                .edges(edges)
                .cycles(cycles)
                .criticalPath(criticalPath.getOrder())
                .cyclicNodeIds(criticalPath.getCyclicNodeIds())
                .fileConflictsSkipped(fileConflictsSkipped)
                .generatedAt(LocalDateTime.now())
                .build();
    }

    public PRWorkflow findWorkflow(String workflowId) {
        return workflowRepository.findById(workflowId)
                .orElseThrow(() -> new ResourceNotFoundException("Workflow", workflowId));
    }

    /**
     * Graph of the workflow's repository. A workflow that is no longer active has no node
     * in it and is reported as not found.
     */
    public DependencyGraph buildGraphForWorkflow(String workflowId) {
        PRWorkflow workflow = findWorkflow(workflowId);
        DependencyGraph graph = buildGraph(workflow.getRepositoryId());
        if (graph.findNode(workflowId).isEmpty()) {
            throw new ResourceNotFoundException("Active workflow", workflowId);
        }
        return graph;
    }

    PRNode toNode(PRWorkflow workflow) {
        return PRNode.builder()
                .id(workflow.getId())
                .prNumber(workflow.getPrNumber())
                .title(workflow.getPrTitle())
                .branch(workflow.getHeadBranch())
                .baseBranch(workflow.getBaseBranch())
                .author(workflow.getAuthorLogin())
                .status(workflow.getStatus())
                .riskLevel(RiskLevel.fromString(workflow.riskLevelOrNull()))
                .filesChanged(new LinkedHashSet<>(workflow.affectedFilesOrEmpty()))
                .createdAt(workflow.getCreatedAt())
                .build();
    }

    private void addBranchDependencies(List<PRNode> nodes, Map<String, DependencyEdge> edges) {
        Map<String, List<PRNode>> byHeadBranch = new HashMap<>();
        for (PRNode node : nodes) {
            if (node.getBranch() != null) {
                byHeadBranch.computeIfAbsent(node.getBranch(), k -> new ArrayList<>()).add(node);
            }
        }

        for (PRNode dependent : nodes) {
            if (dependent.getBaseBranch() == null) continue;
            for (PRNode base : byHeadBranch.getOrDefault(dependent.getBaseBranch(), List.of())) {
                if (base.getId().equals(dependent.getId())) continue;
                addEdge(edges, new BranchDependencyEdge(dependent.getId(), base.getId(), 1.0,
                        "PR #" + dependent.getPrNumber() + " is based on PR #" + base.getPrNumber() + "'s branch"));
            }
        }
    }

    private void addFileConflicts(List<PRNode> nodes, Map<String, DependencyEdge> edges) {
        // Inverted index: file -> positions of the PRs touching it
        Map<String, List<Integer>> fileIndex = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            for (String file : nodes.get(i).getFilesChanged()) {
                fileIndex.computeIfAbsent(file, k -> new ArrayList<>()).add(i);
            }
        }

        // Pair (i, j) with i < j -> shared files
        Map<Long, Set<String>> shared = new LinkedHashMap<>();
        for (Map.Entry<String, List<Integer>> entry : fileIndex.entrySet()) {
            List<Integer> touching = entry.getValue();
            for (int a = 0; a < touching.size(); a++) {
                for (int b = a + 1; b < touching.size(); b++) {
                    long key = (long) touching.get(a) * nodes.size() + touching.get(b);
                    shared.computeIfAbsent(key, k -> new TreeSet<>()).add(entry.getKey());
                }
            }
        }

        shared.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> {
                    PRNode first = nodes.get((int) (entry.getKey() / nodes.size()));
                    PRNode second = nodes.get((int) (entry.getKey() % nodes.size()));
                    Set<String> union = new HashSet<>(first.getFilesChanged());
                    union.addAll(second.getFilesChanged());
                    List<String> conflictFiles = new ArrayList<>(entry.getValue());
                    double strength = (double) conflictFiles.size() / union.size();
                    addEdge(edges, new FileConflictEdge(first.getId(), second.getId(), strength,
                            "PR #" + first.getPrNumber() + " and PR #" + second.getPrNumber()
                                    + " modify " + conflictFiles.size() + " common file(s)",
                            conflictFiles));
                });
    }

    private void addDeclaredDependencies(String repositoryId, List<PRNode> nodes, Map<String, DependencyEdge> edges) {
        Set<String> nodeIds = new HashSet<>();
        for (PRNode node : nodes) {
            nodeIds.add(node.getId());
        }

        for (DeclaredDependency declared : declaredDependencyRepository.findByRepositoryId(repositoryId)) {
            String source = declared.getSourceWorkflowId();
            String target = declared.getTargetWorkflowId();
            if (!nodeIds.contains(source) || !nodeIds.contains(target)) {
                log.debug("Dropping declared dependency {} -> {}: not between active PRs", source, target);
                continue;
            }
            if (source.equals(target)) {
                log.debug("Dropping self-referencing declared dependency on {}", source);
                continue;
            }
            double strength = Math.max(0.0, Math.min(1.0, declared.getStrength()));
            DependencyEdge edge = declared.getKind() == DeclaredDependency.Kind.SEMANTIC
                    ? new SemanticDependencyEdge(source, target, strength, declared.getDescription())
                    : new ExplicitDependencyEdge(source, target, strength, declared.getDescription());
            if (!addEdge(edges, edge)) {
                log.debug("Dropping duplicate declared dependency {} -> {}", source, target);
            }
        }
    }

    private boolean addEdge(Map<String, DependencyEdge> edges, DependencyEdge edge) {
        return edges.putIfAbsent(edge.dedupeKey(), edge) == null;
    }
}

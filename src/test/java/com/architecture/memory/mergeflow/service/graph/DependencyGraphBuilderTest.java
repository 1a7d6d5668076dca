package com.architecture.memory.mergeflow.service.graph;

import com.architecture.memory.mergeflow.dto.graph.DependencyEdge;
import com.architecture.memory.mergeflow.dto.graph.DependencyGraph;
import com.architecture.memory.mergeflow.dto.graph.EdgeType;
import com.architecture.memory.mergeflow.dto.graph.FileConflictEdge;
import com.architecture.memory.mergeflow.dto.graph.RiskLevel;
import com.architecture.memory.mergeflow.exception.ResourceNotFoundException;
import com.architecture.memory.mergeflow.model.DeclaredDependency;
import com.architecture.memory.mergeflow.model.PRWorkflow;
import com.architecture.memory.mergeflow.repository.DeclaredDependencyRepository;
import com.architecture.memory.mergeflow.repository.PRWorkflowRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;

import static com.architecture.memory.mergeflow.service.graph.GraphFixtures.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DependencyGraphBuilderTest {

    @Mock
    private PRWorkflowRepository workflowRepository;

    @Mock
    private DeclaredDependencyRepository declaredDependencyRepository;

    private DependencyGraphBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new DependencyGraphBuilder(workflowRepository, declaredDependencyRepository,
                new CircularDependencyDetector(), new CriticalPathPlanner());
    }

    private void givenWorkflows(PRWorkflow... workflows) {
        when(workflowRepository.findByRepositoryIdAndStatusNotInOrderByCreatedAtAsc(eq("repo-1"), any()))
                .thenReturn(List.of(workflows));
    }

    private void givenDeclared(DeclaredDependency... dependencies) {
        when(declaredDependencyRepository.findByRepositoryId("repo-1")).thenReturn(List.of(dependencies));
    }

    @Test
    void buildsEmptyGraph_forRepositoryWithoutActivePRs() {
        givenWorkflows();
        givenDeclared();

        DependencyGraph graph = builder.buildGraph("repo-1");

        assertThat(graph.getNodes()).isEmpty();
        assertThat(graph.getEdges()).isEmpty();
        assertThat(graph.getCycles()).isEmpty();
        assertThat(graph.getCriticalPath()).isEmpty();
        assertThat(graph.getGeneratedAt()).isNotNull();
    }

    @Test
    void addsSingleFileConflictEdge_whenTwoPRsShareAFile() {
        givenWorkflows(
                workflow("a", 1, "feature/a", "main", "low", 0, "shared.ts", "a.ts"),
                workflow("b", 2, "feature/b", "main", "low", 1, "shared.ts", "b.ts"));
        givenDeclared();

        DependencyGraph graph = builder.buildGraph("repo-1");

        assertThat(graph.getEdges()).hasSize(1);
        FileConflictEdge edge = (FileConflictEdge) graph.getEdges().get(0);
        assertThat(edge.getType()).isEqualTo(EdgeType.FILE_CONFLICT);
        assertThat(edge.getSource()).isEqualTo("a");
        assertThat(edge.getTarget()).isEqualTo("b");
        assertThat(edge.getConflictFiles()).containsExactly("shared.ts");
        assertThat(edge.getStrength()).isEqualTo(1.0 / 3.0);
    }

    @Test
    void addsBranchDependency_andOrdersBaseFirst() {
        givenWorkflows(
                workflow("a", 1, "feature/a", "main", "medium", 0),
                workflow("b", 2, "feature/b", "feature/a", "medium", 1));
        givenDeclared();

        DependencyGraph graph = builder.buildGraph("repo-1");

        assertThat(graph.getEdges()).hasSize(1);
        DependencyEdge edge = graph.getEdges().get(0);
        assertThat(edge.getType()).isEqualTo(EdgeType.BRANCH_DEPENDENCY);
        assertThat(edge.getSource()).isEqualTo("b");
        assertThat(edge.getTarget()).isEqualTo("a");
        assertThat(edge.getStrength()).isEqualTo(1.0);
        assertThat(edge.getDescription()).isEqualTo("PR #2 is based on PR #1's branch");
        assertThat(graph.getCriticalPath()).containsExactly("a", "b");
    }

    @Test
    void reportsCycle_whenPRsAreStackedOnEachOther() {
        givenWorkflows(
                workflow("a", 1, "feature/a", "feature/b", "low", 0),
                workflow("b", 2, "feature/b", "feature/a", "low", 1));
        givenDeclared();

        DependencyGraph graph = builder.buildGraph("repo-1");

        assertThat(graph.getCycles()).hasSize(1);
        assertThat(graph.getCycles().get(0)).containsExactlyInAnyOrder("a", "b");
        assertThat(graph.mergeOrderPosition("a")).isNull();
        assertThat(graph.mergeOrderPosition("b")).isNull();
        assertThat(graph.getCriticalPath()).containsExactly("a", "b");
    }

    @Test
    void defaultsMissingAnalysisToMediumRisk() {
        PRWorkflow bare = PRWorkflow.builder()
                .id("x").repositoryId("repo-1").prNumber(7).headBranch("feature/x").baseBranch("main")
                .status(PRWorkflow.Status.PENDING)
                .build();
        givenWorkflows(bare);
        givenDeclared();

        DependencyGraph graph = builder.buildGraph("repo-1");

        assertThat(graph.getNodes()).singleElement()
                .satisfies(node -> {
                    assertThat(node.getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
                    assertThat(node.getFilesChanged()).isEmpty();
                });
    }

    @Test
    void mergesDeclaredDependencies_droppingUnknownSelfAndDuplicate() {
        givenWorkflows(
                workflow("a", 1, "feature/a", "main", "low", 0),
                workflow("b", 2, "feature/b", "main", "low", 1));
        givenDeclared(
                declared("b", "a", DeclaredDependency.Kind.EXPLICIT),
                declared("b", "a", DeclaredDependency.Kind.EXPLICIT),
                declared("a", "b", DeclaredDependency.Kind.SEMANTIC),
                declared("a", "a", DeclaredDependency.Kind.EXPLICIT),
                declared("a", "ghost", DeclaredDependency.Kind.SEMANTIC));

        DependencyGraph graph = builder.buildGraph("repo-1");

        assertThat(graph.getEdges()).extracting(DependencyEdge::getType)
                .containsExactly(EdgeType.EXPLICIT, EdgeType.SEMANTIC_DEPENDENCY);
        assertThat(graph.getCycles()).isEmpty();
    }

    @Test
    void skipsFileConflicts_whenNodeCapExceeded() {
        ReflectionTestUtils.setField(builder, "maxNodesForFileConflicts", 1);
        givenWorkflows(
                workflow("a", 1, "feature/a", "main", "low", 0, "shared.ts"),
                workflow("b", 2, "feature/b", "feature/a", "low", 1, "shared.ts"));
        givenDeclared();

        DependencyGraph graph = builder.buildGraph("repo-1");

        assertThat(graph.isFileConflictsSkipped()).isTrue();
        assertThat(graph.getEdges()).extracting(DependencyEdge::getType)
                .containsExactly(EdgeType.BRANCH_DEPENDENCY);
    }

    @Test
    void throwsNotFound_forUnknownWorkflow() {
        when(workflowRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> builder.buildGraphForWorkflow("missing"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void throwsNotFound_forWorkflowThatIsNoLongerActive() {
        PRWorkflow done = workflow("done", 9, "feature/done", "main", "low", 0);
        done.setStatus(PRWorkflow.Status.COMPLETED);
        when(workflowRepository.findById("done")).thenReturn(Optional.of(done));
        givenWorkflows();
        givenDeclared();

        assertThatThrownBy(() -> builder.buildGraphForWorkflow("done"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    private static DeclaredDependency declared(String source, String target, DeclaredDependency.Kind kind) {
        return DeclaredDependency.builder()
                .repositoryId("repo-1")
                .sourceWorkflowId(source)
                .targetWorkflowId(target)
                .kind(kind)
                .strength(0.5)
                .description("declared")
                .build();
    }
}

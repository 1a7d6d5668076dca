package com.architecture.memory.mergeflow.service.graph;

import com.architecture.memory.mergeflow.dto.graph.MergeSimulationResponse;
import com.architecture.memory.mergeflow.model.PRWorkflow;
import com.architecture.memory.mergeflow.repository.DeclaredDependencyRepository;
import com.architecture.memory.mergeflow.repository.PRWorkflowRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.architecture.memory.mergeflow.service.graph.GraphFixtures.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MergeSimulationServiceTest {

    @Mock
    private PRWorkflowRepository workflowRepository;

    @Mock
    private DeclaredDependencyRepository declaredDependencyRepository;

    private MergeSimulationService simulationService;

    @BeforeEach
    void setUp() {
        DependencyGraphBuilder builder = new DependencyGraphBuilder(workflowRepository, declaredDependencyRepository,
                new CircularDependencyDetector(), new CriticalPathPlanner());
        simulationService = new MergeSimulationService(builder);
    }

    @Test
    void unblocksOnlyDependentsWithNoOtherBase() {
        // b and c are stacked on a; d sits on b and stays blocked
        List<PRWorkflow> workflows = List.of(
                workflow("a", 1, "feature/a", "main", "low", 0),
                workflow("b", 2, "feature/b", "feature/a", "low", 1),
                workflow("c", 3, "feature/c", "feature/a", "low", 2),
                workflow("d", 4, "feature/d", "feature/b", "low", 3));
        when(workflowRepository.findById("a")).thenReturn(Optional.of(workflows.get(0)));
        when(workflowRepository.findByRepositoryIdAndStatusNotInOrderByCreatedAtAsc(eq("repo-1"), any()))
                .thenReturn(workflows);
        when(declaredDependencyRepository.findByRepositoryId("repo-1")).thenReturn(List.of());

        MergeSimulationResponse response = simulationService.simulateMerge("a");

        assertThat(response.getUnblocked()).extracting(MergeSimulationResponse.UnblockedPR::getPrId)
                .containsExactlyInAnyOrder("b", "c");
        assertThat(response.getNewCriticalPath()).containsExactly("b", "c", "d");
        assertThat(response.getNewConflicts()).isEmpty();
        assertThat(response.getSummary()).isEqualTo("Merging PR #1 unblocks 2 PR(s)");
    }

    @Test
    void doesNotPersistAnything() {
        PRWorkflow solo = workflow("a", 1, "feature/a", "main", "low", 0);
        when(workflowRepository.findById("a")).thenReturn(Optional.of(solo));
        when(workflowRepository.findByRepositoryIdAndStatusNotInOrderByCreatedAtAsc(eq("repo-1"), any()))
                .thenReturn(List.of(solo));
        when(declaredDependencyRepository.findByRepositoryId("repo-1")).thenReturn(List.of());

        MergeSimulationResponse response = simulationService.simulateMerge("a");

        assertThat(response.getUnblocked()).isEmpty();
        assertThat(response.getNewCriticalPath()).isEmpty();
        verify(workflowRepository).findById("a");
        verify(workflowRepository).findByRepositoryIdAndStatusNotInOrderByCreatedAtAsc(eq("repo-1"), any());
        verifyNoMoreInteractions(workflowRepository);
    }
}

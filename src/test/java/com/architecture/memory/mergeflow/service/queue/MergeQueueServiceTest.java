package com.architecture.memory.mergeflow.service.queue;

import com.architecture.memory.mergeflow.dto.github.PullRequestInfo;
import com.architecture.memory.mergeflow.dto.queue.ConflictingPR;
import com.architecture.memory.mergeflow.dto.queue.MergeQueueConfig;
import com.architecture.memory.mergeflow.dto.queue.QueueAddition;
import com.architecture.memory.mergeflow.dto.queue.QueueOperationResult;
import com.architecture.memory.mergeflow.dto.queue.QueueStats;
import com.architecture.memory.mergeflow.exception.ResourceNotFoundException;
import com.architecture.memory.mergeflow.exception.ValidationException;
import com.architecture.memory.mergeflow.model.MergeQueueItem;
import com.architecture.memory.mergeflow.model.QueueItemStatus;
import com.architecture.memory.mergeflow.service.github.GitProviderClient;
import com.architecture.memory.mergeflow.service.notify.MergeQueueEvent;
import com.architecture.memory.mergeflow.service.notify.QueueNotificationBroadcaster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.architecture.memory.mergeflow.service.queue.QueueFixtures.OWNER;
import static com.architecture.memory.mergeflow.service.queue.QueueFixtures.REPO;
import static com.architecture.memory.mergeflow.service.queue.QueueFixtures.REPOSITORY_ID;
import static com.architecture.memory.mergeflow.service.queue.QueueFixtures.file;
import static com.architecture.memory.mergeflow.service.queue.QueueFixtures.item;
import static com.architecture.memory.mergeflow.service.queue.QueueFixtures.openPr;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MergeQueueServiceTest {

    @Mock
    private MergeQueueConfigService configService;

    @Mock
    private MergeQueueProcessor queueProcessor;

    @Mock
    private GitProviderClient gitProviderClient;

    @Mock
    private QueueNotificationBroadcaster notificationBroadcaster;

    private InMemoryMergeQueueStore queueStore;
    private MergeQueueService queueService;

    @BeforeEach
    void setUp() {
        queueStore = new InMemoryMergeQueueStore();
        queueService = new MergeQueueService(queueStore, configService, queueProcessor,
                new ConflictDetector(gitProviderClient, false), gitProviderClient, notificationBroadcaster);
    }

    @Test
    void addToQueue_createsQueuedItemFromPullRequest() {
        when(gitProviderClient.getPullRequest(OWNER, REPO, 4)).thenReturn(openPr(4));

        QueueAddition addition = queueService.addToQueue(OWNER, REPO, REPOSITORY_ID, 4, 10);
        MergeQueueItem item = addition.getItem();

        assertThat(addition.isCreated()).isTrue();
        assertThat(item.getStatus()).isEqualTo(QueueItemStatus.QUEUED);
        assertThat(item.getPriority()).isEqualTo(10);
        assertThat(item.getHeadSha()).isEqualTo("sha-4");
        assertThat(item.getBaseBranch()).isEqualTo("main");
        assertThat(item.getAuthorLogin()).isEqualTo("dev4");
        assertThat(item.getAddedAt()).isNotNull();

        ArgumentCaptor<MergeQueueEvent> events = ArgumentCaptor.forClass(MergeQueueEvent.class);
        verify(notificationBroadcaster).publish(events.capture());
        assertThat(events.getValue().getType()).isEqualTo(MergeQueueEvent.Type.ADDED);
    }

    @Test
    void addToQueue_twice_keepsSingleUnchangedItem() {
        when(gitProviderClient.getPullRequest(OWNER, REPO, 4)).thenReturn(openPr(4));
        MergeQueueItem first = queueService.addToQueue(OWNER, REPO, REPOSITORY_ID, 4, 0).getItem();
        queueStore.update(REPOSITORY_ID, 4, i -> i.setStatus(QueueItemStatus.CHECKING));

        QueueAddition again = queueService.addToQueue(OWNER, REPO, REPOSITORY_ID, 4, 50);
        MergeQueueItem second = again.getItem();

        assertThat(again.isCreated()).isFalse();
        assertThat(queueStore.size()).isEqualTo(1);
        assertThat(second.getStatus()).isEqualTo(QueueItemStatus.CHECKING);
        assertThat(second.getPriority()).isZero();
        assertThat(second.getAddedAt()).isEqualTo(first.getAddedAt());
        verify(gitProviderClient, times(1)).getPullRequest(OWNER, REPO, 4);
        verify(notificationBroadcaster, times(1)).publish(any());
    }

    @Test
    void addToQueue_rejectsClosedPR() {
        PullRequestInfo closed = openPr(4);
        closed.setState("closed");
        when(gitProviderClient.getPullRequest(OWNER, REPO, 4)).thenReturn(closed);

        assertThatThrownBy(() -> queueService.addToQueue(OWNER, REPO, REPOSITORY_ID, 4, 0))
                .isInstanceOf(ValidationException.class)
                .hasMessage("PR #4 is not open");
        assertThat(queueStore.size()).isZero();
    }

    @Test
    void removeFromQueue_reportsMissingItem() {
        QueueOperationResult result = queueService.removeFromQueue(REPOSITORY_ID, 8);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("PR #8 not found in queue");
        verifyNoInteractions(notificationBroadcaster);
    }

    @Test
    void removeFromQueue_deletesItem() {
        queueStore.insertIfAbsent(item(8, QueueItemStatus.BLOCKED, 0));

        QueueOperationResult result = queueService.removeFromQueue(REPOSITORY_ID, 8);

        assertThat(result.isSuccess()).isTrue();
        assertThat(queueStore.size()).isZero();
    }

    @Test
    void getQueue_ordersByPriorityThenArrivalAndNumbersPositions() {
        queueStore.insertIfAbsent(item(1, QueueItemStatus.QUEUED, 0));
        MergeQueueItem urgent = item(2, QueueItemStatus.QUEUED, 5);
        urgent.setPriority(10);
        queueStore.insertIfAbsent(urgent);
        queueStore.insertIfAbsent(item(3, QueueItemStatus.QUEUED, 1));

        List<MergeQueueItem> queue = queueService.getQueue(REPOSITORY_ID);

        assertThat(queue).extracting(MergeQueueItem::getPrNumber).containsExactly(2, 1, 3);
        assertThat(queue).extracting(MergeQueueItem::getPosition).containsExactly(1, 2, 3);
    }

    @Test
    void getQueueItem_whenMissing_throwsNotFound() {
        assertThatThrownBy(() -> queueService.getQueueItem(REPOSITORY_ID, 5))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void getConflictingPRs_listsOverlapsWithItemsAhead() {
        queueStore.insertIfAbsent(item(1, QueueItemStatus.READY, 0));
        queueStore.insertIfAbsent(item(2, QueueItemStatus.QUEUED, 1));
        when(gitProviderClient.getPullRequestFiles(OWNER, REPO, 2)).thenReturn(List.of(file("a.java")));
        when(gitProviderClient.getPullRequestFiles(OWNER, REPO, 1)).thenReturn(List.of(file("a.java"), file("b.java")));

        List<ConflictingPR> conflicts = queueService.getConflictingPRs(OWNER, REPO, REPOSITORY_ID, 2);

        assertThat(conflicts).hasSize(1);
        assertThat(conflicts.get(0).getPrNumber()).isEqualTo(1);
        assertThat(conflicts.get(0).getTitle()).isEqualTo("PR 1");
        assertThat(conflicts.get(0).getConflictingFiles()).containsExactly("a.java");
    }

    @Test
    void getConflictingPRs_forUnqueuedPR_isEmpty() {
        assertThat(queueService.getConflictingPRs(OWNER, REPO, REPOSITORY_ID, 2)).isEmpty();
        verifyNoInteractions(gitProviderClient);
    }

    @Test
    void getQueueStats_countsEveryStatus() {
        queueStore.insertIfAbsent(item(1, QueueItemStatus.READY, 0));
        queueStore.insertIfAbsent(item(2, QueueItemStatus.BLOCKED, 1));
        queueStore.insertIfAbsent(item(3, QueueItemStatus.BLOCKED, 2));
        when(configService.getConfig(REPOSITORY_ID)).thenReturn(MergeQueueConfig.defaults());

        QueueStats stats = queueService.getQueueStats(REPOSITORY_ID);

        assertThat(stats.getTotal()).isEqualTo(3);
        assertThat(stats.getByStatus()).containsEntry("ready", 1L).containsEntry("blocked", 2L)
                .containsEntry("merging", 0L).hasSize(QueueItemStatus.values().length);
        assertThat(stats.getOldestAddedAt()).isEqualTo(QueueFixtures.T0);
        assertThat(stats.getOldestWaitMinutes()).isPositive();
        assertThat(stats.isEnabled()).isTrue();
    }
}

package com.architecture.memory.mergeflow.service.queue;

import com.architecture.memory.mergeflow.dto.github.PullRequestInfo;
import com.architecture.memory.mergeflow.dto.queue.ConflictingPR;
import com.architecture.memory.mergeflow.dto.queue.FileOverlap;
import com.architecture.memory.mergeflow.dto.queue.MergeQueueConfig;
import com.architecture.memory.mergeflow.dto.queue.QueueAddition;
import com.architecture.memory.mergeflow.dto.queue.QueueOperationResult;
import com.architecture.memory.mergeflow.dto.queue.QueueProcessingResult;
import com.architecture.memory.mergeflow.dto.queue.QueueStats;
import com.architecture.memory.mergeflow.exception.ResourceNotFoundException;
import com.architecture.memory.mergeflow.exception.ValidationException;
import com.architecture.memory.mergeflow.model.MergeQueueItem;
import com.architecture.memory.mergeflow.model.QueueItemStatus;
import com.architecture.memory.mergeflow.service.github.GitProviderClient;
import com.architecture.memory.mergeflow.service.notify.MergeQueueEvent;
import com.architecture.memory.mergeflow.service.notify.QueueNotificationBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for merge queue operations of a repository.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MergeQueueService {

    private final MergeQueueStore queueStore;
    private final MergeQueueConfigService configService;
    private final MergeQueueProcessor queueProcessor;
    private final ConflictDetector conflictDetector;
    private final GitProviderClient gitProviderClient;
    private final QueueNotificationBroadcaster notificationBroadcaster;

    /**
     * Queue a PR. Re-adding a PR that is already queued returns the existing item untouched.
     */
    public QueueAddition addToQueue(String owner, String repo, String repositoryId, int prNumber, int priority) {
        Optional<MergeQueueItem> existing = queueStore.find(repositoryId, prNumber);
        if (existing.isPresent()) {
            log.debug("PR #{} already queued in repository {}", prNumber, repositoryId);
            return new QueueAddition(existing.get(), false);
        }

        PullRequestInfo pr = gitProviderClient.getPullRequest(owner, repo, prNumber);
        if (pr.isMerged() || pr.isClosed()) {
            throw new ValidationException("PR #" + prNumber + " is not open");
        }

        MergeQueueItem item = MergeQueueItem.builder()
                .id(MergeQueueItem.itemId(repositoryId, prNumber))
                .repositoryId(repositoryId)
                .prNumber(prNumber)
                .prTitle(pr.getTitle())
                .authorLogin(pr.authorLogin())
                .headSha(pr.headSha())
                .baseBranch(pr.baseRef())
                .priority(priority)
                .status(QueueItemStatus.QUEUED)
                .addedAt(LocalDateTime.now())
                .attempts(0)
                .build();

        boolean created = queueStore.insertIfAbsent(item);
        if (created) {
            log.info("Added PR #{} to merge queue of repository {} with priority {}", prNumber, repositoryId, priority);
            notificationBroadcaster.publish(MergeQueueEvent.builder()
                    .type(MergeQueueEvent.Type.ADDED)
                    .repositoryId(repositoryId)
                    .prNumber(prNumber)
                    .status(QueueItemStatus.QUEUED)
                    .message(pr.getTitle())
                    .occurredAt(LocalDateTime.now())
                    .build());
        }
        return new QueueAddition(queueStore.find(repositoryId, prNumber).orElse(item), created);
    }

    public QueueOperationResult removeFromQueue(String repositoryId, int prNumber) {
        if (!queueStore.remove(repositoryId, prNumber)) {
            return QueueOperationResult.failed("PR #" + prNumber + " not found in queue");
        }
        log.info("Removed PR #{} from merge queue of repository {}", prNumber, repositoryId);
        notificationBroadcaster.publish(MergeQueueEvent.builder()
                .type(MergeQueueEvent.Type.REMOVED)
                .repositoryId(repositoryId)
                .prNumber(prNumber)
                .message("Removed from queue")
                .occurredAt(LocalDateTime.now())
                .build());
        return QueueOperationResult.ok("PR #" + prNumber + " removed from queue");
    }

    /**
     * Items in queue order with their 1-based position.
     */
    public List<MergeQueueItem> getQueue(String repositoryId) {
        List<MergeQueueItem> queue = new ArrayList<>(queueStore.findQueue(repositoryId));
        queue.sort(MergeQueueStore.QUEUE_ORDER);
        for (int i = 0; i < queue.size(); i++) {
            queue.get(i).setPosition(i + 1);
        }
        return queue;
    }

    public MergeQueueItem getQueueItem(String repositoryId, int prNumber) {
        return queueStore.find(repositoryId, prNumber)
                .orElseThrow(() -> new ResourceNotFoundException("Queue item", MergeQueueItem.itemId(repositoryId, prNumber)));
    }

    /**
     * Queued PRs ahead of the given one whose changes touch the same files.
     * Empty when the PR is not queued.
     */
    public List<ConflictingPR> getConflictingPRs(String owner, String repo, String repositoryId, int prNumber) {
        List<MergeQueueItem> queue = getQueue(repositoryId);
        Optional<MergeQueueItem> item = queue.stream().filter(i -> i.getPrNumber() == prNumber).findFirst();
        if (item.isEmpty()) {
            return List.of();
        }

        List<MergeQueueItem> ahead = MergeQueueProcessor.itemsAhead(queue, item.get());
        Map<Integer, MergeQueueItem> byNumber = new LinkedHashMap<>();
        ahead.forEach(other -> byNumber.put(other.getPrNumber(), other));

        List<ConflictingPR> conflicts = new ArrayList<>();
        for (FileOverlap overlap : conflictDetector.findOverlaps(owner, repo, item.get(), ahead)) {
            MergeQueueItem other = byNumber.get(overlap.getPrNumber());
            conflicts.add(ConflictingPR.builder()
                    .prNumber(overlap.getPrNumber())
                    .title(other != null ? other.getPrTitle() : null)
                    .conflictingFiles(overlap.getFiles())
                    .build());
        }
        return conflicts;
    }

    public QueueProcessingResult processQueue(String owner, String repo, String repositoryId) {
        return queueProcessor.processQueue(owner, repo, repositoryId);
    }

    public QueueOperationResult rebaseAndRetry(String owner, String repo, String repositoryId, int prNumber) {
        return queueProcessor.rebaseAndRetry(owner, repo, repositoryId, prNumber);
    }

    public QueueStats getQueueStats(String repositoryId) {
        List<MergeQueueItem> queue = queueStore.findQueue(repositoryId);
        MergeQueueConfig config = configService.getConfig(repositoryId);

        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (QueueItemStatus status : QueueItemStatus.values()) {
            byStatus.put(status.getValue(), 0L);
        }
        LocalDateTime oldest = null;
        for (MergeQueueItem item : queue) {
            byStatus.merge(item.getStatus().getValue(), 1L, Long::sum);
            if (item.getAddedAt() != null && (oldest == null || item.getAddedAt().isBefore(oldest))) {
                oldest = item.getAddedAt();
            }
        }

        return QueueStats.builder()
                .repositoryId(repositoryId)
                .total(queue.size())
                .byStatus(byStatus)
                .oldestAddedAt(oldest)
                .oldestWaitMinutes(oldest != null ? Duration.between(oldest, LocalDateTime.now()).toMinutes() : null)
                .enabled(config.isEnabled())
                .autoMergeEnabled(config.isAutoMergeEnabled())
                .mergeMethod(config.getMergeMethod())
                .batchSize(config.getBatchSize())
                .build();
    }
}

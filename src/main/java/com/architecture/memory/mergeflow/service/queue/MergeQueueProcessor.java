package com.architecture.memory.mergeflow.service.queue;

import com.architecture.memory.mergeflow.dto.github.BranchComparison;
import com.architecture.memory.mergeflow.dto.github.CheckState;
import com.architecture.memory.mergeflow.dto.github.PullRequestInfo;
import com.architecture.memory.mergeflow.dto.github.PullRequestReview;
import com.architecture.memory.mergeflow.dto.queue.FileOverlap;
import com.architecture.memory.mergeflow.dto.queue.MergeQueueConfig;
import com.architecture.memory.mergeflow.dto.queue.QueueOperationResult;
import com.architecture.memory.mergeflow.dto.queue.QueueProcessingResult;
import com.architecture.memory.mergeflow.dto.queue.QueueProcessingResult.ItemOutcome;
import com.architecture.memory.mergeflow.exception.ProviderException;
import com.architecture.memory.mergeflow.model.BlockingPolicy;
import com.architecture.memory.mergeflow.model.MergeQueueItem;
import com.architecture.memory.mergeflow.model.QueueItemStatus;
import com.architecture.memory.mergeflow.service.github.GitProviderClient;
import com.architecture.memory.mergeflow.service.notify.MergeQueueEvent;
import com.architecture.memory.mergeflow.service.notify.QueueNotificationBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Drives merge queue items through their lifecycle, one pass at a time.
 *
 * A pass takes up to {@code batchSize} items in queue order and evaluates them strictly one
 * after another. Under the head-of-line policy the first item left blocked, conflicted or still
 * checking ends the pass so nothing overtakes it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MergeQueueProcessor {

    private final MergeQueueStore queueStore;
    private final MergeQueueConfigService configService;
    private final GitProviderClient gitProviderClient;
    private final ConflictDetector conflictDetector;
    private final QueueNotificationBroadcaster notificationBroadcaster;

    private final Set<String> rebasesInFlight = ConcurrentHashMap.newKeySet();

    private enum Verdict { PASS, BLOCKED, CONFLICTED, PENDING }

    private record Readiness(Verdict verdict, String reason, List<Integer> conflictsWith) {
        static final Readiness PASSED = new Readiness(Verdict.PASS, null, List.of());

        Readiness(Verdict verdict, String reason) {
            this(verdict, reason, List.of());
        }
    }

    public QueueProcessingResult processQueue(String owner, String repo, String repositoryId) {
        MergeQueueConfig config = configService.getConfig(repositoryId);
        if (!config.isEnabled()) {
            log.debug("Merge queue disabled for repository {}", repositoryId);
            return QueueProcessingResult.disabled(repositoryId);
        }

        List<MergeQueueItem> queue = queueStore.findQueue(repositoryId);
        List<MergeQueueItem> candidates = queue.stream()
                .filter(item -> item.getStatus() != QueueItemStatus.FAILED)
                .limit(config.getBatchSize())
                .collect(Collectors.toList());

        QueueProcessingResult result = QueueProcessingResult.builder()
                .repositoryId(repositoryId)
                .enabled(true)
                .build();

        for (MergeQueueItem item : candidates) {
            ItemOutcome outcome;
            try {
                outcome = processItem(owner, repo, item, config);
            } catch (Exception e) {
                log.error("Unexpected error processing PR #{} in repository {}: {}",
                        item.getPrNumber(), repositoryId, e.getMessage(), e);
                outcome = markFailed(item, "Processing error: " + e.getMessage());
            }
            result.getItems().add(outcome);

            if (config.getBlockingPolicy() == BlockingPolicy.HEAD_OF_LINE
                    && outcome.getStatus() != null && outcome.getStatus().haltsQueue()) {
                result.setHalted(true);
                result.setHaltReason("PR #" + item.getPrNumber() + " is " + outcome.getStatus().getValue()
                        + (outcome.getMessage() != null ? ": " + outcome.getMessage() : ""));
                break;
            }
        }

        log.info("Merge queue pass for repository {}: {} item(s) evaluated, {} merged, halted={}",
                repositoryId, result.getItems().size(), result.countWithStatus(QueueItemStatus.MERGED), result.isHalted());
        return result;
    }

    private ItemOutcome processItem(String owner, String repo, MergeQueueItem item, MergeQueueConfig config) {
        QueueItemStatus previous = item.getStatus();

        if (previous == QueueItemStatus.MERGING) {
            return recoverInterruptedMerge(owner, repo, item);
        }
        if (previous == QueueItemStatus.QUEUED) {
            item = transition(item, QueueItemStatus.CHECKING, i -> { });
        }

        PullRequestInfo pr = gitProviderClient.getPullRequest(owner, repo, item.getPrNumber());
        if (pr.isMerged()) {
            return finishMerged(item, previous, MergeQueueEvent.Type.MERGED_EXTERNALLY, "Merged outside the queue");
        }
        if (pr.isClosed()) {
            queueStore.remove(item.getRepositoryId(), item.getPrNumber());
            notify(item, MergeQueueEvent.Type.REMOVED, null, "Closed without merging");
            return outcome(item, previous, null, "Closed without merging, removed from queue");
        }

        if (item.getStatus().isRetryable()) {
            // Parked until someone rebases and retries it
            return outcome(item, previous, item.getStatus(), item.getErrorMessage());
        }
        if (item.getStatus() == QueueItemStatus.READY) {
            return config.isAutoMergeEnabled()
                    ? merge(owner, repo, item, previous, config)
                    : outcome(item, previous, QueueItemStatus.READY, "Waiting for merge");
        }

        Readiness checked = checkReadiness(owner, repo, pr, config);
        if (checked.verdict() == Verdict.PASS && config.isCheckConflicts()) {
            checked = checkConflicts(owner, repo, item, pr, config);
        }
        final Readiness readiness = checked;
        String headSha = pr.headSha();

        switch (readiness.verdict()) {
            case PENDING:
                queueStore.update(item.getRepositoryId(), item.getPrNumber(), i -> {
                    i.setLastCheckedAt(LocalDateTime.now());
                    i.setHeadSha(headSha);
                });
                log.debug("PR #{} still checking: {}", item.getPrNumber(), readiness.reason());
                return outcome(item, previous, QueueItemStatus.CHECKING, readiness.reason());
            case BLOCKED:
                transition(item, QueueItemStatus.BLOCKED, i -> {
                    i.setErrorMessage(readiness.reason());
                    i.setHeadSha(headSha);
                });
                log.info("PR #{} blocked in repository {}: {}", item.getPrNumber(), item.getRepositoryId(), readiness.reason());
                return outcome(item, previous, QueueItemStatus.BLOCKED, readiness.reason());
            case CONFLICTED:
                transition(item, QueueItemStatus.CONFLICTED, i -> {
                    i.setConflictsWith(new ArrayList<>(readiness.conflictsWith()));
                    i.setErrorMessage(readiness.reason());
                    i.setHeadSha(headSha);
                });
                log.info("PR #{} conflicted in repository {}: {}", item.getPrNumber(), item.getRepositoryId(), readiness.reason());
                return outcome(item, previous, QueueItemStatus.CONFLICTED, readiness.reason());
            default:
                break;
        }

        MergeQueueItem ready = transition(item, QueueItemStatus.READY, i -> {
            i.setChecksPassedAt(LocalDateTime.now());
            i.setErrorMessage(null);
            i.getConflictsWith().clear();
            i.setHeadSha(headSha);
        });
        log.info("PR #{} ready to merge in repository {}", item.getPrNumber(), item.getRepositoryId());

        if (config.isAutoMergeEnabled()) {
            return merge(owner, repo, ready, previous, config);
        }
        return outcome(ready, previous, QueueItemStatus.READY, "All checks passed");
    }

    private Readiness checkReadiness(String owner, String repo, PullRequestInfo pr, MergeQueueConfig config) {
        if (pr.isDraft()) {
            return new Readiness(Verdict.BLOCKED, "PR is a draft");
        }

        // Latest decisive review per reviewer
        Map<String, String> latestReview = new LinkedHashMap<>();
        for (PullRequestReview review : gitProviderClient.getReviews(owner, repo, pr.getNumber())) {
            String reviewer = review.reviewerLogin();
            String state = review.getState();
            if (reviewer == null || state == null) continue;
            if (PullRequestReview.APPROVED.equals(state) || PullRequestReview.CHANGES_REQUESTED.equals(state)) {
                latestReview.put(reviewer, state);
            } else if ("DISMISSED".equals(state)) {
                latestReview.remove(reviewer);
            }
        }
        List<String> requestingChanges = latestReview.entrySet().stream()
                .filter(e -> PullRequestReview.CHANGES_REQUESTED.equals(e.getValue()))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        if (!requestingChanges.isEmpty()) {
            return new Readiness(Verdict.BLOCKED, "Changes requested by " + String.join(", ", requestingChanges));
        }
        long approvals = latestReview.values().stream().filter(PullRequestReview.APPROVED::equals).count();
        if (approvals < config.getRequireApprovals()) {
            return new Readiness(Verdict.BLOCKED,
                    "Needs " + config.getRequireApprovals() + " approval(s), has " + approvals);
        }

        if (config.isRequireChecks()) {
            CheckState checks = gitProviderClient.getCheckStatus(owner, repo, pr.headSha());
            if (checks == CheckState.FAILURE) {
                return new Readiness(Verdict.BLOCKED, "CI checks failed");
            }
            if (checks == CheckState.PENDING) {
                return new Readiness(Verdict.PENDING, "CI checks still running");
            }
        }

        if (config.isRequireUpToDate()) {
            BranchComparison comparison = gitProviderClient.compareBranches(owner, repo, pr.baseRef(), pr.headSha());
            if (comparison != null && comparison.getBehindBy() > 0) {
                if (!config.isAutoResolveConflicts()) {
                    return new Readiness(Verdict.BLOCKED,
                            "Branch is " + comparison.getBehindBy() + " commit(s) behind " + pr.baseRef());
                }
                try {
                    gitProviderClient.updateBranch(owner, repo, pr.getNumber(), pr.headSha());
                    return new Readiness(Verdict.PENDING, "Branch updated with " + pr.baseRef() + ", waiting for CI");
                } catch (ProviderException e) {
                    return new Readiness(Verdict.BLOCKED, "Could not update branch: " + e.getMessage());
                }
            }
        }

        return Readiness.PASSED;
    }

    private Readiness checkConflicts(String owner, String repo, MergeQueueItem item, PullRequestInfo pr,
                                     MergeQueueConfig config) {
        // Re-read so items merged or failed earlier in this pass no longer count as ahead
        List<MergeQueueItem> ahead = itemsAhead(queueStore.findQueue(item.getRepositoryId()), item);
        List<FileOverlap> overlaps = conflictDetector.findOverlaps(owner, repo, item, ahead);
        if (overlaps.isEmpty()) {
            return Readiness.PASSED;
        }

        if (config.isAutoResolveConflicts()) {
            try {
                gitProviderClient.updateBranch(owner, repo, item.getPrNumber(), pr.headSha());
                return new Readiness(Verdict.PENDING, "Branch updated to resolve conflicts, waiting for CI");
            } catch (ProviderException e) {
                log.warn("Automatic conflict resolution failed for PR #{}: {}", item.getPrNumber(), e.getMessage());
            }
        }

        List<Integer> conflicting = overlaps.stream().map(FileOverlap::getPrNumber).collect(Collectors.toList());
        String reason = "Conflicts with " + conflicting.stream().map(n -> "PR #" + n).collect(Collectors.joining(", "));
        return new Readiness(Verdict.CONFLICTED, reason, conflicting);
    }

    /**
     * Unmerged items queued ahead of the given one against the same base branch. Parked failed
     * items are left out since a pass never advances them.
     */
    static List<MergeQueueItem> itemsAhead(List<MergeQueueItem> queue, MergeQueueItem item) {
        List<MergeQueueItem> ahead = new ArrayList<>();
        for (MergeQueueItem other : queue) {
            if (other.getPrNumber() == item.getPrNumber()) break;
            if (other.getStatus() == QueueItemStatus.MERGED || other.getStatus() == QueueItemStatus.FAILED) continue;
            if (item.getBaseBranch() != null && !item.getBaseBranch().equals(other.getBaseBranch())) continue;
            ahead.add(other);
        }
        return ahead;
    }

    private ItemOutcome merge(String owner, String repo, MergeQueueItem item, QueueItemStatus previous,
                              MergeQueueConfig config) {
        // Status guard: only an item still ready may be sent to the provider
        Optional<MergeQueueItem> current = queueStore.find(item.getRepositoryId(), item.getPrNumber());
        if (current.isEmpty() || current.get().getStatus() != QueueItemStatus.READY) {
            QueueItemStatus status = current.map(MergeQueueItem::getStatus).orElse(null);
            log.debug("Skipping merge of PR #{}: status is {}", item.getPrNumber(), status);
            return outcome(item, previous, status, "Skipped merge, item is no longer ready");
        }

        MergeQueueItem merging = transition(current.get(), QueueItemStatus.MERGING, i -> { });
        try {
            gitProviderClient.mergePullRequest(owner, repo, merging.getPrNumber(), config.getMergeMethod(),
                    merging.getHeadSha());
        } catch (ProviderException e) {
            log.warn("Merge of PR #{} failed in repository {}: {}", merging.getPrNumber(),
                    merging.getRepositoryId(), e.getMessage());
            transition(merging, QueueItemStatus.FAILED, i -> i.setErrorMessage("Merge failed: " + e.getMessage()));
            notify(merging, MergeQueueEvent.Type.STATUS_CHANGED, QueueItemStatus.FAILED, "Merge failed: " + e.getMessage());
            return outcome(merging, previous, QueueItemStatus.FAILED, "Merge failed: " + e.getMessage());
        }

        return finishMerged(merging, previous, MergeQueueEvent.Type.MERGED, "Merged with " + config.getMergeMethod().getValue());
    }

    /**
     * An item left merging by an earlier pass is never sent a second merge request.
     */
    private ItemOutcome recoverInterruptedMerge(String owner, String repo, MergeQueueItem item) {
        PullRequestInfo pr = gitProviderClient.getPullRequest(owner, repo, item.getPrNumber());
        if (pr.isMerged()) {
            return finishMerged(item, QueueItemStatus.MERGING, MergeQueueEvent.Type.MERGED, "Merge completed");
        }
        transition(item, QueueItemStatus.FAILED, i -> i.setErrorMessage("Merge interrupted"));
        notify(item, MergeQueueEvent.Type.STATUS_CHANGED, QueueItemStatus.FAILED, "Merge interrupted");
        return outcome(item, QueueItemStatus.MERGING, QueueItemStatus.FAILED, "Merge interrupted");
    }

    private ItemOutcome finishMerged(MergeQueueItem item, QueueItemStatus previous, MergeQueueEvent.Type type,
                                     String message) {
        queueStore.update(item.getRepositoryId(), item.getPrNumber(), i -> {
            i.setStatus(QueueItemStatus.MERGED);
            i.setMergedAt(LocalDateTime.now());
        });
        queueStore.remove(item.getRepositoryId(), item.getPrNumber());
        notify(item, type, QueueItemStatus.MERGED, message);
        log.info("PR #{} merged in repository {}: {}", item.getPrNumber(), item.getRepositoryId(), message);
        return outcome(item, previous, QueueItemStatus.MERGED, message);
    }

    private ItemOutcome markFailed(MergeQueueItem item, String message) {
        Optional<MergeQueueItem> updated = queueStore.update(item.getRepositoryId(), item.getPrNumber(), i -> {
            if (i.getStatus().canTransitionTo(QueueItemStatus.FAILED)) {
                i.setStatus(QueueItemStatus.FAILED);
            }
            i.setErrorMessage(message);
            i.setLastCheckedAt(LocalDateTime.now());
        });
        QueueItemStatus status = updated.map(MergeQueueItem::getStatus).orElse(null);
        notify(item, MergeQueueEvent.Type.STATUS_CHANGED, status, message);
        return outcome(item, item.getStatus(), status, message);
    }

    public QueueOperationResult rebaseAndRetry(String owner, String repo, String repositoryId, int prNumber) {
        Optional<MergeQueueItem> existing = queueStore.find(repositoryId, prNumber);
        if (existing.isEmpty()) {
            return QueueOperationResult.failed("PR #" + prNumber + " not found in queue");
        }
        QueueItemStatus status = existing.get().getStatus();
        if (!status.isRetryable()) {
            return QueueOperationResult.failed("PR #" + prNumber + " is " + status.getValue()
                    + ", only blocked, conflicted or failed PRs can be rebased");
        }

        String key = MergeQueueItem.itemId(repositoryId, prNumber);
        if (!rebasesInFlight.add(key)) {
            return QueueOperationResult.failed("A rebase of PR #" + prNumber + " is already in progress");
        }
        try {
            try {
                gitProviderClient.updateBranch(owner, repo, prNumber, null);
            } catch (ProviderException e) {
                log.warn("Rebase of PR #{} in repository {} failed: {}", prNumber, repositoryId, e.getMessage());
                return QueueOperationResult.failed("Rebase failed: " + e.getMessage());
            }

            Optional<MergeQueueItem> updated = queueStore.update(repositoryId, prNumber, i -> {
                if (!i.getStatus().isRetryable()) {
                    throw new IllegalStateException("PR #" + prNumber + " changed to " + i.getStatus().getValue());
                }
                i.setStatus(QueueItemStatus.CHECKING);
                i.getConflictsWith().clear();
                i.setErrorMessage(null);
                i.setAttempts(i.getAttempts() + 1);
                i.setLastCheckedAt(LocalDateTime.now());
            });
            if (updated.isEmpty()) {
                return QueueOperationResult.failed("PR #" + prNumber + " not found in queue");
            }

            notify(updated.get(), MergeQueueEvent.Type.REBASED, QueueItemStatus.CHECKING, "Rebased, re-checking");
            log.info("PR #{} rebased in repository {} (attempt {})", prNumber, repositoryId, updated.get().getAttempts());
            return QueueOperationResult.ok("PR #" + prNumber + " rebased and queued for re-checking");
        } catch (IllegalStateException e) {
            return QueueOperationResult.failed(e.getMessage());
        } finally {
            rebasesInFlight.remove(key);
        }
    }

    /**
     * Persist a state change, enforcing the lifecycle against the stored status.
     */
    private MergeQueueItem transition(MergeQueueItem item, QueueItemStatus next, Consumer<MergeQueueItem> change) {
        return queueStore.update(item.getRepositoryId(), item.getPrNumber(), i -> {
            if (!i.getStatus().canTransitionTo(next)) {
                throw new IllegalStateException("PR #" + i.getPrNumber() + " cannot move from "
                        + i.getStatus().getValue() + " to " + next.getValue());
            }
            i.setStatus(next);
            i.setLastCheckedAt(LocalDateTime.now());
            change.accept(i);
        }).orElseThrow(() -> new IllegalStateException("PR #" + item.getPrNumber() + " left the queue"));
    }

    private void notify(MergeQueueItem item, MergeQueueEvent.Type type, QueueItemStatus status, String message) {
        notificationBroadcaster.publish(MergeQueueEvent.builder()
                .type(type)
                .repositoryId(item.getRepositoryId())
                .prNumber(item.getPrNumber())
                .status(status)
                .message(message)
                .occurredAt(LocalDateTime.now())
                .build());
    }

    private static ItemOutcome outcome(MergeQueueItem item, QueueItemStatus previous, QueueItemStatus status,
                                       String message) {
        return ItemOutcome.builder()
                .prNumber(item.getPrNumber())
                .previousStatus(previous)
                .status(status)
                .message(message)
                .build();
    }
}

package com.architecture.memory.mergeflow.service.queue;

import com.architecture.memory.mergeflow.model.MergeQueueItem;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable per-repository merge queue. Each operation is atomic for a single item.
 */
public interface MergeQueueStore {

    /**
     * Higher priority first, then first come first served, then lower PR number.
     */
    Comparator<MergeQueueItem> QUEUE_ORDER = Comparator
            .comparingInt(MergeQueueItem::getPriority).reversed()
            .thenComparing(MergeQueueItem::getAddedAt, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparingInt(MergeQueueItem::getPrNumber);

    Optional<MergeQueueItem> find(String repositoryId, int prNumber);

    /**
     * All items of a repository in {@link #QUEUE_ORDER}.
     */
    List<MergeQueueItem> findQueue(String repositoryId);

    /**
     * Insert the item unless one already exists for its repository and PR number.
     *
     * @return true if this call created the item
     */
    boolean insertIfAbsent(MergeQueueItem item);

    /**
     * Apply a change to the current version of an item and persist it.
     *
     * @return the updated item, or empty if the item no longer exists
     */
    Optional<MergeQueueItem> update(String repositoryId, int prNumber, Consumer<MergeQueueItem> change);

    boolean remove(String repositoryId, int prNumber);
}

package com.architecture.memory.mergeflow.service.notify;

import com.architecture.memory.mergeflow.model.QueueItemStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A change in a repository's merge queue, published as a Spring application event.
 */
@Value
@Builder
public class MergeQueueEvent {

    public enum Type {
        ADDED,
        REMOVED,
        STATUS_CHANGED,
        MERGED,
        MERGED_EXTERNALLY,
        REBASED,
        STALE
    }

    Type type;
    String repositoryId;
    int prNumber;
    QueueItemStatus status;
    String message;
    LocalDateTime occurredAt;
}

package com.architecture.memory.mergeflow.dto.queue;

import com.architecture.memory.mergeflow.model.MergeQueueItem;
import lombok.Value;

/**
 * The queued item, and whether this request created it or found it already queued.
 */
@Value
public class QueueAddition {
    MergeQueueItem item;
    boolean created;
}

package com.architecture.memory.mergeflow.service.notify;

/**
 * Fire-and-forget publication of merge queue changes. Implementations must not throw.
 */
public interface QueueNotificationBroadcaster {

    void publish(MergeQueueEvent event);
}

package com.architecture.memory.mergeflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a merge queue item.
 *
 * <pre>
 * queued -> checking -> ready -> merging -> merged | failed
 *              |-> blocked | conflicted | failed
 * blocked | conflicted | failed -> checking   (rebase and retry only)
 * </pre>
 */
public enum QueueItemStatus {
    QUEUED("queued"),
    CHECKING("checking"),
    READY("ready"),
    MERGING("merging"),
    MERGED("merged"),
    FAILED("failed"),
    BLOCKED("blocked"),
    CONFLICTED("conflicted");

    private static final Map<QueueItemStatus, Set<QueueItemStatus>> TRANSITIONS = new EnumMap<>(QueueItemStatus.class);

    static {
        TRANSITIONS.put(QUEUED, EnumSet.of(CHECKING));
        TRANSITIONS.put(CHECKING, EnumSet.of(READY, BLOCKED, CONFLICTED, FAILED));
        TRANSITIONS.put(READY, EnumSet.of(MERGING, FAILED));
        TRANSITIONS.put(MERGING, EnumSet.of(MERGED, FAILED));
        TRANSITIONS.put(MERGED, EnumSet.noneOf(QueueItemStatus.class));
        TRANSITIONS.put(FAILED, EnumSet.of(CHECKING));
        TRANSITIONS.put(BLOCKED, EnumSet.of(CHECKING));
        TRANSITIONS.put(CONFLICTED, EnumSet.of(CHECKING));
    }

    private final String value;

    QueueItemStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean canTransitionTo(QueueItemStatus next) {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet()).contains(next);
    }

    /**
     * States from which only an explicit rebase-and-retry moves the item on.
     */
    public boolean isRetryable() {
        return this == BLOCKED || this == CONFLICTED || this == FAILED;
    }

    /**
     * States that stop a head-of-line pass when reached by (or found on) an item.
     */
    public boolean haltsQueue() {
        return this == BLOCKED || this == CONFLICTED || this == CHECKING || this == QUEUED;
    }
}

package com.architecture.memory.mergeflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a queue pass does when an item cannot advance.
 */
public enum BlockingPolicy {
    /** A blocked, conflicted or still-checking item stops the whole pass. */
    HEAD_OF_LINE("head_of_line"),
    /** Later items in the batch are evaluated anyway. */
    SKIP_BLOCKED("skip_blocked");

    private final String value;

    BlockingPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static BlockingPolicy fromValue(String value) {
        for (BlockingPolicy policy : values()) {
            if (policy.value.equalsIgnoreCase(value)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown blocking policy: " + value);
    }
}

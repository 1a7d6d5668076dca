package com.architecture.memory.mergeflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MergeMethod {
    MERGE("merge"),
    SQUASH("squash"),
    REBASE("rebase");

    private final String value;

    MergeMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static MergeMethod fromValue(String value) {
        for (MergeMethod method : values()) {
            if (method.value.equalsIgnoreCase(value)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown merge method: " + value);
    }
}

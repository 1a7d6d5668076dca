package com.architecture.memory.mergeflow.dto.graph;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EdgeType {
    BRANCH_DEPENDENCY("branch_dependency"),
    FILE_CONFLICT("file_conflict"),
    SEMANTIC_DEPENDENCY("semantic_dependency"),
    EXPLICIT("explicit");

    private final String value;

    EdgeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

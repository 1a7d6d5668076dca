package com.architecture.memory.mergeflow.dto.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A directed dependency between two PR nodes: {@code source} depends on (or conflicts with) {@code target}.
 * Serialized with a {@code type} tag naming the edge kind.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BranchDependencyEdge.class, name = "branch_dependency"),
        @JsonSubTypes.Type(value = FileConflictEdge.class, name = "file_conflict"),
        @JsonSubTypes.Type(value = SemanticDependencyEdge.class, name = "semantic_dependency"),
        @JsonSubTypes.Type(value = ExplicitDependencyEdge.class, name = "explicit")
})
public abstract class DependencyEdge {

    private String source;
    private String target;
    private double strength;
    private String description;

    @JsonIgnore
    public abstract EdgeType getType();

    public boolean touches(String nodeId) {
        return nodeId.equals(source) || nodeId.equals(target);
    }

    /**
     * Identity used to drop duplicate edges. File conflicts are unordered.
     */
    public String dedupeKey() {
        if (getType() == EdgeType.FILE_CONFLICT && source.compareTo(target) > 0) {
            return target + "|" + source + "|" + getType().getValue();
        }
        return source + "|" + target + "|" + getType().getValue();
    }
}

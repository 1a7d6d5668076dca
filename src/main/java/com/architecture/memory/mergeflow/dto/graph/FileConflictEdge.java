package com.architecture.memory.mergeflow.dto.graph;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Two PRs touching at least one common file. Unordered: source is simply the earlier PR.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class FileConflictEdge extends DependencyEdge {

    private List<String> conflictFiles = new ArrayList<>();

    public FileConflictEdge(String source, String target, double strength, String description,
                            List<String> conflictFiles) {
        super(source, target, strength, description);
        this.conflictFiles = conflictFiles;
    }

    @Override
    public EdgeType getType() {
        return EdgeType.FILE_CONFLICT;
    }
}

package com.architecture.memory.mergeflow.dto.graph;

import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * PR stacked on another PR's head branch.
 */
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class BranchDependencyEdge extends DependencyEdge {

    public BranchDependencyEdge(String source, String target, double strength, String description) {
        super(source, target, strength, description);
    }

    @Override
    public EdgeType getType() {
        return EdgeType.BRANCH_DEPENDENCY;
    }
}

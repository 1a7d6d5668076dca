package com.architecture.memory.mergeflow.dto.graph;

import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SemanticDependencyEdge extends DependencyEdge {

    public SemanticDependencyEdge(String source, String target, double strength, String description) {
        super(source, target, strength, description);
    }

    @Override
    public EdgeType getType() {
        return EdgeType.SEMANTIC_DEPENDENCY;
    }
}

package com.architecture.memory.mergeflow.dto.graph;

import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ExplicitDependencyEdge extends DependencyEdge {

    public ExplicitDependencyEdge(String source, String target, double strength, String description) {
        super(source, target, strength, description);
    }

    @Override
    public EdgeType getType() {
        return EdgeType.EXPLICIT;
    }
}

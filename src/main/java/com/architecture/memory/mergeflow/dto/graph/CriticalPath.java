package com.architecture.memory.mergeflow.dto.graph;

import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Merge sequence: acyclic PRs in dependency-safe order followed by the cyclic ones.
 */
@Value
public class CriticalPath {
    List<String> order;
    Set<String> cyclicNodeIds;
}

package com.architecture.memory.mergeflow.dto.github;

/**
 * Combined CI verdict for a commit across commit statuses and check runs.
 */
public enum CheckState {
    SUCCESS,
    PENDING,
    FAILURE
}

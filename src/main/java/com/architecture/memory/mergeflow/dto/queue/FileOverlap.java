package com.architecture.memory.mergeflow.dto.queue;

import lombok.Value;

import java.util.List;

/**
 * Files a PR shares with a PR queued ahead of it.
 */
@Value
public class FileOverlap {
    int prNumber;
    List<String> files;
}

package com.architecture.memory.mergeflow.dto.queue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A queued PR ahead of the given one that touches some of the same files.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConflictingPR {

    private int prNumber;
    private String title;

    @Builder.Default
    private List<String> conflictingFiles = new ArrayList<>();
}

package com.architecture.memory.mergeflow.dto.queue;

import com.architecture.memory.mergeflow.model.BlockingPolicy;
import com.architecture.memory.mergeflow.model.MergeMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Effective merge queue policy of a repository: persisted overrides applied over the defaults.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MergeQueueConfig {

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private boolean autoMergeEnabled = false;

    @Builder.Default
    private int requireApprovals = 1;

    @Builder.Default
    private boolean requireChecks = true;

    @Builder.Default
    private boolean requireUpToDate = true;

    @Builder.Default
    private boolean checkConflicts = true;

    @Builder.Default
    private boolean autoResolveConflicts = false;

    @Builder.Default
    private MergeMethod mergeMethod = MergeMethod.SQUASH;

    @Builder.Default
    private int batchSize = 1;

    @Builder.Default
    private int maxWaitTimeMinutes = 60;

    @Builder.Default
    private BlockingPolicy blockingPolicy = BlockingPolicy.HEAD_OF_LINE;

    public static MergeQueueConfig defaults() {
        return MergeQueueConfig.builder().build();
    }
}

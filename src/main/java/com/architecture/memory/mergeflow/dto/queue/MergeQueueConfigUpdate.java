package com.architecture.memory.mergeflow.dto.queue;

import com.architecture.memory.mergeflow.model.BlockingPolicy;
import com.architecture.memory.mergeflow.model.MergeMethod;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a repository's merge queue policy. Null fields are left as they are.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeQueueConfigUpdate {

    private Boolean enabled;
    private Boolean autoMergeEnabled;

    @Min(value = 0, message = "requireApprovals must be between 0 and 10")
    @Max(value = 10, message = "requireApprovals must be between 0 and 10")
    private Integer requireApprovals;

    private Boolean requireChecks;
    private Boolean requireUpToDate;
    private Boolean checkConflicts;
    private Boolean autoResolveConflicts;
    private MergeMethod mergeMethod;

    @Min(value = 1, message = "batchSize must be between 1 and 10")
    @Max(value = 10, message = "batchSize must be between 1 and 10")
    private Integer batchSize;

    @Min(value = 5, message = "maxWaitTimeMinutes must be between 5 and 1440")
    @Max(value = 1440, message = "maxWaitTimeMinutes must be between 5 and 1440")
    private Integer maxWaitTimeMinutes;

    private BlockingPolicy blockingPolicy;
}

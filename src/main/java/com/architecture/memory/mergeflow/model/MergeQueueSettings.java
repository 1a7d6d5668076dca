package com.architecture.memory.mergeflow.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * Per-repository merge queue overrides. Only fields that were explicitly set are non-null;
 * everything else falls back to the defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "merge_queue_settings")
public class MergeQueueSettings {

    @Id
    private String repositoryId;

    private Boolean enabled;
    private Boolean autoMergeEnabled;
    private Integer requireApprovals;
    private Boolean requireChecks;
    private Boolean requireUpToDate;
    private Boolean checkConflicts;
    private Boolean autoResolveConflicts;
    private MergeMethod mergeMethod;
    private Integer batchSize;
    private Integer maxWaitTimeMinutes;
    private BlockingPolicy blockingPolicy;

    private LocalDateTime updatedAt;
}

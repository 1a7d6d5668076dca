package com.architecture.memory.mergeflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A pull request waiting in a repository's merge queue.
 * Exactly one item exists per (repositoryId, prNumber).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "merge_queue_items")
@CompoundIndex(name = "repository_pr_idx", def = "{'repositoryId': 1, 'prNumber': 1}", unique = true)
public class MergeQueueItem {

    @Id
    private String id;              // {repositoryId}:{prNumber}

    private String repositoryId;
    private int prNumber;
    private String prTitle;
    private String authorLogin;
    private String headSha;
    private String baseBranch;

    private int priority;
    private QueueItemStatus status;

    private LocalDateTime addedAt;
    private LocalDateTime lastCheckedAt;
    private LocalDateTime checksPassedAt;
    private LocalDateTime mergedAt;

    private int attempts;

    @Builder.Default
    private List<Integer> conflictsWith = new ArrayList<>();

    private String errorMessage;

    // 1-based position, filled in when the queue is listed
    @Transient
    private Integer position;

    @Version
    @JsonIgnore
    private Long version;

    public static String itemId(String repositoryId, int prNumber) {
        return repositoryId + ":" + prNumber;
    }
}

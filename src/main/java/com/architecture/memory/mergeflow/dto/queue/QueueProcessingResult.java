package com.architecture.memory.mergeflow.dto.queue;

import com.architecture.memory.mergeflow.model.QueueItemStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one pass over a repository's merge queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueProcessingResult {

    private String repositoryId;
    private boolean enabled;

    @Builder.Default
    private List<ItemOutcome> items = new ArrayList<>();

    private boolean halted;
    private String haltReason;

    public static QueueProcessingResult disabled(String repositoryId) {
        return QueueProcessingResult.builder()
                .repositoryId(repositoryId)
                .enabled(false)
                .build();
    }

    public long countWithStatus(QueueItemStatus status) {
        return items.stream().filter(i -> i.getStatus() == status).count();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemOutcome {
        private int prNumber;
        private QueueItemStatus previousStatus;
        private QueueItemStatus status;     // null when the item left the queue without merging
        private String message;
    }
}

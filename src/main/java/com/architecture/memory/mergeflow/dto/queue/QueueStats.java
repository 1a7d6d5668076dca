package com.architecture.memory.mergeflow.dto.queue;

import com.architecture.memory.mergeflow.model.MergeMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStats {

    private String repositoryId;
    private int total;

    @Builder.Default
    private Map<String, Long> byStatus = new LinkedHashMap<>();

    private LocalDateTime oldestAddedAt;
    private Long oldestWaitMinutes;

    private boolean enabled;
    private boolean autoMergeEnabled;
    private MergeMethod mergeMethod;
    private int batchSize;
}

package com.architecture.memory.mergeflow.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeCheckResponse {

    private String workflowId;
    private boolean canMerge;

    @Builder.Default
    private List<String> blockers = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    private String summary;
}

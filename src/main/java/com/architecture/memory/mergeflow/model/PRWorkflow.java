package com.architecture.memory.mergeflow.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A pull request workflow as recorded by the upstream workflow pipeline,
 * together with the risk analysis attached to it.
 * Read-only from the point of view of the dependency graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "pr_workflows")
public class PRWorkflow {

    @Id
    private String id;

    @Indexed
    private String repositoryId;

    private int prNumber;
    private String prTitle;
    private String headBranch;
    private String baseBranch;
    private String authorLogin;
    private String status;          // opaque upstream status; COMPLETED and FAILED are inactive

    private Analysis analysis;

    private LocalDateTime createdAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Analysis {
        private String riskLevel;   // low, medium, high, critical
        private ImpactRadius impactRadius;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImpactRadius {
        @Builder.Default
        private List<String> affectedFiles = new ArrayList<>();
    }

    public String riskLevelOrNull() {
        return analysis != null ? analysis.getRiskLevel() : null;
    }

    public List<String> affectedFilesOrEmpty() {
        if (analysis == null || analysis.getImpactRadius() == null
                || analysis.getImpactRadius().getAffectedFiles() == null) {
            return List.of();
        }
        return analysis.getImpactRadius().getAffectedFiles();
    }

    public static class Status {
        public static final String PENDING = "PENDING";
        public static final String ANALYZING = "ANALYZING";
        public static final String REVIEWING = "REVIEWING";
        public static final String COMPLETED = "COMPLETED";
        public static final String FAILED = "FAILED";

        public static final List<String> INACTIVE = List.of(COMPLETED, FAILED);
    }
}

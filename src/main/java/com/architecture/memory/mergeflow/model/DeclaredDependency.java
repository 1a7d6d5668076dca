package com.architecture.memory.mergeflow.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * A dependency between two workflows that was declared by a collaborator
 * (an author marking "depends on", or the analysis service spotting related code)
 * rather than derived from branches or files.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "declared_dependencies")
public class DeclaredDependency {

    @Id
    private String id;

    @Indexed
    private String repositoryId;

    private String sourceWorkflowId;    // the dependent PR
    private String targetWorkflowId;    // the PR it depends on

    private Kind kind;

    private double strength;
    private String description;

    private LocalDateTime createdAt;

    public enum Kind {
        EXPLICIT,
        SEMANTIC
    }
}

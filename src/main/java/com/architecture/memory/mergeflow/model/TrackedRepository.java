package com.architecture.memory.mergeflow.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "repositories")
public class TrackedRepository {

    @Id
    private String id;

    private String owner;

    private String name;

    @Indexed(unique = true)
    private String fullName;        // owner/name

    private String defaultBranch;

    private LocalDateTime createdAt;

    public static String fullName(String owner, String name) {
        return owner + "/" + name;
    }
}

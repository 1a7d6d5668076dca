package com.architecture.memory.mergeflow.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A file changed in a pull request.
 * GET /repos/{owner}/{repo}/pulls/{pull_number}/files
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PullRequestFile {

    private String filename;
    private String status;      // added, removed, modified, renamed, copied, changed
    private int additions;
    private int deletions;
    private String patch;       // unified diff, absent for binary or very large files

    @JsonProperty("previous_filename")
    private String previousFilename;

    public boolean hasPatch() {
        return patch != null && !patch.isEmpty();
    }
}

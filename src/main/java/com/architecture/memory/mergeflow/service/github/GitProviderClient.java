package com.architecture.memory.mergeflow.service.github;

import com.architecture.memory.mergeflow.dto.github.BranchComparison;
import com.architecture.memory.mergeflow.dto.github.CheckState;
import com.architecture.memory.mergeflow.dto.github.MergeResult;
import com.architecture.memory.mergeflow.dto.github.PullRequestFile;
import com.architecture.memory.mergeflow.dto.github.PullRequestInfo;
import com.architecture.memory.mergeflow.dto.github.PullRequestReview;
import com.architecture.memory.mergeflow.model.MergeMethod;

import java.util.List;

/**
 * What the merge queue needs from the Git host. Every method throws
 * {@link com.architecture.memory.mergeflow.exception.ProviderException} when the host cannot be reached
 * or rejects the request.
 */
public interface GitProviderClient {

    PullRequestInfo getPullRequest(String owner, String repo, int prNumber);

    List<PullRequestReview> getReviews(String owner, String repo, int prNumber);

    /**
     * Combined verdict of commit statuses and check runs for a commit or branch.
     */
    CheckState getCheckStatus(String owner, String repo, String ref);

    BranchComparison compareBranches(String owner, String repo, String base, String head);

    /**
     * Bring the PR's head branch up to date with its base.
     */
    void updateBranch(String owner, String repo, int prNumber, String expectedHeadSha);

    MergeResult mergePullRequest(String owner, String repo, int prNumber, MergeMethod method, String expectedHeadSha);

    List<PullRequestFile> getPullRequestFiles(String owner, String repo, int prNumber);
}

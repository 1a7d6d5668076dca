package com.architecture.memory.mergeflow.service.github;

import com.architecture.memory.mergeflow.dto.github.BranchComparison;
import com.architecture.memory.mergeflow.dto.github.CheckRunList;
import com.architecture.memory.mergeflow.dto.github.CheckState;
import com.architecture.memory.mergeflow.dto.github.CombinedCommitStatus;
import com.architecture.memory.mergeflow.dto.github.MergeResult;
import com.architecture.memory.mergeflow.dto.github.PullRequestFile;
import com.architecture.memory.mergeflow.dto.github.PullRequestInfo;
import com.architecture.memory.mergeflow.dto.github.PullRequestReview;
import com.architecture.memory.mergeflow.exception.ProviderException;
import com.architecture.memory.mergeflow.model.MergeMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * GitHub REST implementation of the Git provider capability.
 */
@Service
@Slf4j
public class GitHubProviderClient implements GitProviderClient {

    private static final int FILES_PAGE_SIZE = 100;
    private static final int MAX_FILE_PAGES = 30;   // GitHub lists at most 3000 files per PR
    private static final Set<String> FAILED_CONCLUSIONS = Set.of("failure", "cancelled", "timed_out", "action_required");

    private final WebClient.Builder webClientBuilder;

    @Value("${github.api.base-url:https://api.github.com}")
    private String githubApiBaseUrl = "https://api.github.com";

    @Value("${github.api.token:}")
    private String accessToken = "";

    @Value("${github.api.timeout-seconds:30}")
    private long timeoutSeconds = 30;

    public GitHubProviderClient(WebClient.Builder webClientBuilder) {
        this.webClientBuilder = webClientBuilder;
    }

    @Override
    public PullRequestInfo getPullRequest(String owner, String repo, int prNumber) {
        log.debug("Fetching PR #{} of {}/{}", prNumber, owner, repo);
        return execute("getPullRequest", buildClient().get()
                .uri("/repos/{owner}/{repo}/pulls/{number}", owner, repo, prNumber)
                .retrieve()
                .bodyToMono(PullRequestInfo.class));
    }

    @Override
    public List<PullRequestReview> getReviews(String owner, String repo, int prNumber) {
        List<PullRequestReview> reviews = execute("getReviews", buildClient().get()
                .uri("/repos/{owner}/{repo}/pulls/{number}/reviews?per_page=100", owner, repo, prNumber)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<List<PullRequestReview>>() {}));
        return reviews != null ? reviews : List.of();
    }

    @Override
    public CheckState getCheckStatus(String owner, String repo, String ref) {
        WebClient client = buildClient();

        CombinedCommitStatus combined = execute("getCheckStatus", client.get()
                .uri("/repos/{owner}/{repo}/commits/{ref}/status", owner, repo, ref)
                .retrieve()
                .bodyToMono(CombinedCommitStatus.class));

        CheckRunList checkRuns = execute("getCheckStatus", client.get()
                .uri("/repos/{owner}/{repo}/commits/{ref}/check-runs?per_page=100", owner, repo, ref)
                .retrieve()
                .bodyToMono(CheckRunList.class));

        CheckState state = combine(combined, checkRuns);
        log.debug("CI state for {}/{}@{}: {}", owner, repo, ref, state);
        return state;
    }

    static CheckState combine(CombinedCommitStatus combined, CheckRunList checkRuns) {
        boolean pending = false;

        // GitHub reports "pending" when no status was ever posted, so only count real statuses
        if (combined != null && combined.getStatuses() != null && !combined.getStatuses().isEmpty()) {
            String state = combined.getState();
            if ("failure".equals(state) || "error".equals(state)) {
                return CheckState.FAILURE;
            }
            if (!"success".equals(state)) {
                pending = true;
            }
        }

        if (checkRuns != null && checkRuns.getCheckRuns() != null) {
            for (CheckRunList.CheckRun run : checkRuns.getCheckRuns()) {
                if (!"completed".equals(run.getStatus())) {
                    pending = true;
                } else if (run.getConclusion() != null && FAILED_CONCLUSIONS.contains(run.getConclusion())) {
                    return CheckState.FAILURE;
                }
            }
        }

        return pending ? CheckState.PENDING : CheckState.SUCCESS;
    }

    @Override
    public BranchComparison compareBranches(String owner, String repo, String base, String head) {
        return execute("compareBranches", buildClient().get()
                .uri("/repos/{owner}/{repo}/compare/{base}...{head}", owner, repo, base, head)
                .retrieve()
                .bodyToMono(BranchComparison.class));
    }

    @Override
    public void updateBranch(String owner, String repo, int prNumber, String expectedHeadSha) {
        log.info("Updating branch of PR #{} in {}/{}", prNumber, owner, repo);
        Map<String, Object> body = new HashMap<>();
        if (expectedHeadSha != null) {
            body.put("expected_head_sha", expectedHeadSha);
        }
        execute("updateBranch", buildClient().put()
                .uri("/repos/{owner}/{repo}/pulls/{number}/update-branch", owner, repo, prNumber)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public MergeResult mergePullRequest(String owner, String repo, int prNumber, MergeMethod method,
                                        String expectedHeadSha) {
        log.info("Merging PR #{} in {}/{} with method {}", prNumber, owner, repo, method.getValue());
        Map<String, Object> body = new HashMap<>();
        body.put("merge_method", method.getValue());
        if (expectedHeadSha != null) {
            body.put("sha", expectedHeadSha);
        }

        MergeResult result = execute("mergePullRequest", buildClient().put()
                .uri("/repos/{owner}/{repo}/pulls/{number}/merge", owner, repo, prNumber)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(MergeResult.class));

        if (result == null || !result.isMerged()) {
            String message = result != null && result.getMessage() != null ? result.getMessage() : "PR was not merged";
            throw new ProviderException("mergePullRequest", message);
        }
        return result;
    }

    @Override
    public List<PullRequestFile> getPullRequestFiles(String owner, String repo, int prNumber) {
        WebClient client = buildClient();
        List<PullRequestFile> files = new ArrayList<>();

        for (int page = 1; page <= MAX_FILE_PAGES; page++) {
            List<PullRequestFile> batch = execute("getPullRequestFiles", client.get()
                    .uri("/repos/{owner}/{repo}/pulls/{number}/files?per_page={size}&page={page}",
                            owner, repo, prNumber, FILES_PAGE_SIZE, page)
                    .retrieve()
                    .bodyToMono(new ParameterizedTypeReference<List<PullRequestFile>>() {}));
            if (batch == null || batch.isEmpty()) break;
            files.addAll(batch);
            if (batch.size() < FILES_PAGE_SIZE) break;
        }

        log.debug("PR #{} in {}/{} changes {} files", prNumber, owner, repo, files.size());
        return files;
    }

    private WebClient buildClient() {
        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(githubApiBaseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28");
        if (accessToken != null && !accessToken.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);
        }
        return builder.build();
    }

    private <T> T execute(String operation, Mono<T> request) {
        try {
            return request.block(Duration.ofSeconds(timeoutSeconds));
        } catch (WebClientResponseException e) {
            log.warn("GitHub {} failed with status {}", operation, e.getStatusCode().value());
            throw new ProviderException(operation, e.getStatusCode().value(),
                    "GitHub " + operation + " failed with status " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            log.warn("GitHub {} could not reach the API: {}", operation, e.getMessage());
            throw new ProviderException(operation, 0, "GitHub " + operation + " could not reach the API", e);
        } catch (IllegalStateException e) {
            // block(Duration) signals a timeout this way
            log.warn("GitHub {} timed out after {}s", operation, timeoutSeconds);
            throw new ProviderException(operation, 0, "GitHub " + operation + " timed out", e);
        }
    }
}

package com.architecture.memory.mergeflow.service.github;

import com.architecture.memory.mergeflow.dto.github.CheckRunList;
import com.architecture.memory.mergeflow.dto.github.CheckState;
import com.architecture.memory.mergeflow.dto.github.CombinedCommitStatus;
import com.architecture.memory.mergeflow.dto.github.PullRequestFile;
import com.architecture.memory.mergeflow.dto.github.PullRequestInfo;
import com.architecture.memory.mergeflow.dto.github.PullRequestReview;
import com.architecture.memory.mergeflow.exception.ProviderException;
import com.architecture.memory.mergeflow.model.MergeMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GitHubProviderClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private final Deque<ClientResponse> responses = new ArrayDeque<>();
    private RuntimeException failure;

    private GitHubProviderClient client;

    @BeforeEach
    void setUp() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            if (failure != null) {
                return Mono.error(failure);
            }
            return Mono.just(responses.removeFirst());
        });
        client = new GitHubProviderClient(builder);
        ReflectionTestUtils.setField(client, "githubApiBaseUrl", "https://github.test/api");
        ReflectionTestUtils.setField(client, "accessToken", "secret-token");
    }

    private void respond(HttpStatus status, String json) {
        responses.add(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build());
    }

    @Test
    void getPullRequest_sendsAuthenticatedRequest() {
        respond(HttpStatus.OK, "{\"number\":12,\"title\":\"Fix\",\"state\":\"open\",\"draft\":false,\"merged\":false,"
                + "\"head\":{\"ref\":\"feature/x\",\"sha\":\"abc\"},\"base\":{\"ref\":\"main\",\"sha\":\"def\"},"
                + "\"user\":{\"login\":\"octo\"},\"labels\":[]}");

        PullRequestInfo pr = client.getPullRequest("acme", "widgets", 12);

        assertThat(pr.getNumber()).isEqualTo(12);
        assertThat(pr.headSha()).isEqualTo("abc");
        assertThat(pr.baseRef()).isEqualTo("main");
        assertThat(pr.authorLogin()).isEqualTo("octo");
        assertThat(pr.isClosed()).isFalse();

        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.GET);
        assertThat(request.url().toString()).isEqualTo("https://github.test/api/repos/acme/widgets/pulls/12");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret-token");
        assertThat(request.headers().getFirst(HttpHeaders.ACCEPT)).isEqualTo("application/vnd.github+json");
    }

    @Test
    void getReviews_parsesReviewStates() {
        respond(HttpStatus.OK, "[{\"id\":1,\"user\":{\"login\":\"alice\"},\"state\":\"APPROVED\"},"
                + "{\"id\":2,\"user\":{\"login\":\"bob\"},\"state\":\"CHANGES_REQUESTED\"}]");

        List<PullRequestReview> reviews = client.getReviews("acme", "widgets", 12);

        assertThat(reviews).extracting(PullRequestReview::reviewerLogin).containsExactly("alice", "bob");
        assertThat(reviews).extracting(PullRequestReview::getState)
                .containsExactly(PullRequestReview.APPROVED, PullRequestReview.CHANGES_REQUESTED);
    }

    @Test
    void getCheckStatus_combinesStatusesAndCheckRuns() {
        respond(HttpStatus.OK, "{\"state\":\"success\",\"total_count\":1,\"statuses\":[{\"state\":\"success\"}]}");
        respond(HttpStatus.OK, "{\"total_count\":1,\"check_runs\":[{\"name\":\"build\",\"status\":\"in_progress\"}]}");

        assertThat(client.getCheckStatus("acme", "widgets", "abc")).isEqualTo(CheckState.PENDING);
        assertThat(requests).extracting(r -> r.url().getPath()).containsExactly(
                "/api/repos/acme/widgets/commits/abc/status",
                "/api/repos/acme/widgets/commits/abc/check-runs");
    }

    @Test
    void combine_ignoresPlaceholderPendingWithoutStatuses() {
        CombinedCommitStatus noStatuses = CombinedCommitStatus.builder().state("pending").build();
        CheckRunList passed = CheckRunList.builder()
                .checkRuns(List.of(new CheckRunList.CheckRun("build", "completed", "success")))
                .build();

        assertThat(GitHubProviderClient.combine(noStatuses, passed)).isEqualTo(CheckState.SUCCESS);
    }

    @Test
    void combine_failsOnFailedCheckRun() {
        CheckRunList runs = CheckRunList.builder()
                .checkRuns(List.of(
                        new CheckRunList.CheckRun("lint", "queued", null),
                        new CheckRunList.CheckRun("test", "completed", "timed_out")))
                .build();

        assertThat(GitHubProviderClient.combine(null, runs)).isEqualTo(CheckState.FAILURE);
    }

    @Test
    void mergePullRequest_whenNotMerged_throws() {
        respond(HttpStatus.OK, "{\"merged\":false,\"message\":\"Base branch was modified\"}");

        assertThatThrownBy(() -> client.mergePullRequest("acme", "widgets", 12, MergeMethod.SQUASH, "abc"))
                .isInstanceOf(ProviderException.class)
                .hasMessage("Base branch was modified");
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.PUT);
    }

    @Test
    void getPullRequestFiles_followsPagination() {
        String fullPage = IntStream.range(0, 100)
                .mapToObj(i -> "{\"filename\":\"src/F" + i + ".java\",\"status\":\"modified\"}")
                .collect(Collectors.joining(",", "[", "]"));
        respond(HttpStatus.OK, fullPage);
        respond(HttpStatus.OK, "[{\"filename\":\"README.md\",\"status\":\"added\",\"patch\":\"@@ -0,0 +1 @@\\n+hi\"}]");

        List<PullRequestFile> files = client.getPullRequestFiles("acme", "widgets", 12);

        assertThat(files).hasSize(101);
        assertThat(files.get(100).hasPatch()).isTrue();
        assertThat(requests).hasSize(2);
        assertThat(requests.get(1).url().getQuery()).isEqualTo("per_page=100&page=2");
    }

    @Test
    void errorStatus_isWrappedWithoutResponseBody() {
        respond(HttpStatus.NOT_FOUND, "{\"message\":\"Not Found\",\"documentation_url\":\"https://docs\"}");

        assertThatThrownBy(() -> client.getPullRequest("acme", "widgets", 99))
                .isInstanceOfSatisfying(ProviderException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(404);
                    assertThat(e.getOperation()).isEqualTo("getPullRequest");
                    assertThat(e.getMessage()).isEqualTo("GitHub getPullRequest failed with status 404")
                            .doesNotContain("documentation_url");
                });
    }

    @Test
    void networkFailure_isWrapped() {
        failure = new WebClientRequestException(new IOException("Connection refused"), HttpMethod.GET,
                URI.create("https://github.test/api/repos/acme/widgets/pulls/1"), new HttpHeaders());

        assertThatThrownBy(() -> client.getPullRequest("acme", "widgets", 1))
                .isInstanceOfSatisfying(ProviderException.class, e -> {
                    assertThat(e.getStatusCode()).isZero();
                    assertThat(e.getMessage()).isEqualTo("GitHub getPullRequest could not reach the API");
                });
    }
}

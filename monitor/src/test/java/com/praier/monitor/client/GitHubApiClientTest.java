package com.praier.monitor.client;

import com.praier.monitor.config.ServerConfig;
import com.praier.monitor.model.github.CheckRunsPage;
import com.praier.monitor.model.github.PullRequestQueryResponse.PullRequestNode;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GitHubApiClient} covering GraphQL and Link pagination,
 * error classification, retry logic, and the two mutations.
 */
class GitHubApiClientTest {

    private MockWebServer server;
    private GitHubApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(5, TimeUnit.SECONDS)
                .build();

        client = new GitHubApiClient(new ServerConfig("test", server.url("/").toString(), "test-token"), httpClient);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    // =========================================================================
    // Pagination parsing tests
    // =========================================================================

    @Test
    @DisplayName("parseNextPageUrl extracts next URL from Link header")
    void parseNextPageUrl_withNextAndLast() {
        String linkHeader = "<https://api.github.com/repos/o/r/actions/runs?page=2>; rel=\"next\", "
                + "<https://api.github.com/repos/o/r/actions/runs?page=5>; rel=\"last\"";

        assertEquals("https://api.github.com/repos/o/r/actions/runs?page=2",
                GitHubApiClient.parseNextPageUrl(linkHeader));
    }

    @Test
    @DisplayName("parseNextPageUrl returns null without a next link")
    void parseNextPageUrl_noNext() {
        assertNull(GitHubApiClient.parseNextPageUrl("<https://api.github.com/x?page=1>; rel=\"prev\""));
        assertNull(GitHubApiClient.parseNextPageUrl(null));
        assertNull(GitHubApiClient.parseNextPageUrl(""));
    }

    @Test
    @DisplayName("splitRepository rejects values that are not owner/name")
    void splitRepository_invalid() {
        assertArrayEquals(new String[]{"owner", "repo"}, GitHubApiClient.splitRepository("owner/repo"));
        assertThrows(IllegalArgumentException.class, () -> GitHubApiClient.splitRepository("owner"));
        assertThrows(IllegalArgumentException.class, () -> GitHubApiClient.splitRepository("owner/"));
    }

    // =========================================================================
    // Open pull requests (GraphQL)
    // =========================================================================

    @Test
    @DisplayName("getOpenPullRequests follows GraphQL cursors and sends auth headers")
    void getOpenPullRequests_paginates() throws Exception {
        server.enqueue(json(pullRequestPage(true, "cursor-1", node(1, "sha-1", "alice"))));
        server.enqueue(json(pullRequestPage(false, null, node(2, "sha-2", "bob"))));

        List<PullRequestNode> nodes = client.getOpenPullRequests("owner/repo");

        assertEquals(2, nodes.size());
        assertEquals(1, nodes.get(0).number());
        assertEquals("sha-2", nodes.get(1).headRefOid());
        assertEquals("bob", nodes.get(1).authorLogin());

        RecordedRequest first = server.takeRequest();
        assertEquals("POST", first.getMethod());
        assertEquals("/graphql", first.getPath());
        assertEquals("Bearer test-token", first.getHeader("Authorization"));
        assertEquals("2022-11-28", first.getHeader("X-GitHub-Api-Version"));
        assertEquals(GitHubApiClient.USER_AGENT, first.getHeader("User-Agent"));
        String firstBody = first.getBody().readUtf8();
        assertTrue(firstBody.contains("\"owner\":\"owner\""));
        assertTrue(firstBody.contains("\"after\":null"));

        RecordedRequest second = server.takeRequest();
        assertTrue(second.getBody().readUtf8().contains("\"after\":\"cursor-1\""));
    }

    @Test
    @DisplayName("A null repository in the GraphQL response means not found")
    void getOpenPullRequests_missingRepository() {
        server.enqueue(json("{\"data\":{\"repository\":null}}"));

        assertThrows(NotFoundException.class, () -> client.getOpenPullRequests("owner/gone"));
    }

    @Test
    @DisplayName("GraphQL errors are mapped by type")
    void getOpenPullRequests_graphQlErrors() {
        server.enqueue(json("{\"data\":null,\"errors\":[{\"type\":\"FORBIDDEN\",\"message\":\"no access\"}]}"));
        server.enqueue(json("{\"data\":null,\"errors\":[{\"type\":\"RATE_LIMITED\",\"message\":\"slow\"}]}"));
        server.enqueue(json("{\"data\":null,\"errors\":[{\"type\":\"NOT_FOUND\",\"message\":\"gone\"}]}"));
        server.enqueue(json("{\"data\":null,\"errors\":[{\"message\":\"syntax\"}]}"));

        assertThrows(PermissionDeniedException.class, () -> client.getOpenPullRequests("owner/repo"));
        assertThrows(RateLimitException.class, () -> client.getOpenPullRequests("owner/repo"));
        assertThrows(NotFoundException.class, () -> client.getOpenPullRequests("owner/repo"));
        GitHubApiException other = assertThrows(GitHubApiException.class, () -> client.getOpenPullRequests("owner/repo"));
        assertEquals(ErrorKind.TRANSPORT, ErrorKind.classify(other));
        assertTrue(other.getMessage().contains("syntax"));
    }

    // =========================================================================
    // REST pagination
    // =========================================================================

    @Test
    @DisplayName("getCheckRuns follows the Link header across pages")
    void getCheckRuns_followsLinks() throws Exception {
        String next = server.url("/repos/owner/repo/commits/abc/check-runs?per_page=100&page=2").toString();
        server.enqueue(json("{\"total_count\":2,\"check_runs\":[{\"id\":1,\"name\":\"build\",\"status\":\"completed\",\"conclusion\":\"success\"}]}")
                .setHeader("Link", "<" + next + ">; rel=\"next\""));
        server.enqueue(json("{\"total_count\":2,\"check_runs\":[{\"id\":2,\"name\":\"lint\",\"status\":\"completed\",\"conclusion\":\"failure\"}]}"));

        List<CheckRunsPage.CheckRunItem> runs = client.getCheckRuns("owner/repo", "abc");

        assertEquals(List.of("build", "lint"), runs.stream().map(CheckRunsPage.CheckRunItem::name).toList());
        assertEquals("/repos/owner/repo/commits/abc/check-runs?per_page=100", server.takeRequest().getPath());
        assertEquals("/repos/owner/repo/commits/abc/check-runs?per_page=100&page=2", server.takeRequest().getPath());
    }

    @Test
    @DisplayName("getWorkflowRuns queries by head SHA")
    void getWorkflowRuns_byHeadSha() throws Exception {
        server.enqueue(json("{\"total_count\":1,\"workflow_runs\":[{\"id\":77,\"name\":\"ci\",\"status\":\"waiting\",\"pull_requests\":[]}]}"));

        var runs = client.getWorkflowRuns("owner/repo", "abc");

        assertEquals(1, runs.size());
        assertEquals(77L, runs.get(0).id());
        assertEquals("/repos/owner/repo/actions/runs?head_sha=abc&per_page=100", server.takeRequest().getPath());
    }

    // =========================================================================
    // Mutations
    // =========================================================================

    @Test
    @DisplayName("approveWorkflowRun POSTs to the approve endpoint")
    void approveWorkflowRun() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201));

        client.approveWorkflowRun("owner/repo", "77");

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/repos/owner/repo/actions/runs/77/approve", request.getPath());
    }

    @Test
    @DisplayName("createIssueComment POSTs the body as JSON")
    void createIssueComment() throws Exception {
        server.enqueue(json("{\"id\":1}").setResponseCode(201));

        client.createIssueComment("owner/repo", 12, "@copilot \"fix\" it");

        RecordedRequest request = server.takeRequest();
        assertEquals("/repos/owner/repo/issues/12/comments", request.getPath());
        assertEquals("{\"body\":\"@copilot \\\"fix\\\" it\"}", request.getBody().readUtf8());
    }

    // =========================================================================
    // Error classification
    // =========================================================================

    @Test
    @DisplayName("429 is a rate limit carrying the reset time")
    void status429_rateLimit() {
        long reset = Instant.now().plusSeconds(600).getEpochSecond();
        server.enqueue(new MockResponse().setResponseCode(429)
                .setHeader("X-RateLimit-Reset", String.valueOf(reset)));

        RateLimitException e = assertThrows(RateLimitException.class,
                () -> client.approveWorkflowRun("owner/repo", "1"));

        assertEquals(Instant.ofEpochSecond(reset), e.getResetAt());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    @DisplayName("403 with an exhausted budget is a rate limit, otherwise permission denied")
    void status403() {
        server.enqueue(new MockResponse().setResponseCode(403).setHeader("X-RateLimit-Remaining", "0"));
        server.enqueue(new MockResponse().setResponseCode(403).setBody("{\"message\":\"Resource not accessible\"}"));

        assertThrows(RateLimitException.class, () -> client.approveWorkflowRun("owner/repo", "1"));
        PermissionDeniedException denied = assertThrows(PermissionDeniedException.class,
                () -> client.approveWorkflowRun("owner/repo", "1"));
        assertEquals(403, denied.getStatusCode());
        assertTrue(denied.getMessage().contains("Resource not accessible"));
    }

    @Test
    @DisplayName("401, 404 and 500 map to permission, not found and transport errors")
    void otherStatuses() {
        server.enqueue(new MockResponse().setResponseCode(401));
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThrows(PermissionDeniedException.class, () -> client.approveWorkflowRun("owner/repo", "1"));
        assertThrows(NotFoundException.class, () -> client.approveWorkflowRun("owner/repo", "1"));
        GitHubApiException e = assertThrows(GitHubApiException.class, () -> client.approveWorkflowRun("owner/repo", "1"));
        assertEquals(500, e.getStatusCode());
        assertEquals(ErrorKind.TRANSPORT, ErrorKind.classify(e));
        assertEquals(3, server.getRequestCount());
    }

    // =========================================================================
    // Retry logic
    // =========================================================================

    @Test
    @DisplayName("503 on a read is retried and the call succeeds on a later attempt")
    void retry_succeedsAfter503() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503).setHeader("Retry-After", "0"));
        server.enqueue(json("{\"total_count\":0,\"check_runs\":[]}"));

        assertTrue(client.getCheckRuns("owner/repo", "abc").isEmpty());

        assertEquals(2, server.getRequestCount());
    }

    @Test
    @DisplayName("Read retries stop after the maximum attempts")
    void retry_exhausted() {
        for (int i = 0; i < 4; i++) {
            server.enqueue(new MockResponse().setResponseCode(502).setHeader("Retry-After", "0"));
        }

        GitHubApiException e = assertThrows(GitHubApiException.class,
                () -> client.getWorkflowRuns("owner/repo", "abc"));

        assertEquals(502, e.getStatusCode());
        assertEquals(4, server.getRequestCount());
    }

    @Test
    @DisplayName("A comment answered with 504 is sent once and reported as a transport error")
    void createIssueComment_notRetried() {
        server.enqueue(new MockResponse().setResponseCode(504).setHeader("Retry-After", "0"));
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{}"));

        GitHubApiException e = assertThrows(GitHubApiException.class,
                () -> client.createIssueComment("owner/repo", 7, "@copilot fix"));

        assertEquals(504, e.getStatusCode());
        assertEquals(ErrorKind.TRANSPORT, ErrorKind.classify(e));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    @DisplayName("An approval answered with 502 is sent once")
    void approveWorkflowRun_notRetried() {
        server.enqueue(new MockResponse().setResponseCode(502).setHeader("Retry-After", "0"));
        server.enqueue(new MockResponse().setResponseCode(201));

        GitHubApiException e = assertThrows(GitHubApiException.class,
                () -> client.approveWorkflowRun("owner/repo", "1"));

        assertEquals(502, e.getStatusCode());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    @DisplayName("Retry-After is honored up to the maximum backoff")
    void retryWait_capped() {
        assertEquals(4_000, client.getRetryWaitMs(response("5"), 500));
        assertEquals(2_000, client.getRetryWaitMs(response("2"), 500));
        assertEquals(500, client.getRetryWaitMs(response(null), 500));
        assertEquals(1_000, client.getRetryWaitMs(response("soon"), 1_000));
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static MockResponse json(String body) {
        return new MockResponse().setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }

    private static Response response(String retryAfter) {
        Response.Builder builder = new Response.Builder()
                .request(new Request.Builder().url("https://api.github.com/x").build())
                .protocol(Protocol.HTTP_1_1)
                .code(503)
                .message("Service Unavailable");
        if (retryAfter != null) {
            builder.header("Retry-After", retryAfter);
        }
        return builder.build();
    }

    static String pullRequestPage(boolean hasNext, String cursor, String... nodes) {
        return "{\"data\":{\"repository\":{\"pullRequests\":{"
                + "\"pageInfo\":{\"hasNextPage\":" + hasNext + ",\"endCursor\":"
                + (cursor == null ? "null" : "\"" + cursor + "\"") + "},"
                + "\"nodes\":[" + String.join(",", nodes) + "]}}}}";
    }

    static String node(int number, String headSha, String author) {
        return "{\"id\":\"PR_" + number + "\",\"number\":" + number + ",\"title\":\"PR " + number + "\","
                + "\"headRefOid\":" + (headSha == null ? "null" : "\"" + headSha + "\"") + ","
                + "\"author\":{\"login\":\"" + author + "\"},"
                + "\"createdAt\":\"2024-05-01T10:00:00Z\",\"updatedAt\":\"2024-05-02T10:00:00Z\",\"isDraft\":false}";
    }
}

package com.praier.monitor.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.praier.monitor.config.ServerConfig;
import com.praier.monitor.model.github.CheckRunsPage;
import com.praier.monitor.model.github.PullRequestQueryResponse;
import com.praier.monitor.model.github.PullRequestQueryResponse.PullRequestConnection;
import com.praier.monitor.model.github.PullRequestQueryResponse.PullRequestNode;
import com.praier.monitor.model.github.WorkflowRunsPage;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Client for one GitHub (or GitHub Enterprise) server: GraphQL for open pull
 * requests, REST for check runs, workflow runs and the two mutations.
 *
 * <p>Transient 502/503/504 responses are retried with exponential backoff inside
 * a call. Rate limiting is never waited out here: it surfaces as
 * {@link RateLimitException} so the poll loop can skip the repository until the
 * next cycle.</p>
 *
 * <p>Thread-safe: the underlying {@link OkHttpClient} and {@link ObjectMapper}
 * are both thread-safe, and this class holds no mutable per-request state.</p>
 */
public class GitHubApiClient {

    private static final Logger logger = LoggerFactory.getLogger(GitHubApiClient.class);

    static final String USER_AGENT = "praier/0.1.0";
    static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private static final int RATE_LIMIT_WARN_THRESHOLD = 100;
    private static final long INITIAL_BACKOFF_MS = 500;
    private static final long MAX_BACKOFF_MS = 4_000;
    private static final int MAX_RETRIES = 3; // 0.5s, 1s, 2s
    private static final int PER_PAGE = 100;
    private static final int MAX_ERROR_BODY = 200;

    static final Pattern LINK_NEXT_PATTERN =
            Pattern.compile("<([^>]+)>;\\s*rel=\"next\"");

    static final String OPEN_PULL_REQUESTS_QUERY = """
            query($owner: String!, $repo: String!, $first: Int!, $after: String) {
              repository(owner: $owner, name: $repo) {
                pullRequests(states: [OPEN], first: $first, after: $after,
                             orderBy: {field: UPDATED_AT, direction: DESC}) {
                  pageInfo { hasNextPage endCursor }
                  nodes {
                    id
                    number
                    title
                    url
                    headRefOid
                    baseRefName
                    headRefName
                    author { login }
                    createdAt
                    updatedAt
                    isDraft
                  }
                }
              }
            }""";

    private final ServerConfig server;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GitHubApiClient(ServerConfig server, Duration requestTimeout) {
        this(server, defaultHttpClient(requestTimeout));
    }

    public GitHubApiClient(ServerConfig server, OkHttpClient httpClient) {
        this.server = Objects.requireNonNull(server, "server");
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Every call, including the time spent reading the body, is bounded by {@code timeout}.
     */
    static OkHttpClient defaultHttpClient(Duration timeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout)
                .build();
    }

    public ServerConfig getServer() {
        return server;
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    /**
     * Fetches all open pull requests, most recently updated first.
     * Endpoint: POST /graphql, following {@code pageInfo.endCursor}.
     */
    public List<PullRequestNode> getOpenPullRequests(String repository) throws IOException, InterruptedException {
        String[] parts = splitRepository(repository);
        List<PullRequestNode> nodes = new ArrayList<>();
        String cursor = null;

        do {
            Map<String, Object> variables = new HashMap<>();
            variables.put("owner", parts[0]);
            variables.put("repo", parts[1]);
            variables.put("first", PER_PAGE);
            variables.put("after", cursor);

            PullRequestQueryResponse response = objectMapper.readValue(
                    graphql(OPEN_PULL_REQUESTS_QUERY, variables), PullRequestQueryResponse.class);
            if (response.hasErrors()) {
                throw graphQlFailure(response.errors());
            }
            if (response.data() == null || response.data().repository() == null) {
                throw new NotFoundException(404, "Repository " + repository + " not found on " + server.name());
            }

            PullRequestConnection connection = response.data().repository().pullRequests();
            if (connection == null || connection.nodes() == null) {
                break;
            }
            connection.nodes().stream().filter(Objects::nonNull).forEach(nodes::add);

            boolean hasNext = connection.pageInfo() != null && connection.pageInfo().hasNextPage();
            cursor = hasNext ? connection.pageInfo().endCursor() : null;
        } while (cursor != null);

        logger.debug("Fetched {} open pull requests for {} on {}", nodes.size(), repository, server.name());
        return nodes;
    }

    /**
     * Fetches the check runs reported against a commit.
     * Endpoint: GET /repos/{owner}/{repo}/commits/{sha}/check-runs?per_page=100
     */
    public List<CheckRunsPage.CheckRunItem> getCheckRuns(String repository, String headSha)
            throws IOException, InterruptedException {
        String url = server.apiUrl("/repos/" + repository + "/commits/" + headSha
                + "/check-runs?per_page=" + PER_PAGE);
        return fetchAllPages(url, CheckRunsPage.class, CheckRunsPage::checkRuns);
    }

    /**
     * Fetches the workflow runs triggered for a commit.
     * Endpoint: GET /repos/{owner}/{repo}/actions/runs?head_sha={sha}&per_page=100
     */
    public List<WorkflowRunsPage.WorkflowRunItem> getWorkflowRuns(String repository, String headSha)
            throws IOException, InterruptedException {
        String url = server.apiUrl("/repos/" + repository + "/actions/runs?head_sha=" + headSha
                + "&per_page=" + PER_PAGE);
        return fetchAllPages(url, WorkflowRunsPage.class, WorkflowRunsPage::workflowRuns);
    }

    // -------------------------------------------------------------------------
    // Mutations
    // -------------------------------------------------------------------------

    /**
     * Approves a workflow run that is waiting for maintainer approval.
     * Endpoint: POST /repos/{owner}/{repo}/actions/runs/{run_id}/approve
     */
    public void approveWorkflowRun(String repository, String runId) throws IOException, InterruptedException {
        String url = server.apiUrl("/repos/" + repository + "/actions/runs/" + runId + "/approve");
        executeOnce(buildRequest(url, RequestBody.create(new byte[0], JSON)));
        logger.info("Approved workflow run {} in {} on {}", runId, repository, server.name());
    }

    /**
     * Creates a comment on a pull request.
     * Endpoint: POST /repos/{owner}/{repo}/issues/{number}/comments
     */
    public void createIssueComment(String repository, int issueNumber, String body)
            throws IOException, InterruptedException {
        String url = server.apiUrl("/repos/" + repository + "/issues/" + issueNumber + "/comments");
        byte[] payload = objectMapper.writeValueAsBytes(Map.of("body", body));
        executeOnce(buildRequest(url, RequestBody.create(payload, JSON)));
        logger.info("Created comment on PR #{} in {} on {}", issueNumber, repository, server.name());
    }

    // -------------------------------------------------------------------------
    // Core HTTP execution with pagination, retries, and error classification
    // -------------------------------------------------------------------------

    String graphql(String query, Map<String, Object> variables) throws IOException, InterruptedException {
        Map<String, Object> payload = new HashMap<>();
        payload.put("query", query);
        payload.put("variables", variables);
        RequestBody body = RequestBody.create(objectMapper.writeValueAsBytes(payload), JSON);
        return executeWithRetry(buildRequest(server.graphqlUrl(), body)).body();
    }

    /**
     * Fetches every page of a paginated endpoint whose pages are JSON objects
     * wrapping the item list, concatenating the items.
     */
    <P, T> List<T> fetchAllPages(String initialUrl, Class<P> pageType, Function<P, List<T>> items)
            throws IOException, InterruptedException {
        List<T> allResults = new ArrayList<>();
        String url = initialUrl;

        while (url != null) {
            PageResult result = executeWithRetry(buildRequest(url, null));

            if (result.body() != null) {
                List<T> page = items.apply(objectMapper.readValue(result.body(), pageType));
                if (page != null) {
                    allResults.addAll(page);
                    logger.debug("Fetched page with {} items from {}", page.size(), url);
                }
            }

            url = result.nextUrl();
        }

        return allResults;
    }

    /**
     * Builds an authenticated request; a {@code null} body means GET, anything else POST.
     */
    Request buildRequest(String url, RequestBody body) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + server.token())
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28")
                .header("User-Agent", USER_AGENT);

        if (body != null) {
            builder.post(body);
        }

        return builder.build();
    }

    /**
     * Executes a read, retrying 502/503/504 with exponential backoff and mapping
     * error statuses onto the exception taxonomy.
     */
    PageResult executeWithRetry(Request request) throws IOException, InterruptedException {
        return execute(request, MAX_RETRIES);
    }

    /**
     * Executes a mutation exactly once. A gateway error may hide a request the server
     * already applied, so 502/503/504 surface as a {@link GitHubApiException} and the
     * next poll cycle decides whether the action is still needed.
     */
    PageResult executeOnce(Request request) throws IOException, InterruptedException {
        return execute(request, 0);
    }

    private PageResult execute(Request request, int maxRetries) throws IOException, InterruptedException {
        long backoffMs = INITIAL_BACKOFF_MS;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                int statusCode = response.code();
                logResponse(request, statusCode, response);

                if (statusCode == 502 || statusCode == 503 || statusCode == 504) {
                    if (maxRetries == 0) {
                        throw new GitHubApiException(statusCode, "GitHub API error: " + statusCode + " for "
                                + request.method() + " " + request.url() + " (not retried)");
                    }
                    if (attempt == maxRetries) {
                        throw new GitHubApiException(statusCode, "Max retries exceeded for "
                                + request.method() + " " + request.url() + " (last status: " + statusCode + ")");
                    }
                    long waitMs = getRetryWaitMs(response, backoffMs);
                    logger.warn("Received {} from {}. Retrying in {}ms (attempt {}/{})",
                            statusCode, request.url(), waitMs, attempt + 1, maxRetries);
                    Thread.sleep(waitMs);
                    backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
                    continue;
                }

                ResponseBody body = response.body();
                String bodyString = body != null ? body.string() : null;

                if (statusCode < 200 || statusCode >= 300) {
                    throw toException(request, response, bodyString);
                }

                warnIfRateLimitLow(response);
                return new PageResult(bodyString, parseNextPageUrl(response.header("Link")));
            }
        }

        throw new GitHubApiException(0, "Exhausted retries for " + request.url());
    }

    GitHubApiException toException(Request request, Response response, String body) {
        int statusCode = response.code();
        String message = "GitHub API error: " + statusCode + " for " + request.method() + " "
                + request.url() + describeBody(body);

        if (isRateLimited(response, body)) {
            return new RateLimitException(statusCode, message, getRateLimitReset(response));
        }
        if (statusCode == 401 || statusCode == 403) {
            return new PermissionDeniedException(statusCode, message);
        }
        if (statusCode == 404 || statusCode == 410) {
            return new NotFoundException(statusCode, message);
        }
        return new GitHubApiException(statusCode, message);
    }

    static boolean isRateLimited(Response response, String body) {
        if (response.code() == 429) {
            return true;
        }
        if (response.code() != 403) {
            return false;
        }
        return "0".equals(response.header("X-RateLimit-Remaining"))
                || (body != null && body.toLowerCase(Locale.ROOT).contains("rate limit"));
    }

    GitHubApiException graphQlFailure(List<PullRequestQueryResponse.GraphQlError> errors) {
        String messages = errors.stream()
                .map(e -> e.message() != null ? e.message() : String.valueOf(e.type()))
                .collect(Collectors.joining("; "));
        String type = errors.get(0).type() != null ? errors.get(0).type() : "";
        String message = "GraphQL query failed on " + server.name() + ": " + messages;

        if ("NOT_FOUND".equals(type)) {
            return new NotFoundException(404, message);
        }
        if ("RATE_LIMITED".equals(type)) {
            return new RateLimitException(200, message, null);
        }
        if ("FORBIDDEN".equals(type) || "INSUFFICIENT_SCOPES".equals(type)) {
            return new PermissionDeniedException(403, message);
        }
        return new GitHubApiException(200, message);
    }

    // -------------------------------------------------------------------------
    // Rate limit handling
    // -------------------------------------------------------------------------

    /**
     * Logs a warning when the remaining budget is low. Never blocks: a cycle that
     * exhausts the budget gets a {@link RateLimitException} on its next call.
     */
    void warnIfRateLimitLow(Response response) {
        String remainingHeader = response.header("X-RateLimit-Remaining");
        if (remainingHeader == null) {
            return;
        }
        try {
            int remaining = Integer.parseInt(remainingHeader);
            if (remaining < RATE_LIMIT_WARN_THRESHOLD) {
                logger.warn("Rate limit low on {} ({} remaining, resets at {})",
                        server.name(), remaining, getRateLimitReset(response));
            }
        } catch (NumberFormatException e) {
            logger.debug("Ignoring malformed X-RateLimit-Remaining header: {}", remainingHeader);
        }
    }

    /**
     * Reset time from {@code X-RateLimit-Reset} (epoch seconds) or {@code Retry-After}
     * (seconds from now), or {@code null} when neither is usable.
     */
    static Instant getRateLimitReset(Response response) {
        String resetHeader = response.header("X-RateLimit-Reset");
        if (resetHeader != null) {
            try {
                return Instant.ofEpochSecond(Long.parseLong(resetHeader));
            } catch (NumberFormatException ignored) {
                // fall through to Retry-After
            }
        }
        String retryAfter = response.header("Retry-After");
        if (retryAfter != null) {
            try {
                return Instant.now().plusSeconds(Long.parseLong(retryAfter));
            } catch (NumberFormatException ignored) {
                // no usable reset time
            }
        }
        return null;
    }

    /**
     * Determines wait time for retries. Uses Retry-After header if present,
     * otherwise falls back to exponential backoff.
     */
    long getRetryWaitMs(Response response, long backoffMs) {
        String retryAfter = response.header("Retry-After");
        if (retryAfter != null) {
            try {
                return Math.min(Long.parseLong(retryAfter) * 1_000, MAX_BACKOFF_MS);
            } catch (NumberFormatException ignored) {
                // fall through to backoff
            }
        }
        return backoffMs;
    }

    // -------------------------------------------------------------------------
    // Pagination parsing
    // -------------------------------------------------------------------------

    /**
     * Parses the "next" URL from the GitHub Link header.
     *
     * <p>Example header:
     * {@code <https://api.github.com/repositories/1/actions/runs?page=2>; rel="next", <...>; rel="last"}
     *
     * @return the next page URL, or {@code null} if there is no next page
     */
    static String parseNextPageUrl(String linkHeader) {
        if (linkHeader == null || linkHeader.isEmpty()) {
            return null;
        }
        Matcher matcher = LINK_NEXT_PATTERN.matcher(linkHeader);
        return matcher.find() ? matcher.group(1) : null;
    }

    static String[] splitRepository(String repository) {
        int slash = repository.indexOf('/');
        if (slash <= 0 || slash == repository.length() - 1) {
            throw new IllegalArgumentException("Repository must be owner/name: " + repository);
        }
        return new String[]{repository.substring(0, slash), repository.substring(slash + 1)};
    }

    // -------------------------------------------------------------------------
    // Logging
    // -------------------------------------------------------------------------

    private void logResponse(Request request, int statusCode, Response response) {
        String remaining = response.header("X-RateLimit-Remaining");
        logger.debug("GitHub API {} {} {} | rate-limit-remaining: {}",
                statusCode, request.method(), request.url(), remaining != null ? remaining : "n/a");
    }

    private static String describeBody(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return ": " + (trimmed.length() > MAX_ERROR_BODY ? trimmed.substring(0, MAX_ERROR_BODY) + "..." : trimmed);
    }

    // -------------------------------------------------------------------------
    // Internal result holder
    // -------------------------------------------------------------------------

    record PageResult(String body, String nextUrl) {}
}

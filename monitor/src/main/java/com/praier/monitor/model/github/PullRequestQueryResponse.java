package com.praier.monitor.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * GraphQL response envelope for the open pull request query.
 * Maps from: POST /graphql {@code repository { pullRequests(states: OPEN) { ... } }}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PullRequestQueryResponse(
        @JsonProperty("data") Data data,
        @JsonProperty("errors") List<GraphQlError> errors
) {

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(@JsonProperty("repository") Repository repository) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Repository(@JsonProperty("pullRequests") PullRequestConnection pullRequests) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PullRequestConnection(
            @JsonProperty("pageInfo") PageInfo pageInfo,
            @JsonProperty("nodes") List<PullRequestNode> nodes
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PageInfo(
            @JsonProperty("hasNextPage") boolean hasNextPage,
            @JsonProperty("endCursor") String endCursor
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PullRequestNode(
            @JsonProperty("id") String id,
            @JsonProperty("number") Integer number,
            @JsonProperty("title") String title,
            @JsonProperty("url") String url,
            @JsonProperty("headRefOid") String headRefOid,
            @JsonProperty("baseRefName") String baseRefName,
            @JsonProperty("headRefName") String headRefName,
            @JsonProperty("author") Author author,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("updatedAt") Instant updatedAt,
            @JsonProperty("isDraft") boolean draft
    ) {

        public String authorLogin() {
            return author != null && author.login() != null ? author.login() : "unknown";
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Author(@JsonProperty("login") String login) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GraphQlError(
            @JsonProperty("type") String type,
            @JsonProperty("message") String message
    ) {}
}

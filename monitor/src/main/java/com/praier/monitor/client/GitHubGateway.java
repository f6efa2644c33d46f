package com.praier.monitor.client;

import com.praier.monitor.config.ServerConfig;
import com.praier.monitor.model.CheckRun;
import com.praier.monitor.model.PullRequestRef;
import com.praier.monitor.model.PullRequestSnapshot;
import com.praier.monitor.model.RepositorySnapshot;
import com.praier.monitor.model.WorkflowRun;
import com.praier.monitor.model.github.CheckRunsPage.CheckRunItem;
import com.praier.monitor.model.github.PullRequestQueryResponse.PullRequestNode;
import com.praier.monitor.model.github.WorkflowRunsPage.WorkflowRunItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Routes fetches and mutations to a {@link GitHubApiClient} per configured server,
 * and turns loosely-typed API responses into validated {@link PullRequestSnapshot}s.
 * Malformed records are dropped here with a warning so nothing ambiguous reaches
 * change detection.
 */
public class GitHubGateway implements SnapshotFetcher, RemoteActions {

    private static final Logger logger = LoggerFactory.getLogger(GitHubGateway.class);

    private final Function<ServerConfig, GitHubApiClient> clientFactory;
    private final Map<String, GitHubApiClient> clients = new ConcurrentHashMap<>();

    public GitHubGateway(Duration requestTimeout) {
        this(server -> new GitHubApiClient(server, requestTimeout));
    }

    // Visible for testing
    GitHubGateway(Function<ServerConfig, GitHubApiClient> clientFactory) {
        this.clientFactory = clientFactory;
    }

    GitHubApiClient client(ServerConfig server) {
        return clients.computeIfAbsent(server.name(), name -> clientFactory.apply(server));
    }

    @Override
    public RepositorySnapshot fetchOpenPullRequests(ServerConfig server, String repository)
            throws IOException {
        GitHubApiClient client = client(server);
        try {
            List<PullRequestNode> nodes = client.getOpenPullRequests(repository);
            List<PullRequestSnapshot> snapshots = new ArrayList<>(nodes.size());
            List<PullRequestRef> unresolved = new ArrayList<>();
            for (PullRequestNode node : nodes) {
                if (node.number() == null || node.number() <= 0
                        || node.headRefOid() == null || node.headRefOid().isBlank()) {
                    logger.warn("Skipping malformed pull request node in {} on {}: number={}, head={}",
                            repository, server.name(), node.number(), node.headRefOid());
                    continue;
                }
                try {
                    snapshots.add(toSnapshot(client, server, repository, node));
                } catch (NotFoundException e) {
                    // The repository answered the listing, so only this pull request's head is gone
                    PullRequestRef ref = new PullRequestRef(server.name(), repository, node.number());
                    logger.warn("Checks or runs of {} at {} not found, skipping it this cycle: {}",
                            ref, node.headRefOid(), e.getMessage());
                    unresolved.add(ref);
                }
            }
            return new RepositorySnapshot(snapshots, unresolved);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while fetching " + repository);
        }
    }

    private PullRequestSnapshot toSnapshot(GitHubApiClient client, ServerConfig server,
                                           String repository, PullRequestNode node)
            throws IOException, InterruptedException {
        PullRequestRef ref = new PullRequestRef(server.name(), repository, node.number());
        String headSha = node.headRefOid();

        List<CheckRun> checkRuns = new ArrayList<>();
        for (CheckRunItem item : client.getCheckRuns(repository, headSha)) {
            if (item.name() == null || item.name().isBlank()) {
                logger.warn("Skipping check run {} without a name on {}", item.id(), ref);
                continue;
            }
            checkRuns.add(new CheckRun(item.name(), item.status(), item.conclusion()));
        }

        List<WorkflowRun> workflowRuns = new ArrayList<>();
        for (WorkflowRunItem item : client.getWorkflowRuns(repository, headSha)) {
            if (item.id() == null) {
                logger.warn("Skipping workflow run without an id on {}", ref);
                continue;
            }
            if (item.belongsTo(node.number())) {
                workflowRuns.add(new WorkflowRun(String.valueOf(item.id()), item.name(), item.status()));
            }
        }

        logger.debug("Snapshot {} '{}' by {}: {} checks, {} workflow runs",
                ref, node.title(), node.authorLogin(), checkRuns.size(), workflowRuns.size());
        return new PullRequestSnapshot(ref, node.title(), headSha, checkRuns, workflowRuns);
    }

    @Override
    public void approveWorkflowRun(ServerConfig server, String repository, String runId) throws IOException {
        try {
            client(server).approveWorkflowRun(repository, runId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while approving run " + runId);
        }
    }

    @Override
    public void postComment(ServerConfig server, String repository, int prNumber, String body) throws IOException {
        try {
            client(server).createIssueComment(repository, prNumber, body);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while commenting on #" + prNumber);
        }
    }
}

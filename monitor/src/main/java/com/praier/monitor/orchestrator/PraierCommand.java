package com.praier.monitor.orchestrator;

import com.praier.monitor.client.GitHubApiClient;
import com.praier.monitor.config.AppConfig;
import com.praier.monitor.config.ConfigException;
import com.praier.monitor.config.LogLevels;
import com.praier.monitor.config.MonitorSettings;
import com.praier.monitor.config.ServerConfig;
import com.praier.monitor.model.github.PullRequestQueryResponse.PullRequestNode;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Top-level command. Global options are read before the subcommand runs.
 */
@Command(
        name = "praier",
        version = "praier 0.1.0",
        description = "Automate pull request workflows with GitHub Actions and Copilot",
        mixinStandardHelpOptions = true,
        subcommands = {
                PraierCommand.MonitorCommand.class,
                PraierCommand.StatusCommand.class,
                PraierCommand.GenerateConfigCommand.class,
                PraierCommand.TestConnectionCommand.class
        }
)
public class PraierCommand implements Runnable {

    static final String SAMPLE_CONFIG = """
            # Praier configuration file
            # Copy this file and customize it for your needs

            github_servers:
              - name: "public"
                url: "https://api.github.com"
                token: "${GITHUB_TOKEN}"

              # Example for GitHub Enterprise Server
              # - name: "enterprise"
              #   url: "https://github.company.com/api/v3"
              #   token: "${GITHUB_ENTERPRISE_TOKEN}"

            monitoring:
              poll_interval: 60  # seconds
              max_concurrent_requests: 10
              repositories:
                - "owner/repo1"
                - "owner/repo2"
              auto_approve_actions: true
              auto_fix_with_copilot: true
              eviction_cycles: 1
              request_timeout: 30  # seconds

            log_level: "INFO"
            """;

    @Spec
    CommandSpec spec;

    @Option(names = {"-c", "--config"}, description = "Path to a YAML configuration file")
    Path configFile;

    @Option(names = {"-l", "--log-level"}, description = "Log level: DEBUG, INFO, WARNING, ERROR")
    String logLevel;

    private final Function<AppConfig, PollLoop> loopFactory;

    public PraierCommand() {
        this(PollLoop::create);
    }

    // Visible for testing
    PraierCommand(Function<AppConfig, PollLoop> loopFactory) {
        this.loopFactory = loopFactory;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    AppConfig loadConfig() {
        AppConfig config = AppConfig.load(configFile);
        if (logLevel != null) {
            config = config.withLogLevel(logLevel);
        }
        if (LogLevels.isSupported(config.getLogLevel())) {
            LogLevels.apply(config.getLogLevel());
        }
        return config;
    }

    // =========================================================================
    // monitor
    // =========================================================================

    @Command(name = "monitor", description = "Start monitoring pull requests")
    static class MonitorCommand implements Callable<Integer> {

        @ParentCommand
        PraierCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            AppConfig config;
            try {
                config = parent.loadConfig();
                config.validate();
            } catch (ConfigException e) {
                spec.commandLine().getErr().println("Error: " + e.getMessage());
                return 1;
            }

            MonitorSettings monitoring = config.getMonitoring();
            out.println("Starting Praier PR monitor...");
            out.println("Poll interval: " + monitoring.pollIntervalSeconds() + " seconds");
            out.println("Repositories: " + String.join(", ", monitoring.repositories()));
            out.println("Auto-approve actions: " + monitoring.autoApproveActions());
            out.println("Auto-fix with Copilot: " + monitoring.autoFixWithCopilot());
            out.flush();

            PollLoop loop = parent.loopFactory.apply(config);
            CountDownLatch finished = new CountDownLatch(1);
            Thread shutdownHook = new Thread(() -> {
                loop.stop();
                try {
                    finished.await(monitoring.requestTimeoutSeconds(), TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "praier-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);

            try {
                loop.run();
            } finally {
                finished.countDown();
            }
            out.println("Shutting down gracefully...");
            return 0;
        }
    }

    // =========================================================================
    // status
    // =========================================================================

    @Command(name = "status", description = "Show the effective configuration")
    static class StatusCommand implements Callable<Integer> {

        @ParentCommand
        PraierCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            AppConfig config;
            try {
                config = parent.loadConfig();
            } catch (ConfigException e) {
                spec.commandLine().getErr().println("Error: " + e.getMessage());
                return 1;
            }

            PrintWriter out = spec.commandLine().getOut();
            out.println("Praier Configuration Status");
            out.println("=".repeat(30));

            List<ServerConfig> servers = config.getServers();
            out.println("GitHub Servers: " + servers.size());
            for (int i = 0; i < servers.size(); i++) {
                ServerConfig server = servers.get(i);
                out.printf("  %d. %s (%s) - Token: %s%n",
                        i + 1, server.name(), server.url(), server.hasToken() ? "✓" : "✗");
            }

            MonitorSettings monitoring = config.getMonitoring();
            out.println();
            out.println("Monitoring Configuration:");
            out.println("  Poll interval: " + monitoring.pollIntervalSeconds() + "s");
            out.println("  Max concurrent requests: " + monitoring.maxConcurrentRequests());
            out.println("  Auto-approve actions: " + monitoring.autoApproveActions());
            out.println("  Auto-fix with Copilot: " + monitoring.autoFixWithCopilot());
            out.println("  Eviction cycles: " + monitoring.evictionCycles());
            out.println("  Request timeout: " + monitoring.requestTimeoutSeconds() + "s");

            out.println();
            if (monitoring.repositories().isEmpty()) {
                out.println("Repositories: None configured");
            } else {
                out.println("Repositories (" + monitoring.repositories().size() + "):");
                monitoring.repositories().forEach(repo -> out.println("  - " + repo));
            }

            out.println();
            out.println("Log level: " + config.getLogLevel());
            out.flush();
            return 0;
        }
    }

    // =========================================================================
    // generate-config
    // =========================================================================

    @Command(name = "generate-config", description = "Print or write a sample configuration file")
    static class GenerateConfigCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Option(names = {"-o", "--output"}, description = "Output file path")
        Path output;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            if (output == null) {
                out.print(SAMPLE_CONFIG);
                out.flush();
                return 0;
            }
            try {
                Files.writeString(output, SAMPLE_CONFIG, StandardCharsets.UTF_8);
            } catch (IOException e) {
                spec.commandLine().getErr().println("Error: cannot write " + output + ": " + e.getMessage());
                return 1;
            }
            out.println("Sample configuration written to " + output);
            out.flush();
            return 0;
        }
    }

    // =========================================================================
    // test-connection
    // =========================================================================

    @Command(name = "test-connection", description = "Check access to a repository and list its open pull requests")
    static class TestConnectionCommand implements Callable<Integer> {

        static final int SHOWN_PULL_REQUESTS = 5;

        @ParentCommand
        PraierCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "REPOSITORY", description = "Repository as owner/name")
        String repository;

        @Option(names = {"-s", "--server"}, defaultValue = ServerConfig.DEFAULT_NAME,
                description = "GitHub server name (default: ${DEFAULT-VALUE})")
        String serverName;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();

            AppConfig config;
            try {
                config = parent.loadConfig();
            } catch (ConfigException e) {
                err.println("Error: " + e.getMessage());
                return 1;
            }

            ServerConfig server = config.server(serverName).orElse(null);
            if (server == null) {
                err.println("Error: Server '" + serverName + "' not found in configuration");
                return 1;
            }
            if (!server.hasToken()) {
                err.println("Error: No token configured for server '" + serverName + "'");
                return 1;
            }

            out.println("Testing connection to " + server.url() + "...");
            out.flush();
            List<PullRequestNode> pullRequests;
            try {
                GitHubApiClient client = new GitHubApiClient(server, config.getMonitoring().requestTimeout());
                pullRequests = client.getOpenPullRequests(repository);
            } catch (IOException e) {
                err.println("✗ Connection failed: " + e.getMessage());
                return 1;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                err.println("✗ Connection interrupted");
                return 1;
            }

            out.println("✓ Successfully connected to " + server.name());
            out.println("Found " + pullRequests.size() + " open pull requests in " + repository + ":");
            pullRequests.stream().limit(SHOWN_PULL_REQUESTS).forEach(pr ->
                    out.println("  #" + pr.number() + ": " + pr.title() + " (" + pr.authorLogin() + ")"));
            if (pullRequests.size() > SHOWN_PULL_REQUESTS) {
                out.println("  ... and " + (pullRequests.size() - SHOWN_PULL_REQUESTS) + " more");
            }
            out.flush();
            return 0;
        }
    }
}

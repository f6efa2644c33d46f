package com.praier.monitor.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    // =========================================================================
    // Environment variables
    // =========================================================================

    @Test
    @DisplayName("Defaults apply when only a token and repositories are set")
    void fromVariables_defaults() {
        AppConfig config = AppConfig.fromVariables(vars(Map.of(
                "GITHUB_TOKEN", "ghp_test",
                "PRAIER_REPOSITORIES", "owner/repo1, owner/repo2")));

        config.validate();

        ServerConfig server = config.getServers().get(0);
        assertEquals("default", server.name());
        assertEquals("https://api.github.com", server.url());
        MonitorSettings monitoring = config.getMonitoring();
        assertEquals(60, monitoring.pollIntervalSeconds());
        assertEquals(10, monitoring.maxConcurrentRequests());
        assertEquals(1, monitoring.evictionCycles());
        assertEquals(30, monitoring.requestTimeoutSeconds());
        assertTrue(monitoring.autoApproveActions());
        assertTrue(monitoring.autoFixWithCopilot());
        assertEquals(List.of("owner/repo1", "owner/repo2"), monitoring.repositories());
        assertEquals("INFO", config.getLogLevel());
    }

    @Test
    @DisplayName("Additional servers are read from numbered variables")
    void fromVariables_multipleServers() {
        Map<String, String> env = new HashMap<>();
        env.put("GITHUB_TOKEN", "public-token");
        env.put("GITHUB_NAME", "public");
        env.put("PRAIER_SERVER_COUNT", "2");
        env.put("GITHUB_1_GITHUB_NAME", "enterprise");
        env.put("GITHUB_1_GITHUB_URL", "https://github.example.com/api/v3/");
        env.put("GITHUB_1_GITHUB_TOKEN", "ent-token");
        env.put("PRAIER_REPOSITORIES", "owner/shared,enterprise:team/internal");
        env.put("PRAIER_AUTO_FIX", "false");
        env.put("PRAIER_EVICTION_CYCLES", "3");

        AppConfig config = AppConfig.fromVariables(vars(env));
        config.validate();

        assertEquals(2, config.activeServers().size());
        assertEquals("https://github.example.com/api/v3", config.server("enterprise").orElseThrow().url());
        assertFalse(config.getMonitoring().autoFixWithCopilot());
        assertEquals(3, config.getMonitoring().evictionCycles());
        assertEquals(List.of(
                new RepositoryTarget("public", "owner/shared"),
                new RepositoryTarget("enterprise", "owner/shared"),
                new RepositoryTarget("enterprise", "team/internal")), config.targets());
    }

    @Test
    @DisplayName("Repository entries differing only in case become one target per server")
    void targets_caseInsensitive() {
        AppConfig config = new AppConfig(List.of(new ServerConfig("public", null, "t")),
                MonitorSettings.defaults().withRepositories(List.of("Owner/Repo", "owner/repo", "public:OWNER/REPO")),
                "INFO");

        config.validate();

        assertEquals(List.of(new RepositoryTarget("public", "Owner/Repo")), config.targets());
    }

    @Test
    @DisplayName("Non-numeric values are configuration errors")
    void fromVariables_badInteger() {
        ConfigException e = assertThrows(ConfigException.class, () -> AppConfig.fromVariables(vars(Map.of(
                "GITHUB_TOKEN", "t", "PRAIER_POLL_INTERVAL", "soon"))));

        assertTrue(e.getMessage().contains("PRAIER_POLL_INTERVAL"));
    }

    // =========================================================================
    // Validation
    // =========================================================================

    @Test
    @DisplayName("Validation reports every problem at once")
    void validate_collectsProblems() {
        AppConfig config = new AppConfig(List.of(new ServerConfig("default", "ftp://nowhere", "")),
                new MonitorSettings(0, 0, List.of("not-a-repo"), true, true, 0, 0), "LOUD");

        ConfigException e = assertThrows(ConfigException.class, config::validate);

        String message = e.getMessage();
        assertTrue(message.startsWith("Invalid configuration: "));
        assertTrue(message.contains("invalid URL"));
        assertTrue(message.contains("no GitHub tokens configured"));
        assertTrue(message.contains("invalid repository 'not-a-repo'"));
        assertTrue(message.contains("poll interval must be > 0 seconds"));
        assertTrue(message.contains("max concurrent requests must be >= 1"));
        assertTrue(message.contains("eviction cycles must be >= 1"));
        assertTrue(message.contains("request timeout must be > 0 seconds"));
        assertTrue(message.contains("unsupported log level 'LOUD'"));
    }

    @Test
    @DisplayName("Missing repositories are rejected")
    void validate_noRepositories() {
        AppConfig config = AppConfig.fromVariables(vars(Map.of("GITHUB_TOKEN", "t")));

        ConfigException e = assertThrows(ConfigException.class, config::validate);
        assertTrue(e.getMessage().contains("no repositories configured"));
    }

    @Test
    @DisplayName("A repository bound to an unknown server is rejected")
    void validate_unknownServer() {
        AppConfig config = AppConfig.fromVariables(vars(Map.of(
                "GITHUB_TOKEN", "t", "PRAIER_REPOSITORIES", "ghes:owner/repo")));

        ConfigException e = assertThrows(ConfigException.class, config::validate);
        assertTrue(e.getMessage().contains("unknown or tokenless server 'ghes'"));
    }

    @Test
    @DisplayName("Duplicate server names are rejected")
    void validate_duplicateServers() {
        AppConfig config = new AppConfig(List.of(
                new ServerConfig("a", null, "t1"), new ServerConfig("a", null, "t2")),
                MonitorSettings.defaults().withRepositories(List.of("owner/repo")), null);

        ConfigException e = assertThrows(ConfigException.class, config::validate);
        assertTrue(e.getMessage().contains("duplicate server name 'a'"));
    }

    @Test
    @DisplayName("Servers without a token are kept in the list but not polled")
    void tokenlessServer_notActive() {
        AppConfig config = new AppConfig(List.of(
                new ServerConfig("public", null, "t"), new ServerConfig("ghes", "https://ghes.local/api/v3", "")),
                MonitorSettings.defaults().withRepositories(List.of("owner/repo")), "warning");

        config.validate();

        assertEquals(2, config.getServers().size());
        assertEquals(List.of(new RepositoryTarget("public", "owner/repo")), config.targets());
        assertEquals("WARNING", config.getLogLevel());
    }

    // =========================================================================
    // YAML file
    // =========================================================================

    @Test
    @DisplayName("YAML file is read with placeholders expanded")
    void fromFile_expandsPlaceholders(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("praier.yaml");
        Files.writeString(file, """
                github_servers:
                  - name: "public"
                    url: "https://api.github.com"
                    token: "${TEST_TOKEN}"
                  - name: "enterprise"
                    url: "https://github.example.com/api/v3"
                    token: "${MISSING_TOKEN}"
                monitoring:
                  poll_interval: 15
                  repositories:
                    - "owner/repo1"
                  auto_approve_actions: false
                  eviction_cycles: 2
                  unknown_key: ignored
                log_level: "debug"
                """);

        AppConfig config = AppConfig.fromFile(file, vars(Map.of("TEST_TOKEN", "secret")));
        config.validate();

        assertEquals("secret", config.server("public").orElseThrow().token());
        assertFalse(config.server("enterprise").orElseThrow().hasToken());
        assertEquals(15, config.getMonitoring().pollIntervalSeconds());
        assertEquals(10, config.getMonitoring().maxConcurrentRequests());
        assertFalse(config.getMonitoring().autoApproveActions());
        assertTrue(config.getMonitoring().autoFixWithCopilot());
        assertEquals(2, config.getMonitoring().evictionCycles());
        assertEquals("DEBUG", config.getLogLevel());
    }

    @Test
    @DisplayName("A missing configuration file is a configuration error")
    void fromFile_missing(@TempDir Path dir) {
        assertThrows(ConfigException.class, () -> AppConfig.fromFile(dir.resolve("nope.yaml"), vars(Map.of())));
    }

    @Test
    @DisplayName("expand substitutes known names and blanks unknown ones")
    void expand() {
        assertEquals("a-x-", AppConfig.expand("a-${X}-${Y}", vars(Map.of("X", "x"))));
        assertEquals("plain", AppConfig.expand("plain", vars(Map.of())));
    }

    private static Function<String, String> vars(Map<String, String> values) {
        return values::get;
    }
}

package com.praier.monitor.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolved monitor configuration. Values come from environment variables and a
 * {@code .env} file (dotenv-java), or from a YAML file whose string values may
 * reference variables as {@code ${NAME}}.
 *
 * <p>Loading only fails on values that cannot be parsed; semantic checks happen in
 * {@link #validate()}, which the {@code monitor} command runs before polling starts.</p>
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final String DEFAULT_LOG_LEVEL = "INFO";
    static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private final List<ServerConfig> servers;
    private final MonitorSettings monitoring;
    private final String logLevel;

    public AppConfig(List<ServerConfig> servers, MonitorSettings monitoring, String logLevel) {
        this.servers = servers == null ? List.of() : List.copyOf(servers);
        this.monitoring = monitoring == null ? MonitorSettings.defaults() : monitoring;
        this.logLevel = logLevel == null || logLevel.isBlank()
                ? DEFAULT_LOG_LEVEL : logLevel.trim().toUpperCase(Locale.ROOT);
    }

    // -------------------------------------------------------------------------
    // Loading
    // -------------------------------------------------------------------------

    /**
     * Loads from {@code configFile} when given, otherwise from the environment.
     */
    public static AppConfig load(Path configFile) {
        Function<String, String> lookup = environmentLookup();
        return configFile != null ? fromFile(configFile, lookup) : fromVariables(lookup);
    }

    static Function<String, String> environmentLookup() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        return key -> resolve(dotenv, key);
    }

    private static String resolve(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        return dotenv.get(key);
    }

    /**
     * Builds the configuration from variables such as {@code GITHUB_TOKEN} and
     * {@code PRAIER_REPOSITORIES}. Extra servers are read from
     * {@code GITHUB_1_GITHUB_URL}, {@code GITHUB_1_GITHUB_TOKEN}, ... up to
     * {@code PRAIER_SERVER_COUNT - 1}.
     */
    static AppConfig fromVariables(Function<String, String> lookup) {
        List<ServerConfig> servers = new ArrayList<>();
        servers.add(serverFromVariables(lookup, ""));

        int serverCount = parseInt(lookup, "PRAIER_SERVER_COUNT", 1);
        for (int i = 1; i < serverCount; i++) {
            servers.add(serverFromVariables(lookup, "GITHUB_" + i + "_"));
        }

        String repositories = lookup.apply("PRAIER_REPOSITORIES");
        MonitorSettings monitoring = new MonitorSettings(
                parseInt(lookup, "PRAIER_POLL_INTERVAL", MonitorSettings.DEFAULT_POLL_INTERVAL),
                parseInt(lookup, "PRAIER_MAX_CONCURRENT", MonitorSettings.DEFAULT_MAX_CONCURRENT),
                repositories == null || repositories.isBlank()
                        ? List.of() : Arrays.asList(repositories.split(",")),
                parseBoolean(lookup, "PRAIER_AUTO_APPROVE"),
                parseBoolean(lookup, "PRAIER_AUTO_FIX"),
                parseInt(lookup, "PRAIER_EVICTION_CYCLES", MonitorSettings.DEFAULT_EVICTION_CYCLES),
                parseInt(lookup, "PRAIER_REQUEST_TIMEOUT", MonitorSettings.DEFAULT_REQUEST_TIMEOUT));

        return new AppConfig(servers, monitoring, lookup.apply("PRAIER_LOG_LEVEL"));
    }

    private static ServerConfig serverFromVariables(Function<String, String> lookup, String prefix) {
        return new ServerConfig(
                lookup.apply(prefix + "GITHUB_NAME"),
                lookup.apply(prefix + "GITHUB_URL"),
                lookup.apply(prefix + "GITHUB_TOKEN"));
    }

    /**
     * Reads a YAML configuration file, expanding {@code ${NAME}} placeholders in
     * string values through {@code lookup}. Unresolved placeholders become empty.
     */
    static AppConfig fromFile(Path path, Function<String, String> lookup) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Configuration file not found: " + path);
        }

        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        ConfigFile file;
        try {
            JsonNode tree = yamlMapper.readTree(path.toFile());
            if (tree == null || tree.isMissingNode() || tree.isNull()) {
                throw new ConfigException("Configuration file is empty: " + path);
            }
            file = yamlMapper.treeToValue(expandPlaceholders(tree, lookup), ConfigFile.class);
        } catch (IOException e) {
            throw new ConfigException("Failed to read configuration file " + path + ": " + e.getMessage(), e);
        }

        List<ServerConfig> servers = new ArrayList<>();
        if (file.githubServers() != null) {
            for (ConfigFile.Server server : file.githubServers()) {
                servers.add(new ServerConfig(server.name(), server.url(), server.token()));
            }
        }

        MonitorSettings monitoring = MonitorSettings.defaults();
        ConfigFile.Monitoring m = file.monitoring();
        if (m != null) {
            monitoring = new MonitorSettings(
                    orDefault(m.pollInterval(), MonitorSettings.DEFAULT_POLL_INTERVAL),
                    orDefault(m.maxConcurrentRequests(), MonitorSettings.DEFAULT_MAX_CONCURRENT),
                    m.repositories(),
                    m.autoApproveActions() == null || m.autoApproveActions(),
                    m.autoFixWithCopilot() == null || m.autoFixWithCopilot(),
                    orDefault(m.evictionCycles(), MonitorSettings.DEFAULT_EVICTION_CYCLES),
                    orDefault(m.requestTimeout(), MonitorSettings.DEFAULT_REQUEST_TIMEOUT));
        }

        logger.debug("Loaded configuration file {} ({} servers)", path, servers.size());
        return new AppConfig(servers, monitoring, file.logLevel());
    }

    static JsonNode expandPlaceholders(JsonNode node, Function<String, String> lookup) {
        if (node.isTextual()) {
            return TextNode.valueOf(expand(node.textValue(), lookup));
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                field.setValue(expandPlaceholders(field.getValue(), lookup));
            }
        } else if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                array.set(i, expandPlaceholders(array.get(i), lookup));
            }
        }
        return node;
    }

    static String expand(String value, Function<String, String> lookup) {
        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = lookup.apply(matcher.group(1));
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement != null ? replacement : ""));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static int parseInt(Function<String, String> lookup, String key, int defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException(key + " must be an integer but was '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(Function<String, String> lookup, String key) {
        String value = lookup.apply(key);
        return value == null || value.isBlank() || "true".equalsIgnoreCase(value.trim());
    }

    private static int orDefault(Integer value, int defaultValue) {
        return value != null ? value : defaultValue;
    }

    // -------------------------------------------------------------------------
    // Validation
    // -------------------------------------------------------------------------

    /**
     * Checks every setting and reports all problems at once.
     *
     * @throws ConfigException if anything is invalid
     */
    public void validate() {
        List<String> problems = new ArrayList<>();

        Set<String> names = new HashSet<>();
        for (ServerConfig server : servers) {
            if (!names.add(server.name())) {
                problems.add("duplicate server name '" + server.name() + "'");
            }
            if (!server.hasValidUrl()) {
                problems.add("server '" + server.name() + "' has an invalid URL: " + server.url());
            }
        }
        if (activeServers().isEmpty()) {
            problems.add("no GitHub tokens configured (set GITHUB_TOKEN or github_servers[].token)");
        }

        if (monitoring.repositories().isEmpty()) {
            problems.add("no repositories configured (set PRAIER_REPOSITORIES, e.g. owner/repo1,owner/repo2)");
        }
        for (String entry : monitoring.repositories()) {
            String serverName = serverPart(entry);
            if (!RepositoryTarget.isValidRepository(repositoryPart(entry))) {
                problems.add("invalid repository '" + entry + "' (expected owner/name or server:owner/name)");
            } else if (serverName != null && server(serverName).filter(ServerConfig::hasToken).isEmpty()) {
                problems.add("repository '" + entry + "' refers to unknown or tokenless server '" + serverName + "'");
            }
        }

        if (monitoring.pollIntervalSeconds() <= 0) {
            problems.add("poll interval must be > 0 seconds");
        }
        if (monitoring.maxConcurrentRequests() < 1) {
            problems.add("max concurrent requests must be >= 1");
        }
        if (monitoring.evictionCycles() < 1) {
            problems.add("eviction cycles must be >= 1");
        }
        if (monitoring.requestTimeoutSeconds() <= 0) {
            problems.add("request timeout must be > 0 seconds");
        }
        if (!LogLevels.isSupported(logLevel)) {
            problems.add("unsupported log level '" + logLevel + "'");
        }

        if (!problems.isEmpty()) {
            throw new ConfigException("Invalid configuration: " + String.join("; ", problems));
        }

        servers.stream()
                .filter(s -> !s.hasToken())
                .forEach(s -> logger.warn("No token provided for GitHub server '{}', skipping", s.name()));
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public List<ServerConfig> getServers() {
        return servers;
    }

    /** Servers that have a token and will be polled. */
    public List<ServerConfig> activeServers() {
        return servers.stream().filter(ServerConfig::hasToken).toList();
    }

    public Optional<ServerConfig> server(String name) {
        return servers.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    /**
     * Expands the repository entries into concrete targets in configuration order.
     * Plain {@code owner/name} entries fan out to every active server. GitHub names are
     * case-insensitive, so entries differing only in case collapse into the first spelling.
     */
    public List<RepositoryTarget> targets() {
        Map<String, RepositoryTarget> targets = new LinkedHashMap<>();
        for (String entry : monitoring.repositories()) {
            String repository = repositoryPart(entry);
            if (!RepositoryTarget.isValidRepository(repository)) {
                continue;
            }
            String serverName = serverPart(entry);
            if (serverName != null) {
                server(serverName).filter(ServerConfig::hasToken)
                        .ifPresent(s -> addTarget(targets, new RepositoryTarget(s.name(), repository)));
            } else {
                for (ServerConfig server : activeServers()) {
                    addTarget(targets, new RepositoryTarget(server.name(), repository));
                }
            }
        }
        return List.copyOf(targets.values());
    }

    private static void addTarget(Map<String, RepositoryTarget> targets, RepositoryTarget target) {
        targets.putIfAbsent(target.server() + ":" + target.repository().toLowerCase(Locale.ROOT), target);
    }

    private static String serverPart(String entry) {
        int colon = entry.indexOf(':');
        return colon > 0 ? entry.substring(0, colon).trim() : null;
    }

    private static String repositoryPart(String entry) {
        int colon = entry.indexOf(':');
        return colon >= 0 ? entry.substring(colon + 1).trim() : entry.trim();
    }

    public MonitorSettings getMonitoring() {
        return monitoring;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public AppConfig withLogLevel(String level) {
        return new AppConfig(servers, monitoring, level);
    }
}

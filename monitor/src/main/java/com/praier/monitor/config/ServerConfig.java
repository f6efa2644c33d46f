package com.praier.monitor.config;

import java.net.URI;

/**
 * Connection settings for one GitHub-compatible server. Immutable after load.
 */
public record ServerConfig(String name, String url, String token) {

    public static final String DEFAULT_URL = "https://api.github.com";
    public static final String DEFAULT_NAME = "default";

    private static final String ENTERPRISE_REST_SUFFIX = "/api/v3";

    public ServerConfig {
        name = name == null || name.isBlank() ? DEFAULT_NAME : name.trim();
        url = stripTrailingSlash(url == null || url.isBlank() ? DEFAULT_URL : url.trim());
        token = token == null ? "" : token.trim();
    }

    public boolean hasToken() {
        return !token.isEmpty();
    }

    /** REST endpoint for {@code path}, which must start with a slash. */
    public String apiUrl(String path) {
        return url + path;
    }

    /**
     * GraphQL endpoint. GitHub Enterprise Server serves REST under {@code /api/v3}
     * and GraphQL under {@code /api/graphql}.
     */
    public String graphqlUrl() {
        if (url.endsWith(ENTERPRISE_REST_SUFFIX)) {
            return url.substring(0, url.length() - ENTERPRISE_REST_SUFFIX.length()) + "/api/graphql";
        }
        return url + "/graphql";
    }

    boolean hasValidUrl() {
        try {
            URI uri = URI.create(url);
            return ("https".equals(uri.getScheme()) || "http".equals(uri.getScheme()))
                    && uri.getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    @Override
    public String toString() {
        return "ServerConfig[name=" + name + ", url=" + url + ", token=" + (hasToken() ? "****" : "<none>") + "]";
    }
}

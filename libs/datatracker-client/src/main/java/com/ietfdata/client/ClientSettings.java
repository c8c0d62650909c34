package com.ietfdata.client;

import java.net.URI;
import java.time.Duration;

/**
 * Connection and paging settings for a {@link Datatracker} client.
 *
 * <p>Null components fall back to the defaults, so {@code new ClientSettings(null, null, 0, 0, null, null)}
 * is the same as {@link #defaults()}.
 *
 * @param baseUrl        scheme and host of the service, without a trailing slash
 * @param requestTimeout timeout for a single page or document fetch
 * @param pageSize       {@code limit} sent with the first request of every list walk
 * @param maxPages       upper bound on pages fetched by one list walk
 * @param userAgent      value of the {@code User-Agent} header
 * @param apiKey         optional API key sent as the {@code apikey} query parameter (nullable)
 */
public record ClientSettings(
        String baseUrl,
        Duration requestTimeout,
        int pageSize,
        int maxPages,
        String userAgent,
        String apiKey
) {

    public static final String DEFAULT_BASE_URL = "https://datatracker.ietf.org";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final int DEFAULT_MAX_PAGES = 10_000;
    public static final String DEFAULT_USER_AGENT = "ietfdata-java/0.1";

    /** The service caps {@code limit} at this value. */
    public static final int MAX_PAGE_SIZE = 1000;

    public ClientSettings {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : stripTrailingSlash(baseUrl.strip());
        URI parsed = URI.create(baseUrl);
        if (!"https".equals(parsed.getScheme()) && !"http".equals(parsed.getScheme())) {
            throw new IllegalArgumentException("baseUrl must be an http(s) URL: " + baseUrl);
        }
        if (parsed.getRawPath() != null && !parsed.getRawPath().isEmpty()) {
            throw new IllegalArgumentException("baseUrl must not carry a path: " + baseUrl);
        }

        requestTimeout = requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }

        pageSize = pageSize == 0 ? DEFAULT_PAGE_SIZE : pageSize;
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }

        maxPages = maxPages == 0 ? DEFAULT_MAX_PAGES : maxPages;
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be positive");
        }

        userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
        apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey;
    }

    public static ClientSettings defaults() {
        return new ClientSettings(null, null, 0, 0, null, null);
    }

    public ClientSettings withBaseUrl(String baseUrl) {
        return new ClientSettings(baseUrl, requestTimeout, pageSize, maxPages, userAgent, apiKey);
    }

    public ClientSettings withPageSize(int pageSize) {
        return new ClientSettings(baseUrl, requestTimeout, pageSize, maxPages, userAgent, apiKey);
    }

    public ClientSettings withMaxPages(int maxPages) {
        return new ClientSettings(baseUrl, requestTimeout, pageSize, maxPages, userAgent, apiKey);
    }

    public ClientSettings withApiKey(String apiKey) {
        return new ClientSettings(baseUrl, requestTimeout, pageSize, maxPages, userAgent, apiKey);
    }

    @Override
    public String toString() {
        return "ClientSettings[baseUrl=%s, requestTimeout=%s, pageSize=%d, maxPages=%d, userAgent=%s, apiKey=%s]"
                .formatted(baseUrl, requestTimeout, pageSize, maxPages, userAgent, apiKey == null ? "none" : "****");
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}

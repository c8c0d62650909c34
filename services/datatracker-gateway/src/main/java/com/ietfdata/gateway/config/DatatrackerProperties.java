package com.ietfdata.gateway.config;

import com.ietfdata.client.ClientSettings;
import com.ietfdata.observability.SensitiveDataRedactor;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Client configuration bound from {@code ietfdata.datatracker.*}.
 *
 * <pre>
 * ietfdata:
 *   datatracker:
 *     base-url: https://datatracker.ietf.org
 *     request-timeout: 30s
 *     page-size: 100
 *     max-pages: 10000
 *     api-key: ${DATATRACKER_API_KEY:}
 *     max-list-results: 50
 * </pre>
 *
 * @param baseUrl        scheme and host of the Datatracker instance
 * @param requestTimeout timeout for each fetch
 * @param pageSize       {@code limit} of the first page of a list walk
 * @param maxPages       page bound of a single list walk
 * @param userAgent      {@code User-Agent} sent to the service
 * @param apiKey         optional API key
 * @param maxListResults cap on the elements a list endpoint returns
 */
@ConfigurationProperties(prefix = "ietfdata.datatracker")
@Validated
public record DatatrackerProperties(
        @NotBlank String baseUrl,
        Duration requestTimeout,
        @Min(1) @Max(ClientSettings.MAX_PAGE_SIZE) int pageSize,
        @Min(1) int maxPages,
        String userAgent,
        String apiKey,
        @Min(1) @Max(1000) int maxListResults) {

    /** Defaults are applied here so that Bean Validation sees the effective values. */
    public DatatrackerProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = ClientSettings.DEFAULT_BASE_URL;
        }
        if (requestTimeout == null) {
            requestTimeout = ClientSettings.DEFAULT_REQUEST_TIMEOUT;
        }
        if (pageSize == 0) {
            pageSize = ClientSettings.DEFAULT_PAGE_SIZE;
        }
        if (maxPages == 0) {
            maxPages = ClientSettings.DEFAULT_MAX_PAGES;
        }
        if (userAgent == null || userAgent.isBlank()) {
            userAgent = "ietfdata-gateway/0.1";
        }
        if (maxListResults == 0) {
            maxListResults = 50;
        }
    }

    /**
     * The bound values keyed by property name, with credentials replaced by
     * {@link SensitiveDataRedactor#REDACTED}, for startup logging.
     */
    public Map<String, Object> redacted() {
        SensitiveDataRedactor redactor = new SensitiveDataRedactor();
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("base-url", redactor.redactUrl(baseUrl));
        values.put("request-timeout", requestTimeout);
        values.put("page-size", pageSize);
        values.put("max-pages", maxPages);
        values.put("user-agent", userAgent);
        values.put("api-key", apiKey == null || apiKey.isBlank() ? null : apiKey);
        values.put("max-list-results", maxListResults);
        return redactor.redact(values);
    }

    public ClientSettings toClientSettings() {
        return new ClientSettings(baseUrl, requestTimeout, pageSize, maxPages, userAgent, apiKey);
    }
}

package com.ietfdata.client.transport;

import com.ietfdata.client.ClientSettings;
import com.ietfdata.model.error.DecodeException;
import com.ietfdata.model.error.FetchException;
import com.ietfdata.model.error.NotFoundException;
import com.ietfdata.observability.MetricFactory;
import com.ietfdata.observability.SensitiveDataRedactor;
import com.ietfdata.observability.SpanHelper;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * {@link Transport} over {@link HttpClient}.
 *
 * <p>Every fetch is a GET with {@code Accept: application/json}, timed by the
 * {@code datatracker.fetch} timer and wrapped in a CLIENT span. Failures are counted by
 * {@code datatracker.fetch.failures} with a {@code reason} tag and mapped onto the client's
 * exception taxonomy: 404 becomes {@link NotFoundException}, everything else {@link FetchException}.
 */
public final class HttpTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(HttpTransport.class);

    static final String METRIC_FETCH = "datatracker.fetch";
    static final String METRIC_FAILURES = "datatracker.fetch.failures";

    private final HttpClient httpClient;
    private final ClientSettings settings;
    private final MetricFactory metrics;
    private final SpanHelper spans;
    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();
    private final Timer fetchTimer;

    public HttpTransport(ClientSettings settings) {
        this(settings, MetricFactory.global("datatracker"), SpanHelper.noop());
    }

    public HttpTransport(ClientSettings settings, MetricFactory metrics, SpanHelper spans) {
        this(HttpClient.newBuilder()
                        .connectTimeout(settings.requestTimeout())
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                settings, metrics, spans);
    }

    public HttpTransport(HttpClient httpClient, ClientSettings settings, MetricFactory metrics, SpanHelper spans) {
        if (httpClient == null || settings == null || metrics == null || spans == null) {
            throw new IllegalArgumentException("httpClient, settings, metrics and spans must not be null");
        }
        this.httpClient = httpClient;
        this.settings = settings;
        this.metrics = metrics;
        this.spans = spans;
        this.fetchTimer = metrics.timer(METRIC_FETCH, "Latency of Datatracker document fetches");
    }

    @Override
    public String fetch(String path) {
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("path must be absolute: " + path);
        }
        return spans.withClientSpan("datatracker.fetch", Map.of("http.path", stripQuery(path)), () -> {
            Timer.Sample sample = Timer.start(metrics.registry());
            try {
                return send(path);
            } finally {
                sample.stop(fetchTimer);
            }
        });
    }

    private String send(String path) {
        URI uri = buildUri(path);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(settings.requestTimeout())
                .header("Accept", "application/json")
                .header("User-Agent", settings.userAgent())
                .GET()
                .build();

        log.debug("GET {}", redactor.redactUrl(uri.toString()));

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            countFailure("timeout");
            log.warn("Timed out after {} fetching {}", settings.requestTimeout(), path);
            throw FetchException.timeout(path, e);
        } catch (IOException e) {
            countFailure("io");
            log.warn("I/O failure fetching {}: {}", path, e.getMessage());
            throw FetchException.io(path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            countFailure("interrupted");
            throw FetchException.io(path, e);
        }

        int status = response.statusCode();
        if (status == 404) {
            countFailure("not_found");
            log.debug("Not found: {}", path);
            throw new NotFoundException(path);
        }
        if (status < 200 || status >= 300) {
            countFailure("status_" + status);
            log.warn("Datatracker returned HTTP {} for {}", status, path);
            throw FetchException.status(path, status);
        }
        return response.body();
    }

    /**
     * Resolves {@code path} against the base URL. Characters not allowed in a URI path, such as
     * {@code |} or {@code %} in an email address, are percent-encoded; the query is kept as given.
     *
     * @throws DecodeException if the query is not a valid URI query
     */
    URI buildUri(String path) {
        int query = path.indexOf('?');
        String rawPath = query < 0 ? path : path.substring(0, query);
        try {
            StringBuilder url = new StringBuilder(settings.baseUrl())
                    .append(new URI(null, null, rawPath, null).getRawPath());
            if (query >= 0) {
                url.append(path, query, path.length());
            }
            if (settings.apiKey() != null && !hasApiKey(path)) {
                url.append(query >= 0 ? '&' : '?')
                        .append("apikey=")
                        .append(URLEncoder.encode(settings.apiKey(), StandardCharsets.UTF_8));
            }
            return new URI(url.toString());
        } catch (URISyntaxException e) {
            countFailure("invalid_uri");
            log.warn("Cannot build a request URI for {}: {}", path, e.getMessage());
            throw new DecodeException(path, URI.class, e);
        }
    }

    // continuation links echo the query of the request, apikey included
    private static boolean hasApiKey(String path) {
        int query = path.indexOf('?');
        return query >= 0 && ("&" + path.substring(query + 1)).contains("&apikey=");
    }

    private void countFailure(String reason) {
        metrics.counter(METRIC_FAILURES, "Failed Datatracker fetches", "reason", reason).increment();
    }

    private static String stripQuery(String path) {
        int query = path.indexOf('?');
        return query < 0 ? path : path.substring(0, query);
    }
}

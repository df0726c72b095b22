package io.statsheets.season;

import com.codahale.metrics.Timer;
import io.statsheets.budget.AsyncPermits;
import io.statsheets.metrics.Metrics;
import io.statsheets.runtime.TaskScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.CompletableFuture;

/**
 * {@link StatsClient} over the JDK {@link HttpClient} with {@code sendAsync}, so waiting on the service never holds
 * a worker thread. Outstanding requests are capped by {@link AsyncPermits}; there are no retries.
 */
final class HttpStatsClient implements StatsClient {
    private static final Logger log = LoggerFactory.getLogger(HttpStatsClient.class);
    static final String USER_AGENT = "statsheets-season-archive/0.1";

    private final HttpClient http;
    private final URI baseUri;
    private final Duration timeout;
    private final AsyncPermits permits;
    private final Metrics metrics;

    HttpStatsClient(HttpClient http, URI baseUri, Duration timeout, AsyncPermits permits, Metrics metrics) {
        this.http = http;
        this.baseUri = baseUri;
        this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        this.permits = permits;
        this.metrics = metrics;
    }

    @Override
    public CompletableFuture<String> get(String endpoint, Map<String, String> query) {
        URI uri = uri(endpoint, query);
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .GET()
                .build();
        return permits.withPermit(() -> {
                    metrics.counter("http.requests").inc();
                    Timer.Context latency = metrics.timer("http.latency").time();
                    return http.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                            .whenComplete((r, ex) -> latency.stop());
                })
                .handle((resp, ex) -> {
                    if (ex != null) {
                        metrics.counter("http.failures").inc();
                        Throwable cause = TaskScope.unwrap(ex);
                        log.warn("GET {} failed: {}", uri, cause.toString());
                        throw new TransportException(endpoint, "request to " + uri + " failed: " + cause, cause);
                    }
                    int status = resp.statusCode();
                    if (status < 200 || status > 299) {
                        metrics.counter("http.failures").inc();
                        log.warn("GET {} answered {}", uri, status);
                        throw new TransportException(endpoint, status, "from " + uri);
                    }
                    return resp.body();
                });
    }

    URI uri(String endpoint, Map<String, String> query) {
        StringJoiner q = new StringJoiner("&");
        for (Map.Entry<String, String> e : query.entrySet()) {
            q.add(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
        }
        String base = baseUri.toString();
        String sep = base.endsWith("/") ? "" : "/";
        return URI.create(base + sep + endpoint + (query.isEmpty() ? "" : "?" + q));
    }
}

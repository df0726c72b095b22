package io.statsheets.season;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Issues GET requests against the stats database and yields the raw response body.
 * Fails with {@link TransportException} when no 2xx response arrives.
 */
public interface StatsClient {
    CompletableFuture<String> get(String endpoint, Map<String, String> query);
}

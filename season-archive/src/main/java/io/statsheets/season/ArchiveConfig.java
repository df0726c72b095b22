package io.statsheets.season;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Run settings. {@link #fromSystemProperties()} reads {@code -Dstatsheets.*} JVM properties and falls back to the
 * defaults; nothing is read from the environment or from files.
 */
public record ArchiveConfig(
        URI baseUri,
        Path outputRoot,
        int days,
        int teamBatchSize,
        int maxInFlightRequests,
        int ioThreads,
        Duration requestTimeout
) {
    public static final URI DEFAULT_BASE_URI = URI.create("https://www.blaseball.com/database/");
    public static final int DEFAULT_DAYS = 99;
    public static final int DEFAULT_TEAM_BATCH_SIZE = 5;

    public ArchiveConfig {
        Objects.requireNonNull(baseUri, "baseUri");
        Objects.requireNonNull(outputRoot, "outputRoot");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        positive("days", days);
        positive("teamBatchSize", teamBatchSize);
        positive("maxInFlightRequests", maxInFlightRequests);
        positive("ioThreads", ioThreads);
        if (requestTimeout.isNegative() || requestTimeout.isZero()) throw new ArgumentException("requestTimeout must be positive");
    }

    public static ArchiveConfig defaults() {
        return new ArchiveConfig(DEFAULT_BASE_URI, Path.of("out"), DEFAULT_DAYS, DEFAULT_TEAM_BATCH_SIZE, 32, 8, Duration.ofSeconds(30));
    }

    public static ArchiveConfig fromSystemProperties() {
        ArchiveConfig d = defaults();
        try {
            URI base = URI.create(System.getProperty("statsheets.baseUri", d.baseUri().toString()));
            Path out = Path.of(System.getProperty("statsheets.out", d.outputRoot().toString()));
            int days = Integer.parseInt(System.getProperty("statsheets.days", Integer.toString(d.days())));
            int batch = Integer.parseInt(System.getProperty("statsheets.teamBatchSize", Integer.toString(d.teamBatchSize())));
            int inflight = Integer.parseInt(System.getProperty("statsheets.maxInFlight", Integer.toString(d.maxInFlightRequests())));
            int io = Integer.parseInt(System.getProperty("statsheets.ioThreads", Integer.toString(d.ioThreads())));
            long timeout = Long.parseLong(System.getProperty("statsheets.timeoutSeconds", Long.toString(d.requestTimeout().toSeconds())));
            return new ArchiveConfig(base, out, days, batch, inflight, io, Duration.ofSeconds(timeout));
        } catch (IllegalArgumentException e) {
            throw new ArgumentException("invalid statsheets.* system property: " + e.getMessage(), e);
        }
    }

    public ArchiveConfig withBaseUri(URI uri) {
        return new ArchiveConfig(uri, outputRoot, days, teamBatchSize, maxInFlightRequests, ioThreads, requestTimeout);
    }

    public ArchiveConfig withOutputRoot(Path root) {
        return new ArchiveConfig(baseUri, root, days, teamBatchSize, maxInFlightRequests, ioThreads, requestTimeout);
    }

    public ArchiveConfig withDays(int n) {
        return new ArchiveConfig(baseUri, outputRoot, n, teamBatchSize, maxInFlightRequests, ioThreads, requestTimeout);
    }

    private static void positive(String name, long value) {
        if (value <= 0) throw new ArgumentException(name + " must be positive: " + value);
    }
}

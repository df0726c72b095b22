package io.statsheets.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Snapshot;
import com.codahale.metrics.Timer;

import java.util.Map;
import java.util.StringJoiner;

public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public Counter counter(String name) { return registry.counter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    public long count(String name) { return registry.counter(name).getCount(); }

    /**
     * One line with every counter, then each timer's count and median, sorted by name.
     * e.g. {@code http.requests=12 | http.latency.count=12 p50(ms)=3.100}
     */
    public String summary() {
        StringJoiner line = new StringJoiner(" | ");
        for (Map.Entry<String, Counter> e : registry.getCounters().entrySet()) {
            line.add(e.getKey() + "=" + e.getValue().getCount());
        }
        for (Map.Entry<String, Timer> e : registry.getTimers().entrySet()) {
            Snapshot s = e.getValue().getSnapshot();
            line.add(e.getKey() + ".count=" + e.getValue().getCount() + " p50(ms)=" + nsToMs(s.getMedian()));
        }
        return line.toString();
    }

    private static String nsToMs(double nanos) { return String.format("%.3f", nanos / 1_000_000.0); }
}

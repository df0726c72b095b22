package io.statsheets.season;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import com.google.inject.name.Names;
import io.statsheets.budget.AsyncPermits;
import io.statsheets.metrics.Metrics;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class ArchiveModule extends AbstractModule {
    private final ArchiveConfig config;

    public ArchiveModule(ArchiveConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(ArchiveConfig.class).toInstance(config);
    }

    /** Stops the worker pools created by an injector built from this module. */
    public static void shutdown(Injector injector) {
        for (String name : new String[]{"http", "io"}) {
            injector.getInstance(Key.get(ExecutorService.class, Names.named(name))).shutdownNow();
        }
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton ObjectMapper objectMapper() { return StatsJson.mapper(); }

    @Provides @Singleton @Named("http") ExecutorService httpExecutor() {
        return Executors.newFixedThreadPool(Math.max(2, config.maxInFlightRequests() / 4), r -> {
            Thread t = new Thread(r, "http-async"); t.setDaemon(true); return t;
        });
    }

    @Provides @Singleton @Named("io") ExecutorService ioExecutor() {
        return Executors.newFixedThreadPool(config.ioThreads(), r -> {
            Thread t = new Thread(r, "record-io"); t.setDaemon(true); return t;
        });
    }

    // one client for the whole run; it pools connections across all days
    @Provides @Singleton HttpClient httpClient(@Named("http") ExecutorService executor) {
        return HttpClient.newBuilder()
                .executor(executor)
                .connectTimeout(config.requestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Provides @Singleton StatsClient statsClient(HttpClient http, Metrics metrics) {
        return new HttpStatsClient(http, config.baseUri(), config.requestTimeout(), new AsyncPermits(config.maxInFlightRequests()), metrics);
    }

    @Provides @Singleton StatsApi statsApi(StatsClient client, ObjectMapper mapper) { return new StatsApi(client, mapper); }

    @Provides @Singleton RecordWriter recordWriter(ObjectMapper mapper, @Named("io") ExecutorService io, Metrics metrics) {
        return new RecordWriter(config.outputRoot(), mapper, io, metrics);
    }

    @Provides @Singleton DayPipeline dayPipeline(StatsApi api, RecordWriter writer) {
        return new DayPipeline(api, writer, config.teamBatchSize());
    }

    @Provides @Singleton SeasonOrchestrator seasonOrchestrator(DayPipeline days, Metrics metrics) {
        return new SeasonOrchestrator(days, config.days(), metrics);
    }
}

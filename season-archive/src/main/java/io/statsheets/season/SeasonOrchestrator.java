package io.statsheets.season;

import io.statsheets.metrics.Metrics;
import io.statsheets.runtime.TaskScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs a {@link DayPipeline} for every day of a season at once and waits for all of them.
 */
public class SeasonOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SeasonOrchestrator.class);

    private final DayPipeline dayPipeline;
    private final int days;
    private final Metrics metrics;

    public SeasonOrchestrator(DayPipeline dayPipeline, int days, Metrics metrics) {
        this.dayPipeline = dayPipeline;
        this.days = days;
        this.metrics = metrics;
    }

    /**
     * Archives the season named by {@code seasonArg} (1-based). Blocks until every day has settled and throws the
     * first failure reported by any of them.
     *
     * @throws ArgumentException if the argument is missing or not a positive integer; nothing is fetched then
     */
    public void run(String seasonArg) {
        int season = parseSeason(seasonArg);
        try {
            runAsync(season).join();
        } catch (CompletionException e) {
            Throwable cause = TaskScope.unwrap(e);
            if (cause instanceof StatsheetException) throw (StatsheetException) cause;
            throw new StatsheetException("season " + seasonArg + " failed: " + cause, cause);
        }
    }

    /** 0-based season index for a 1-based season argument. */
    public static int parseSeason(String seasonArg) {
        if (seasonArg == null || seasonArg.isBlank()) throw new ArgumentException("Missing season!");
        int season;
        try {
            season = Integer.parseInt(seasonArg.trim());
        } catch (NumberFormatException e) {
            throw new ArgumentException("season must be a positive integer, got '" + seasonArg + "'", e);
        }
        if (season < 1) throw new ArgumentException("season must be a positive integer, got " + season);
        return season - 1;
    }

    public CompletableFuture<Void> runAsync(int seasonIndex) {
        TaskScope scope = TaskScope.open("season-" + (seasonIndex + 1));
        long started = System.nanoTime();
        log.info("archiving season {} ({} days)", seasonIndex + 1, days);
        for (int day = 0; day < days; day++) {
            int d = day;
            scope.fork(() -> dayPipeline.run(scope, seasonIndex, d)
                    .whenComplete((v, ex) -> metrics.counter(ex == null ? "days.completed" : "days.failed").inc()));
        }
        return scope.join().whenComplete((v, ex) -> {
            long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            if (ex == null) log.info("season {} archived in {} ms", seasonIndex + 1, ms);
            else log.error("season {} failed after {} ms: {}", seasonIndex + 1, ms, TaskScope.unwrap(ex).toString());
            log.info("metrics: {}", metrics.summary());
        });
    }
}

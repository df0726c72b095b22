package io.statsheets.season;

import io.statsheets.core.Batches;
import io.statsheets.runtime.TaskScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Retrieves and persists one day of a season.
 *
 * <p>games -> game statsheets -> team statsheets -> player statsheets, each tier fed by ids taken from the one
 * before. Game files are written as soon as the games arrive, alongside the statsheet chain. Team statsheets are cut
 * into batches, and each batch fetches and writes its players independently of the others. Only an empty games list
 * ends the day early; an empty id list further down is still requested.
 *
 * <p>All work runs in a {@link TaskScope} per day, with a nested scope for the player batches. The first failure
 * cancels fetches that have not started yet; records already fetched are still written.
 */
public class DayPipeline {
    private static final Logger log = LoggerFactory.getLogger(DayPipeline.class);

    private final StatsApi api;
    private final RecordWriter writer;
    private final int teamBatchSize;

    public DayPipeline(StatsApi api, RecordWriter writer, int teamBatchSize) {
        if (teamBatchSize <= 0) throw new IllegalArgumentException("team batch size must be positive: " + teamBatchSize);
        this.api = api;
        this.writer = writer;
        this.teamBatchSize = teamBatchSize;
    }

    public CompletableFuture<Void> run(TaskScope parent, int season, int day) {
        TaskScope scope = parent.child("day-" + day);
        log.info("fetching day {}", day);
        return scope.fork(() -> api.games(season, day))
                .thenCompose(games -> {
                    log.info("received day {} games ({})", day, games.size());
                    if (games.isEmpty()) return scope.join();
                    log.info("writing day {} games", day);
                    for (GameUpdate game : games) {
                        scope.forkAlways(() -> writer.writeGame(day, game));
                    }
                    scope.fork(() -> statsheets(scope, day, games));
                    return scope.join();
                })
                .whenComplete((v, ex) -> {
                    if (ex == null) log.info("finished day {}", day);
                    else log.warn("day {} failed: {}", day, TaskScope.unwrap(ex).toString());
                });
    }

    private CompletableFuture<Void> statsheets(TaskScope scope, int day, List<GameUpdate> games) {
        List<String> statsheetIds = games.stream().map(GameUpdate::statsheetId).collect(Collectors.toList());
        log.info("fetching day {} game statsheets", day);
        return api.fetch(Endpoints.GAME_STATSHEETS, statsheetIds)
                .thenCompose(gameStats -> {
                    log.info("received day {} game statsheets ({})", day, gameStats.size());
                    expectOnePerId(day, Endpoints.GAME_STATSHEETS.path(), statsheetIds.size(), gameStats.size());
                    List<String> teamIds = gameStats.stream()
                            .flatMap(s -> s.teamStatsIds().stream())
                            .collect(Collectors.toList());
                    log.info("fetching day {} team statsheets", day);
                    return scope.fork(() -> api.fetch(Endpoints.TEAM_STATSHEETS, teamIds))
                            .thenCompose(teamStats -> {
                                log.info("received day {} team statsheets ({})", day, teamStats.size());
                                expectOnePerId(day, Endpoints.TEAM_STATSHEETS.path(), teamIds.size(), teamStats.size());
                                return players(scope.child("players"), day, teamStats);
                            });
                });
    }

    private CompletableFuture<Void> players(TaskScope scope, int day, List<TeamStatsheet> teamStats) {
        List<List<TeamStatsheet>> batches = Batches.partition(teamStats, teamBatchSize);
        log.info("fetching day {} player statsheets in {} batches", day, batches.size());
        for (List<TeamStatsheet> batch : batches) {
            List<String> playerIds = batch.stream()
                    .flatMap(t -> t.playerStatsIds().stream())
                    .collect(Collectors.toList());
            scope.fork(() -> api.fetch(Endpoints.PLAYER_SEASON_STATS, playerIds)
                    .thenAccept(stats -> {
                        log.debug("writing day {} player statsheets ({})", day, stats.size());
                        expectOnePerId(day, Endpoints.PLAYER_SEASON_STATS.path(), playerIds.size(), stats.size());
                        for (PlayerStatsheet s : stats) {
                            scope.forkAlways(() -> writer.writePlayer(day, s));
                        }
                    }));
        }
        return scope.join();
    }

    // the service is trusted to answer one record per id; a mismatch is only reported
    private static void expectOnePerId(int day, String endpoint, int requested, int received) {
        if (requested != received) {
            log.debug("day {} {}: requested {} ids, received {} records", day, endpoint, requested, received);
        }
    }
}

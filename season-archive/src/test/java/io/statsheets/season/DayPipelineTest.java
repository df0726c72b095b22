package io.statsheets.season;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.statsheets.metrics.Metrics;
import io.statsheets.runtime.TaskScope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class DayPipelineTest {
    private Path tmp;
    private FakeStatsService service;
    private Injector injector;
    private DayPipeline pipeline;

    @BeforeEach
    void setup() throws IOException {
        tmp = Files.createTempDirectory("day-test");
        service = new FakeStatsService();
        ArchiveConfig config = ArchiveConfig.defaults()
                .withBaseUri(service.baseUri())
                .withOutputRoot(tmp.resolve("out"));
        injector = Guice.createInjector(new ArchiveModule(config));
        pipeline = injector.getInstance(DayPipeline.class);
    }

    @AfterEach
    void cleanup() throws IOException {
        ArchiveModule.shutdown(injector);
        service.close();
        try (var s = Files.walk(tmp)) {
            s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (IOException ignore) {} });
        }
    }

    @Test
    void requestsFollowTheTierOrderWithOnePlayerRequestPerBatch() throws Exception {
        // 3 games -> 6 team statsheets -> batches of 5 and 1
        service.seedDay(4, 3, 2);
        run(4);

        List<String> endpoints = service.requestsForDay(4).stream()
                .map(FakeStatsService.Request::endpoint)
                .collect(Collectors.toList());
        assertEquals(List.of("games", "gameStatsheets", "teamStatsheets", "playerSeasonStats", "playerSeasonStats"), endpoints);

        List<FakeStatsService.Request> playerRequests = service.requestsForDay(4).subList(3, 5);
        List<Integer> batchSizes = new ArrayList<>();
        for (FakeStatsService.Request r : playerRequests) batchSizes.add(r.ids().size());
        batchSizes.sort(null);
        assertEquals(List.of(2, 10), batchSizes, "5 team statsheets x 2 players, then 1 x 2");

        FakeStatsService.Request teams = service.requestsForDay(4).get(2);
        assertEquals(List.of("ts-d4-0-away", "ts-d4-0-home", "ts-d4-1-away", "ts-d4-1-home", "ts-d4-2-away", "ts-d4-2-home"), teams.ids());
    }

    @Test
    void writesOneFilePerGameAndPerPlayer() throws Exception {
        service.seedDay(3, 2, 3);
        run(3);

        Path out = tmp.resolve("out");
        assertTrue(Files.isRegularFile(out.resolve("games/3/team-1.json")));
        assertTrue(Files.isRegularFile(out.resolve("games/3/team-3.json")));
        assertEquals(2, countFiles(out.resolve("games")));

        assertTrue(Files.isRegularFile(out.resolve("players/team-0-p0/3.json")));
        assertTrue(Files.isRegularFile(out.resolve("players/team-3-p2/3.json")));
        assertEquals(2 * 2 * 3, countFiles(out.resolve("players")));

        Metrics metrics = injector.getInstance(Metrics.class);
        assertEquals(2, metrics.count("records.written.games"));
        assertEquals(12, metrics.count("records.written.players"));
    }

    @Test
    void passthroughFieldsReachTheWrittenFiles() throws Exception {
        service.seedDay(2, 1, 1);
        run(2);

        ObjectMapper mapper = new ObjectMapper();
        JsonNode game = mapper.readTree(tmp.resolve("out/games/2/team-1.json").toFile());
        assertEquals(7, game.get("weather").asInt());
        assertEquals(4.5, game.get("score").get("home").asDouble());
        assertEquals("gs-d2-0", game.get("statsheet").asText());

        JsonNode player = mapper.readTree(tmp.resolve("out/players/team-0-p0/2.json").toFile());
        assertEquals("Player team-0/0", player.get("name").asText());
        assertEquals(4, player.get("atBats").asInt());
    }

    @Test
    void rerunProducesIdenticalFiles() throws Exception {
        service.seedDay(5, 2, 2);
        run(5);
        Map<Path, byte[]> first = snapshot(tmp.resolve("out"));
        run(5);
        Map<Path, byte[]> second = snapshot(tmp.resolve("out"));

        assertEquals(first.keySet(), second.keySet());
        for (Path p : first.keySet()) {
            assertArrayEquals(first.get(p), second.get(p), p.toString());
        }
    }

    @Test
    void teamStatsheetFailureSkipsPlayersButStillWritesGames() throws Exception {
        service.seedDay(7, 2, 2).failFor("teamStatsheets", 7);

        ExecutionFailure failure = runExpectingFailure(7);
        TransportException te = assertInstanceOf(TransportException.class, failure.cause);
        assertEquals("teamStatsheets", te.endpoint());

        assertTrue(Files.isRegularFile(tmp.resolve("out/games/7/team-1.json")));
        assertTrue(Files.isRegularFile(tmp.resolve("out/games/7/team-3.json")));
        assertFalse(Files.exists(tmp.resolve("out/players")));
        assertTrue(service.requestsForDay(7).stream().noneMatch(r -> r.endpoint().equals("playerSeasonStats")));
    }

    @Test
    void emptyDayMakesNoFurtherRequestsAndNoFiles() throws Exception {
        service.seedDay(9, 0, 0);
        run(9);

        assertEquals(1, service.requests().size());
        assertEquals("games", service.requests().get(0).endpoint());
        assertFalse(Files.exists(tmp.resolve("out")));
    }

    @Test
    void teamsWithoutPlayersStillSendThePlayerRequest() throws Exception {
        service.seedDay(4, 1, 0);
        run(4);

        List<FakeStatsService.Request> requests = service.requests();
        assertEquals(List.of("games", "gameStatsheets", "teamStatsheets", "playerSeasonStats"),
                requests.stream().map(FakeStatsService.Request::endpoint).collect(Collectors.toList()));
        FakeStatsService.Request players = requests.get(3);
        assertEquals("", players.query().get("ids"));
        assertTrue(players.ids().isEmpty());
        assertTrue(Files.isRegularFile(tmp.resolve("out/games/4/team-1.json")));
        assertFalse(Files.exists(tmp.resolve("out/players")));
    }

    @Test
    void noGameStatsheetsStillSendsTheTeamRequest() throws Exception {
        service.seedDay(4, 1, 1).respondWith("gameStatsheets", "[]");
        run(4);

        List<FakeStatsService.Request> requests = service.requests();
        assertEquals(List.of("games", "gameStatsheets", "teamStatsheets"),
                requests.stream().map(FakeStatsService.Request::endpoint).collect(Collectors.toList()));
        assertEquals("", requests.get(2).query().get("ids"));
        assertTrue(Files.isRegularFile(tmp.resolve("out/games/4/team-1.json")));
        assertFalse(Files.exists(tmp.resolve("out/players")));
    }

    @Test
    void gamesFailureFailsTheDayBeforeAnythingIsWritten() throws Exception {
        service.seedDay(1, 2, 2).failFor("games", 1);

        ExecutionFailure failure = runExpectingFailure(1);
        assertInstanceOf(TransportException.class, failure.cause);
        assertEquals(1, service.requests().size());
        assertFalse(Files.exists(tmp.resolve("out")));
    }

    @Test
    void malformedGameStatsheetsIsADecodeError() throws Exception {
        service.seedDay(6, 1, 1).respondWith("gameStatsheets", "{\"not\":\"an array\"}");

        ExecutionFailure failure = runExpectingFailure(6);
        assertInstanceOf(DecodeException.class, failure.cause);
        assertTrue(Files.isRegularFile(tmp.resolve("out/games/6/team-1.json")));
    }

    @Test
    void playerFailureStillLeavesGameFiles() throws Exception {
        // every player batch fails; the game tier is already on disk
        service.seedDay(8, 3, 1).failFor("playerSeasonStats", 8);

        ExecutionFailure failure = runExpectingFailure(8);
        assertInstanceOf(TransportException.class, failure.cause);
        assertEquals(3, countFiles(tmp.resolve("out/games")));
        assertFalse(Files.exists(tmp.resolve("out/players")));
    }

    private void run(int day) throws Exception {
        pipeline.run(TaskScope.open("test"), 0, day).get(10, TimeUnit.SECONDS);
    }

    private ExecutionFailure runExpectingFailure(int day) {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> pipeline.run(TaskScope.open("test"), 0, day).orTimeout(10, TimeUnit.SECONDS).join());
        return new ExecutionFailure(TaskScope.unwrap(ex));
    }

    private record ExecutionFailure(Throwable cause) {}

    private static long countFiles(Path dir) throws IOException {
        try (Stream<Path> s = Files.walk(dir)) {
            return s.filter(Files::isRegularFile).count();
        }
    }

    private static Map<Path, byte[]> snapshot(Path dir) throws IOException {
        Map<Path, byte[]> out = new HashMap<>();
        try (Stream<Path> s = Files.walk(dir)) {
            for (Path p : (Iterable<Path>) s.filter(Files::isRegularFile)::iterator) {
                out.put(dir.relativize(p), Files.readAllBytes(p));
            }
        }
        return out;
    }
}

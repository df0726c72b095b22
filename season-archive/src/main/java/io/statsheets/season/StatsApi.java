package io.statsheets.season;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.statsheets.core.BatchFetch;
import io.statsheets.core.Batches;
import io.statsheets.core.Endpoint;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Typed access to the stats database: the per-day games listing and comma-joined id batches for statsheets.
 */
public class StatsApi implements BatchFetch {
    private final StatsClient client;
    private final ObjectMapper mapper;

    public StatsApi(StatsClient client, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    /** Games of one day; {@code season} and {@code day} are both 0-based. */
    public CompletableFuture<List<GameUpdate>> games(int season, int day) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("season", Integer.toString(season));
        query.put("day", Integer.toString(day));
        return client.get(Endpoints.GAMES.path(), query)
                .thenApply(body -> decode(Endpoints.GAMES, body));
    }

    /**
     * One request for all {@code ids}, joined with commas. An empty list is still sent, as {@code ids=}.
     */
    @Override
    public <T> CompletableFuture<List<T>> fetch(Endpoint<T> endpoint, List<String> ids) {
        return client.get(endpoint.path(), Map.of("ids", Batches.joinIds(ids)))
                .thenApply(body -> decode(endpoint, body));
    }

    <T> List<T> decode(Endpoint<T> endpoint, String body) {
        JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, endpoint.type());
        List<T> records;
        try {
            records = mapper.readValue(body, listType);
        } catch (JsonProcessingException e) {
            throw new DecodeException(endpoint.path(), "expected a JSON array of " + endpoint.type().getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
        if (records == null) {
            throw new DecodeException(endpoint.path(), "expected a JSON array but got null", null);
        }
        for (T r : records) {
            if (r == null) throw new DecodeException(endpoint.path(), "array contains a null record", null);
        }
        return records;
    }
}

package io.statsheets.season;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Set;

/**
 * One game of a day. Persisted as {@code games/<day>/<homeTeamId>.json}.
 */
@JsonPropertyOrder({"id", "statsheet", "awayTeam", "homeTeam"})
public final class GameUpdate extends PassthroughRecord {
    private static final Set<String> DECLARED = Set.of("id", "statsheet", "awayTeam", "homeTeam");

    private final String id;
    private final String statsheetId;
    private final String awayTeamId;
    private final String homeTeamId;

    @JsonCreator
    public GameUpdate(@JsonProperty(value = "id", required = true) String id,
                      @JsonProperty(value = "statsheet", required = true) String statsheetId,
                      @JsonProperty(value = "awayTeam", required = true) String awayTeamId,
                      @JsonProperty(value = "homeTeam", required = true) String homeTeamId) {
        this.id = required(id, "id");
        this.statsheetId = required(statsheetId, "statsheet");
        this.awayTeamId = required(awayTeamId, "awayTeam");
        this.homeTeamId = required(homeTeamId, "homeTeam");
    }

    @JsonProperty("id")
    public String id() { return id; }

    @JsonProperty("statsheet")
    public String statsheetId() { return statsheetId; }

    @JsonProperty("awayTeam")
    public String awayTeamId() { return awayTeamId; }

    @JsonProperty("homeTeam")
    public String homeTeamId() { return homeTeamId; }

    @Override
    protected Set<String> declaredFields() { return DECLARED; }

    @Override
    public String toString() {
        return "GameUpdate{id=" + id + ", statsheet=" + statsheetId + ", away=" + awayTeamId + ", home=" + homeTeamId + '}';
    }
}

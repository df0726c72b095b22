package io.statsheets.season;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Set;

/**
 * A player's statistics for one game. Persisted as {@code players/<playerId>/<day>.json}.
 */
@JsonPropertyOrder({"id", "playerId", "teamId"})
public final class PlayerStatsheet extends PassthroughRecord {
    private static final Set<String> DECLARED = Set.of("id", "playerId", "teamId");

    private final String id;
    private final String playerId;
    private final String teamId;

    @JsonCreator
    public PlayerStatsheet(@JsonProperty(value = "id", required = true) String id,
                           @JsonProperty(value = "playerId", required = true) String playerId,
                           @JsonProperty(value = "teamId", required = true) String teamId) {
        this.id = required(id, "id");
        this.playerId = required(playerId, "playerId");
        this.teamId = required(teamId, "teamId");
    }

    @JsonProperty("id")
    public String id() { return id; }

    @JsonProperty("playerId")
    public String playerId() { return playerId; }

    @JsonProperty("teamId")
    public String teamId() { return teamId; }

    @Override
    protected Set<String> declaredFields() { return DECLARED; }

    @Override
    public String toString() {
        return "PlayerStatsheet{id=" + id + ", player=" + playerId + ", team=" + teamId + '}';
    }
}

package io.statsheets.season;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Per-game statsheet; only the two team statsheet ids are read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GameStatsheet(@JsonProperty(value = "awayTeamStats", required = true) String awayTeamStatsId,
                            @JsonProperty(value = "homeTeamStats", required = true) String homeTeamStatsId) {
    public GameStatsheet {
        Objects.requireNonNull(awayTeamStatsId, "awayTeamStats");
        Objects.requireNonNull(homeTeamStatsId, "homeTeamStats");
    }

    /** Away id first, then home. */
    public List<String> teamStatsIds() {
        return List.of(awayTeamStatsId, homeTeamStatsId);
    }
}

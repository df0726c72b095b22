package io.statsheets.season;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TeamStatsheet(@JsonProperty(value = "playerStats", required = true) List<String> playerStatsIds) {
    public TeamStatsheet {
        Objects.requireNonNull(playerStatsIds, "playerStats");
        playerStatsIds = List.copyOf(playerStatsIds);
    }
}

package io.statsheets.season;

import io.statsheets.core.Endpoint;

/** Collections served by the stats database. */
public final class Endpoints {
    private Endpoints() {}

    public static final Endpoint<GameUpdate> GAMES = new Endpoint<>("games", GameUpdate.class);
    public static final Endpoint<GameStatsheet> GAME_STATSHEETS = new Endpoint<>("gameStatsheets", GameStatsheet.class);
    public static final Endpoint<TeamStatsheet> TEAM_STATSHEETS = new Endpoint<>("teamStatsheets", TeamStatsheet.class);
    public static final Endpoint<PlayerStatsheet> PLAYER_SEASON_STATS = new Endpoint<>("playerSeasonStats", PlayerStatsheet.class);
}

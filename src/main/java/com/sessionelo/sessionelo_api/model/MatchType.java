package com.sessionelo.sessionelo_api.model;

public enum MatchType {
    SINGLES(2),
    DOUBLES(4);

    private final int playerCount;

    MatchType(int playerCount) {
        this.playerCount = playerCount;
    }

    /** Number of player ids a match of this type carries. */
    public int getPlayerCount() {
        return playerCount;
    }
}

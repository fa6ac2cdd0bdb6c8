package com.sessionelo.sessionelo_api.elo;

/**
 * Maps an unordered pair of players to their stable doubles team id.
 */
@FunctionalInterface
public interface TeamIdResolver {

    String resolve(String playerA, String playerB);
}

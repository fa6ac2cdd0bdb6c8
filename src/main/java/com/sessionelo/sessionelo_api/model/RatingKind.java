package com.sessionelo.sessionelo_api.model;

/**
 * The three rating projections derived from the match log.
 * Ratings, snapshots and history rows of different kinds never mix.
 */
public enum RatingKind {
    /** Per-player rating from singles matches. */
    SINGLES,
    /** Per-player rating from doubles matches, driven by side averages. */
    DOUBLES_PLAYER,
    /** Per-team rating from doubles matches. */
    DOUBLES_TEAM
}

package com.sessionelo.sessionelo_api.model;

public enum MatchStatus {
    PENDING,
    COMPLETED
}

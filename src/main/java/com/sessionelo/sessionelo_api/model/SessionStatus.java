package com.sessionelo.sessionelo_api.model;

public enum SessionStatus {
    ACTIVE,
    COMPLETED
}

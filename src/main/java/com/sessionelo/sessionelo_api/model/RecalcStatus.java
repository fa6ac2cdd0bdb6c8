package com.sessionelo.sessionelo_api.model;

/**
 * State of a session's recalculation lock.
 * A null column is read as IDLE (the lock is created lazily on first use).
 */
public enum RecalcStatus {
    IDLE,
    RUNNING,
    DONE,
    FAILED
}

package com.sessionelo.sessionelo_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;

import java.time.LocalDateTime;

/**
 * A dated batch of rounds. Sessions are ordered against each other by
 * {@code createdAt} (id breaks ties), never by id alone.
 *
 * Updates write only the changed columns, so saving a Session loaded before
 * a lock transition leaves the lock untouched.
 */
@Entity
@DynamicUpdate
@Table(name = "sessions")
public class Session {

    @Getter
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Getter @Setter
    @Column(nullable = false)
    private String name;

    @Getter @Setter
    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    // ACTIVE → COMPLETED
    @Getter @Setter
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SessionStatus status = SessionStatus.ACTIVE;

    @Getter @Setter
    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    // =========================================================================
    // Recalculation lock. Written only through SessionRepository's
    // conditional updates, so no setters.
    // =========================================================================
    @Getter
    @Enumerated(EnumType.STRING)
    @Column(name = "recalc_status", length = 16)
    private RecalcStatus recalcStatus;

    @Getter
    @Column(name = "recalc_token", length = 64)
    private String recalcToken;

    @Getter
    @Column(name = "recalc_started_at")
    private LocalDateTime recalcStartedAt;

    @Getter
    @Column(name = "recalc_finished_at")
    private LocalDateTime recalcFinishedAt;

    // =========================================================================
    // Cached best/worst singles performer, refreshed whenever the session's
    // matches are (re)applied. Null until the session completes.
    // =========================================================================
    @Getter @Setter
    @Column(name = "best_player_id")
    private String bestPlayerId;

    @Getter @Setter
    @Column(name = "best_player_delta")
    private Integer bestPlayerDelta;

    @Getter @Setter
    @Column(name = "worst_player_id")
    private String worstPlayerId;

    @Getter @Setter
    @Column(name = "worst_player_delta")
    private Integer worstPlayerDelta;

    public Session() {}

    public Session(String name, LocalDateTime createdAt) {
        this.name = name;
        this.createdAt = createdAt;
    }

    public boolean isCompleted() {
        return status == SessionStatus.COMPLETED;
    }

    public boolean isRecalculating() {
        return recalcStatus == RecalcStatus.RUNNING;
    }

    public void complete(LocalDateTime at) {
        this.status = SessionStatus.COMPLETED;
        this.completedAt = at;
    }
}

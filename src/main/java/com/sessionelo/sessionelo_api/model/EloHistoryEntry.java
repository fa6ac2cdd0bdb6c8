package com.sessionelo.sessionelo_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Audit row: how one match moved one participant's rating.
 * Rewritten together with the snapshots whenever the match is replayed.
 */
@Getter
@Entity
@Table(name = "match_elo_history",
        uniqueConstraints = @UniqueConstraint(columnNames = {"match_id", "rating_kind", "participant_id"}))
public class EloHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "match_id", nullable = false)
    private String matchId;

    @Column(name = "session_id", nullable = false)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "rating_kind", nullable = false, length = 16)
    private RatingKind kind;

    @Column(name = "participant_id", nullable = false)
    private String participantId;

    @Column(name = "elo_before", nullable = false)
    private int eloBefore;

    @Column(name = "elo_after", nullable = false)
    private int eloAfter;

    @Column(nullable = false)
    private int delta;

    @Column(name = "k_factor", nullable = false)
    private int kFactor;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    public EloHistoryEntry() {}

    public EloHistoryEntry(String matchId, String sessionId, RatingKind kind, String participantId,
                           int eloBefore, int eloAfter, int kFactor) {
        this.matchId = matchId;
        this.sessionId = sessionId;
        this.kind = kind;
        this.participantId = participantId;
        this.eloBefore = eloBefore;
        this.eloAfter = eloAfter;
        this.delta = eloAfter - eloBefore;
        this.kFactor = kFactor;
    }
}

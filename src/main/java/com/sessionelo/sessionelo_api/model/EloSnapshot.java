package com.sessionelo.sessionelo_api.model;

import com.sessionelo.sessionelo_api.elo.RatingState;
import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A participant's rating state immediately after a completed match.
 * Snapshots are the only resumption points for a partial replay.
 */
@Getter
@Entity
@Table(name = "elo_snapshots",
        uniqueConstraints = @UniqueConstraint(columnNames = {"match_id", "rating_kind", "participant_id"}),
        indexes = @Index(name = "idx_elo_snapshots_participant", columnList = "rating_kind, participant_id"))
public class EloSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "match_id", nullable = false)
    private String matchId;

    @Enumerated(EnumType.STRING)
    @Column(name = "rating_kind", nullable = false, length = 16)
    private RatingKind kind;

    @Column(name = "participant_id", nullable = false)
    private String participantId;

    @Column(nullable = false)
    private int elo;

    @Column(name = "matches_played", nullable = false)
    private int matchesPlayed;

    @Column(nullable = false)
    private int wins;

    @Column(nullable = false)
    private int losses;

    @Column(nullable = false)
    private int draws;

    @Column(name = "sets_won", nullable = false)
    private int setsWon;

    @Column(name = "sets_lost", nullable = false)
    private int setsLost;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    public EloSnapshot() {}

    public EloSnapshot(String matchId, RatingKind kind, String participantId, RatingState state) {
        this.matchId = matchId;
        this.kind = kind;
        this.participantId = participantId;
        overwrite(state);
    }

    public void overwrite(RatingState state) {
        this.elo = state.elo();
        this.matchesPlayed = state.matchesPlayed();
        this.wins = state.wins();
        this.losses = state.losses();
        this.draws = state.draws();
        this.setsWon = state.setsWon();
        this.setsLost = state.setsLost();
    }

    public RatingState toState() {
        return new RatingState(elo, matchesPlayed, wins, losses, draws, setsWon, setsLost);
    }
}

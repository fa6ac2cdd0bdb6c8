package com.sessionelo.sessionelo_api.model;

import com.sessionelo.sessionelo_api.elo.RatingState;
import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Current rating of one participant in one projection. This row is a
 * materialized result of replaying the match log; it is only ever written
 * from a {@link RatingState} produced by the replay engine.
 */
@Getter
@Entity
@Table(name = "ratings",
        uniqueConstraints = @UniqueConstraint(columnNames = {"rating_kind", "participant_id"}))
public class Rating {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "rating_kind", nullable = false, length = 16)
    private RatingKind kind;

    @Column(name = "participant_id", nullable = false)
    private String participantId;

    @Column(nullable = false)
    private int elo = 1500;

    @Column(name = "matches_played", nullable = false)
    private int matchesPlayed = 0;

    @Column(nullable = false)
    private int wins = 0;

    @Column(nullable = false)
    private int losses = 0;

    @Column(nullable = false)
    private int draws = 0;

    @Column(name = "sets_won", nullable = false)
    private int setsWon = 0;

    @Column(name = "sets_lost", nullable = false)
    private int setsLost = 0;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public Rating() {}

    public Rating(RatingKind kind, String participantId) {
        this.kind = kind;
        this.participantId = participantId;
    }

    public void applyState(RatingState state) {
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

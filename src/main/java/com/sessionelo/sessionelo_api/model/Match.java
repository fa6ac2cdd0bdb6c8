package com.sessionelo.sessionelo_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One match of a session. {@code (roundNumber, matchOrder)} is the canonical
 * replay order inside a session and is unique per session.
 *
 * Player slots: singles uses player1/player2. Doubles uses player1+player2
 * as side 1 and player3+player4 as side 2.
 */
@Entity
@Table(name = "session_matches",
        uniqueConstraints = @UniqueConstraint(columnNames = {"session_id", "round_number", "match_order"}),
        indexes = @Index(name = "idx_session_matches_session", columnList = "session_id"))
public class Match {

    @Getter
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Getter
    @Column(name = "session_id", nullable = false)
    private String sessionId;

    @Getter
    @Column(name = "round_number", nullable = false)
    private int roundNumber;

    @Getter
    @Column(name = "match_order", nullable = false)
    private int matchOrder;

    @Getter
    @Enumerated(EnumType.STRING)
    @Column(name = "match_type", nullable = false, length = 16)
    private MatchType matchType;

    @Getter
    @Column(name = "player1_id", nullable = false)
    private String player1Id;

    @Getter
    @Column(name = "player2_id", nullable = false)
    private String player2Id;

    @Getter
    @Column(name = "player3_id")
    private String player3Id;

    @Getter
    @Column(name = "player4_id")
    private String player4Id;

    @Getter
    @Column(name = "team1_score")
    private Integer team1Score;

    @Getter
    @Column(name = "team2_score")
    private Integer team2Score;

    // PENDING → COMPLETED
    @Getter @Setter
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MatchStatus status = MatchStatus.PENDING;

    @Getter
    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    // =========================================================================
    // Edit metadata. Set when a completed score is corrected.
    // =========================================================================
    @Getter
    @Column(name = "is_edited", nullable = false)
    private boolean edited = false;

    @Getter
    @Column(name = "edited_at")
    private LocalDateTime editedAt;

    @Getter
    @Column(name = "edited_by")
    private String editedBy;

    @Getter
    @Column(name = "edit_reason", length = 500)
    private String editReason;

    public Match() {}

    public Match(String sessionId, int roundNumber, int matchOrder, MatchType matchType, List<String> playerIds) {
        if (playerIds.size() != matchType.getPlayerCount()) {
            throw new IllegalArgumentException(
                    matchType + " match needs " + matchType.getPlayerCount() + " players, got " + playerIds.size());
        }
        this.sessionId = sessionId;
        this.roundNumber = roundNumber;
        this.matchOrder = matchOrder;
        this.matchType = matchType;
        this.player1Id = playerIds.get(0);
        this.player2Id = playerIds.get(1);
        if (matchType == MatchType.DOUBLES) {
            this.player3Id = playerIds.get(2);
            this.player4Id = playerIds.get(3);
        }
    }

    /** Player ids in slot order, without the empty doubles slots of a singles match. */
    public List<String> getPlayerIds() {
        List<String> ids = new ArrayList<>(4);
        ids.add(player1Id);
        ids.add(player2Id);
        if (player3Id != null) ids.add(player3Id);
        if (player4Id != null) ids.add(player4Id);
        return Collections.unmodifiableList(ids);
    }

    public boolean isCompleted() {
        return status == MatchStatus.COMPLETED;
    }

    public boolean involves(String playerId) {
        return getPlayerIds().contains(playerId);
    }

    public void complete(int team1Score, int team2Score, LocalDateTime at) {
        this.team1Score = team1Score;
        this.team2Score = team2Score;
        this.status = MatchStatus.COMPLETED;
        this.completedAt = at;
    }

    public void correctScore(int team1Score, int team2Score, String editedBy, String reason, LocalDateTime at) {
        this.team1Score = team1Score;
        this.team2Score = team2Score;
        this.edited = true;
        this.editedBy = editedBy;
        this.editReason = reason;
        this.editedAt = at;
    }
}

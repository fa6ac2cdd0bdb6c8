package com.sessionelo.sessionelo_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A doubles pairing. Rows are always stored normalized: player1Id sorts
 * before player2Id, so (A,B) and (B,A) hit the same unique key.
 */
@Getter
@Entity
@Table(name = "double_teams",
        uniqueConstraints = @UniqueConstraint(columnNames = {"player1_id", "player2_id"}))
public class DoubleTeam {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "player1_id", nullable = false)
    private String player1Id;

    @Column(name = "player2_id", nullable = false)
    private String player2Id;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    public DoubleTeam() {}

    public DoubleTeam(String player1Id, String player2Id) {
        this.player1Id = player1Id;
        this.player2Id = player2Id;
    }
}

package com.sessionelo.sessionelo_api.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A registered player. Ratings are not stored here: every rating a player
 * holds lives in the ratings table, one row per projection.
 */
@Entity
@Table(name = "players")
public class Player {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "display_name", nullable = false, unique = true, length = 64)
    private String displayName;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    public Player() {}

    public Player(String displayName) {
        this.displayName = displayName;
    }

    // Getters
    public String getId() { return id; }
    public String getDisplayName() { return displayName; }
    public LocalDateTime getCreatedAt() { return createdAt; }

    // Setters
    public void setDisplayName(String displayName) { this.displayName = displayName; }
}

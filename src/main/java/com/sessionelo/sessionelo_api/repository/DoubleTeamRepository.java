package com.sessionelo.sessionelo_api.repository;

import com.sessionelo.sessionelo_api.model.DoubleTeam;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface DoubleTeamRepository extends JpaRepository<DoubleTeam, String> {

    /** Callers must pass the pair already normalized (player1Id sorts first). */
    Optional<DoubleTeam> findByPlayer1IdAndPlayer2Id(String player1Id, String player2Id);
}

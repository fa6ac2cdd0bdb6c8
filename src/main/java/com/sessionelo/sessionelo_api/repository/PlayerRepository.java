package com.sessionelo.sessionelo_api.repository;

import com.sessionelo.sessionelo_api.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface PlayerRepository extends JpaRepository<Player, String> {

    Optional<Player> findByDisplayName(String displayName);

    boolean existsByDisplayName(String displayName);

    List<Player> findAllByOrderByDisplayNameAsc();
}

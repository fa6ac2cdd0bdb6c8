package com.sessionelo.sessionelo_api.repository;

import com.sessionelo.sessionelo_api.model.Rating;
import com.sessionelo.sessionelo_api.model.RatingKind;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface RatingRepository extends JpaRepository<Rating, Long> {

    Optional<Rating> findByKindAndParticipantId(RatingKind kind, String participantId);

    List<Rating> findByKindAndParticipantIdIn(RatingKind kind, Collection<String> participantIds);

    /**
     * Leaderboard for one projection. Only participants with at least one match.
     */
    @Query("""
        SELECT r FROM Rating r
        WHERE r.kind = :kind
        AND r.matchesPlayed > 0
        ORDER BY r.elo DESC, r.participantId ASC
        """)
    List<Rating> findTopByKind(@Param("kind") RatingKind kind, Pageable pageable);

    @Modifying
    @Query("DELETE FROM Rating r")
    int deleteAllRatings();
}

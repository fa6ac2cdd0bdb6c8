package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.elo.RatingState;
import com.sessionelo.sessionelo_api.model.Rating;
import com.sessionelo.sessionelo_api.model.RatingKind;
import com.sessionelo.sessionelo_api.repository.RatingRepository;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Current ratings: the persisted end state of the latest replay.
 */
@Component
public class RatingStore {

    private final RatingRepository ratingRepository;

    public RatingStore(RatingRepository ratingRepository) {
        this.ratingRepository = ratingRepository;
    }

    public Optional<RatingState> find(RatingKind kind, String participantId) {
        return ratingRepository.findByKindAndParticipantId(kind, participantId).map(Rating::toState);
    }

    /** Current states of the given participants; unrated ones are absent. */
    public Map<String, RatingState> load(RatingKind kind, Collection<String> participantIds) {
        if (participantIds.isEmpty()) return Map.of();
        Map<String, RatingState> states = new LinkedHashMap<>();
        for (Rating rating : ratingRepository.findByKindAndParticipantIdIn(kind, participantIds)) {
            states.put(rating.getParticipantId(), rating.toState());
        }
        return states;
    }

    /** Upsert one row per participant. */
    public void persist(RatingKind kind, Map<String, RatingState> states) {
        if (states.isEmpty()) return;
        Map<String, Rating> existing = new HashMap<>(
                ratingRepository.findByKindAndParticipantIdIn(kind, states.keySet()).stream()
                        .collect(Collectors.toMap(Rating::getParticipantId, Function.identity())));

        List<Rating> rows = states.entrySet().stream().map(entry -> {
            Rating rating = existing.computeIfAbsent(entry.getKey(), id -> new Rating(kind, id));
            rating.applyState(entry.getValue());
            return rating;
        }).toList();
        ratingRepository.saveAll(rows);
    }

    public void clearAll() {
        ratingRepository.deleteAllRatings();
    }
}

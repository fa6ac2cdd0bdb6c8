package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.elo.DoublesPlayerProjection;
import com.sessionelo.sessionelo_api.elo.DoublesTeamProjection;
import com.sessionelo.sessionelo_api.elo.RatingProjection;
import com.sessionelo.sessionelo_api.elo.SinglesProjection;
import com.sessionelo.sessionelo_api.model.RatingKind;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The three projections the service maintains, wired with the team registry.
 */
@Component
public class RatingProjections {

    private final RatingProjection singles;
    private final RatingProjection doublesPlayer;
    private final RatingProjection doublesTeam;

    public RatingProjections(DoubleTeamRegistry doubleTeamRegistry) {
        this.singles = new SinglesProjection();
        this.doublesPlayer = new DoublesPlayerProjection();
        this.doublesTeam = new DoublesTeamProjection(doubleTeamRegistry);
    }

    public RatingProjection singles() {
        return singles;
    }

    public RatingProjection forKind(RatingKind kind) {
        return switch (kind) {
            case SINGLES -> singles;
            case DOUBLES_PLAYER -> doublesPlayer;
            case DOUBLES_TEAM -> doublesTeam;
        };
    }

    /** Every projection, in a fixed order. */
    public List<RatingProjection> all() {
        return List.of(singles, doublesPlayer, doublesTeam);
    }
}

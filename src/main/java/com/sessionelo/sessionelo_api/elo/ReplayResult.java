package com.sessionelo.sessionelo_api.elo;

import java.util.List;
import java.util.Map;

/**
 * End state of a replay plus one outcome per applied match, in apply order.
 */
public record ReplayResult(
        Map<String, RatingState> endStates,
        List<MatchOutcome> outcomes
) {}

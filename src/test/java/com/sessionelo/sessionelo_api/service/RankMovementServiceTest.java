package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.elo.DoublesTeamProjection;
import com.sessionelo.sessionelo_api.elo.RatingState;
import com.sessionelo.sessionelo_api.elo.SinglesProjection;
import com.sessionelo.sessionelo_api.model.RatingKind;
import com.sessionelo.sessionelo_api.model.Session;
import com.sessionelo.sessionelo_api.model.SessionStatus;
import com.sessionelo.sessionelo_api.repository.SessionRepository;
import com.sessionelo.sessionelo_api.service.RankMovementService.RankMovement;
import com.sessionelo.sessionelo_api.service.RankMovementService.RankMovements;
import com.sessionelo.util.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RankMovementServiceTest {

    @Mock private SessionRepository sessionRepository;
    @Mock private SessionBaselineService baselineService;
    @Mock private RatingProjections projections;

    private RankMovementService service;
    private Session latest;

    @BeforeEach
    void setUp() {
        service = new RankMovementService(sessionRepository, baselineService, projections);
        latest = TestFixtures.buildSession("s2", TestFixtures.dayOf(2), SessionStatus.COMPLETED);
    }

    private static RatingState rated(int elo, int wins, int losses) {
        return new RatingState(elo, wins + losses, wins, losses, 0, wins, losses);
    }

    @Test
    @DisplayName("noCompletedSession_returnsEmpty")
    void noCompletedSession_returnsEmpty() {
        when(sessionRepository.findFirstByStatusOrderByCreatedAtDescIdDesc(SessionStatus.COMPLETED))
                .thenReturn(Optional.empty());

        RankMovements result = service.computeRankMovements(RatingKind.SINGLES);

        assertNull(result.sessionId());
        assertTrue(result.movements().isEmpty());
        verifyNoInteractions(baselineService);
    }

    @Test
    @DisplayName("movements_compareRankEnteringAndLeavingLatestSession")
    void movements_compareRankEnteringAndLeavingLatestSession() {
        SinglesProjection singles = new SinglesProjection();
        when(sessionRepository.findFirstByStatusOrderByCreatedAtDescIdDesc(SessionStatus.COMPLETED))
                .thenReturn(Optional.of(latest));
        when(projections.forKind(RatingKind.SINGLES)).thenReturn(singles);

        Map<String, RatingState> before = new LinkedHashMap<>();
        before.put("ann", rated(1540, 2, 0));
        before.put("ben", rated(1500, 1, 1));
        before.put("cal", rated(1460, 0, 2));
        Map<String, RatingState> after = new LinkedHashMap<>(before);
        after.put("ann", rated(1518, 2, 1));
        after.put("cal", rated(1523, 2, 2));
        after.put("dee", rated(1480, 0, 1));
        when(baselineService.baselineBefore(latest, singles)).thenReturn(before);
        when(baselineService.replayThisSession("s2", before, singles)).thenReturn(after);

        RankMovements result = service.computeRankMovements(RatingKind.SINGLES);

        assertEquals("s2", result.sessionId());
        assertEquals(List.of("cal", "ann", "ben", "dee"),
                result.movements().stream().map(RankMovement::participantId).toList());

        RankMovement cal = result.movements().get(0);
        assertEquals(1, cal.rank());
        assertEquals(3, cal.previousRank());
        assertEquals(2, cal.movement());

        RankMovement ann = result.movements().get(1);
        assertEquals(1, ann.previousRank());
        assertEquals(-1, ann.movement());

        RankMovement ben = result.movements().get(2);
        assertEquals(2, ben.previousRank());
        assertEquals(-1, ben.movement());

        RankMovement dee = result.movements().get(3);
        assertNull(dee.previousRank());
        assertEquals(0, dee.movement());
    }

    @Test
    @DisplayName("equalElo_ranksByParticipantId_andUnplayedAreNotRanked")
    void equalElo_ranksByParticipantId_andUnplayedAreNotRanked() {
        DoublesTeamProjection teams = new DoublesTeamProjection((a, b) -> a + "+" + b);
        when(sessionRepository.findFirstByStatusOrderByCreatedAtDescIdDesc(SessionStatus.COMPLETED))
                .thenReturn(Optional.of(latest));
        when(projections.forKind(RatingKind.DOUBLES_TEAM)).thenReturn(teams);
        when(baselineService.baselineBefore(latest, teams)).thenReturn(Map.of("t-unplayed", RatingState.initial()));
        when(baselineService.replayThisSession(eq("s2"), anyMap(), eq(teams))).thenReturn(Map.of(
                "t-unplayed", RatingState.initial(),
                "t-b", rated(1520, 1, 0),
                "t-a", rated(1520, 1, 0)));

        RankMovements result = service.computeRankMovements(RatingKind.DOUBLES_TEAM);

        assertEquals(List.of("t-a", "t-b"),
                result.movements().stream().map(RankMovement::participantId).toList());
        assertEquals(RatingKind.DOUBLES_TEAM, result.kind());
    }
}

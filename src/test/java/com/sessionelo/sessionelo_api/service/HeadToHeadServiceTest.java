package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.elo.MatchRecord;
import com.sessionelo.sessionelo_api.elo.RatingState;
import com.sessionelo.sessionelo_api.exception.ResourceNotFoundException;
import com.sessionelo.sessionelo_api.exception.ValidationException;
import com.sessionelo.sessionelo_api.model.RatingKind;
import com.sessionelo.sessionelo_api.model.Session;
import com.sessionelo.sessionelo_api.model.SessionStatus;
import com.sessionelo.sessionelo_api.repository.PlayerRepository;
import com.sessionelo.sessionelo_api.repository.SessionRepository;
import com.sessionelo.sessionelo_api.service.HeadToHeadService.HeadToHead;
import com.sessionelo.sessionelo_api.service.HeadToHeadService.OpponentRecord;
import com.sessionelo.util.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.sessionelo.util.TestFixtures.doubles;
import static com.sessionelo.util.TestFixtures.singles;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HeadToHeadServiceTest {

    @Mock private PlayerRepository playerRepository;
    @Mock private SessionRepository sessionRepository;
    @Mock private MatchLog matchLog;
    @Mock private RatingStore ratingStore;

    private HeadToHeadService service;

    @BeforeEach
    void setUp() {
        service = new HeadToHeadService(playerRepository, sessionRepository, matchLog, ratingStore);
    }

    private void logContains(MatchRecord... matches) {
        List<Session> sessions = List.of(TestFixtures.buildSession("s1", TestFixtures.dayOf(1), SessionStatus.COMPLETED));
        when(sessionRepository.findAllByOrderByCreatedAtAscIdAsc()).thenReturn(sessions);
        when(matchLog.completedMatchesOf(sessions)).thenReturn(List.of(matches));
    }

    private void playersExist(String... ids) {
        for (String id : ids) when(playerRepository.existsById(id)).thenReturn(true);
    }

    @Test
    @DisplayName("headToHead_countsFromPlayersSide_inEitherSlot")
    void headToHead_countsFromPlayersSide_inEitherSlot() {
        playersExist("ann", "ben");
        logContains(
                singles("m1", "ann", "ben", 11, 5),
                singles("m2", "ben", "ann", 11, 9),
                singles("m3", "ann", "ben", 10, 10),
                singles("m4", "ann", "cal", 11, 2),
                doubles("d1", List.of("ann", "cal", "ben", "dee"), 11, 3));
        when(ratingStore.find(RatingKind.SINGLES, "ann")).thenReturn(Optional.of(new RatingState(1531, 4, 2, 1, 1, 2, 1)));
        when(ratingStore.find(RatingKind.SINGLES, "ben")).thenReturn(Optional.empty());

        HeadToHead result = service.headToHead("ann", "ben");

        assertEquals(1531, result.playerElo());
        assertEquals(1500, result.opponentElo());
        assertEquals(new OpponentRecord("ben", 3, 1, 1, 1, 30, 26), result.record());
    }

    @Test
    @DisplayName("headToHead_neverMet_returnsEmptyRecord")
    void headToHead_neverMet_returnsEmptyRecord() {
        playersExist("ann", "dee");
        logContains(singles("m1", "ann", "ben", 11, 5));
        when(ratingStore.find(eq(RatingKind.SINGLES), anyString())).thenReturn(Optional.empty());

        HeadToHead result = service.headToHead("ann", "dee");

        assertEquals(0, result.record().matches());
        assertEquals("dee", result.record().opponentId());
    }

    @Test
    @DisplayName("headToHead_invalidRequests")
    void headToHead_invalidRequests() {
        assertThrows(ValidationException.class, () -> service.headToHead("ann", null));
        assertThrows(ValidationException.class, () -> service.headToHead("ann", "ann"));

        when(playerRepository.existsById("ann")).thenReturn(true);
        when(playerRepository.existsById("ghost")).thenReturn(false);
        assertThrows(ResourceNotFoundException.class, () -> service.headToHead("ann", "ghost"));
        verifyNoInteractions(matchLog);
    }

    @Test
    @DisplayName("opponentRecords_mostPlayedFirst")
    void opponentRecords_mostPlayedFirst() {
        playersExist("ann");
        logContains(
                singles("m1", "ann", "cal", 11, 5),
                singles("m2", "ben", "ann", 11, 5),
                singles("m3", "ann", "ben", 11, 7),
                singles("m4", "ben", "cal", 11, 7));

        List<OpponentRecord> records = service.opponentRecords("ann");

        assertEquals(List.of("ben", "cal"), records.stream().map(OpponentRecord::opponentId).toList());
        assertEquals(new OpponentRecord("ben", 2, 1, 1, 0, 16, 18), records.get(0));
        assertEquals(new OpponentRecord("cal", 1, 1, 0, 0, 11, 5), records.get(1));
    }
}

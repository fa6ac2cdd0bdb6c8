package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.elo.TeamIdResolver;
import com.sessionelo.sessionelo_api.exception.ValidationException;
import com.sessionelo.sessionelo_api.model.DoubleTeam;
import com.sessionelo.sessionelo_api.repository.DoubleTeamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Stable team ids for doubles pairings.
 *
 * The pair is normalized (lexicographic order) before lookup, so (A,B) and
 * (B,A) resolve to the same team. First use inserts the team in its own
 * transaction; if a concurrent caller inserted the same pair first, the unique
 * constraint fires and the winner's row is re-fetched instead of failing.
 */
@Service
public class DoubleTeamRegistry implements TeamIdResolver {

    private static final Logger log = LoggerFactory.getLogger(DoubleTeamRegistry.class);

    private final DoubleTeamRepository doubleTeamRepository;
    private final TransactionTemplate insertTransaction;

    public DoubleTeamRegistry(DoubleTeamRepository doubleTeamRepository,
                              PlatformTransactionManager transactionManager) {
        this.doubleTeamRepository = doubleTeamRepository;
        this.insertTransaction = new TransactionTemplate(transactionManager);
        this.insertTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public String resolve(String playerA, String playerB) {
        if (playerA == null || playerB == null || playerA.isBlank() || playerB.isBlank()) {
            throw new ValidationException("Both players of a doubles team are required");
        }
        if (playerA.equals(playerB)) {
            throw new ValidationException("A doubles team needs two different players: " + playerA);
        }

        String first = playerA.compareTo(playerB) < 0 ? playerA : playerB;
        String second = first.equals(playerA) ? playerB : playerA;

        return doubleTeamRepository.findByPlayer1IdAndPlayer2Id(first, second)
                .map(DoubleTeam::getId)
                .orElseGet(() -> create(first, second));
    }

    private String create(String first, String second) {
        try {
            String teamId = insertTransaction.execute(status ->
                    doubleTeamRepository.saveAndFlush(new DoubleTeam(first, second)).getId());
            log.info("Created double team {} for players {} / {}", teamId, first, second);
            return teamId;
        } catch (DataIntegrityViolationException e) {
            log.info("Double team {} / {} was created concurrently, re-fetching", first, second);
            return doubleTeamRepository.findByPlayer1IdAndPlayer2Id(first, second)
                    .map(DoubleTeam::getId)
                    .orElseThrow(() -> e);
        }
    }
}

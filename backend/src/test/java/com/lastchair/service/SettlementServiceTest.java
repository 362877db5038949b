package com.lastchair.service;

import com.lastchair.event.LastChairEventPublisher;
import com.lastchair.event.MatchFinishedEvent;
import com.lastchair.event.RoundSettledEvent;
import com.lastchair.model.FeeTier;
import com.lastchair.model.LastChairMatch;
import com.lastchair.model.LastChairRound;
import com.lastchair.model.MatchStatus;
import com.lastchair.model.PlayerSide;
import com.lastchair.model.RevealedChoice;
import com.lastchair.model.RoundStatus;
import com.lastchair.repository.LastChairMatchRepository;
import com.lastchair.repository.LastChairRoundRepository;
import com.lastchair.web.ErrorKind;
import com.lastchair.web.LastChairException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SettlementServiceTest {

    private static final Long MATCH_ID = 21L;

    @Mock
    private LastChairMatchRepository matchRepository;

    @Mock
    private LastChairRoundRepository roundRepository;

    @Mock
    private StakeLedger stakeLedger;

    @Mock
    private LastChairEventPublisher eventPublisher;

    private SettlementService settlementService;

    @BeforeEach
    void setUp() {
        MatchLockManager lockManager = new MatchLockManager(new TransactionTemplate(mock(PlatformTransactionManager.class)));
        settlementService = new SettlementService(matchRepository, roundRepository, stakeLedger, lockManager, eventPublisher);
    }

    @Test
    void settleRoundScoresRoundAndAdvancesCurrentRound() {
        LastChairMatch match = activeMatch(1_000L, 1);
        LastChairRound round = revealedRound(1, new RevealedChoice(10, 5, 6, 7), new RevealedChoice(5, 1, 2, 3));
        when(matchRepository.findByMatchIdForUpdate(MATCH_ID)).thenReturn(Optional.of(match));
        when(roundRepository.findByMatchIdAndRoundNumberForUpdate(MATCH_ID, 1)).thenReturn(Optional.of(round));

        SettlementService.RoundSettlement settlement = settlementService.settleRound(MATCH_ID, 1);

        assertEquals(RoundStatus.SETTLED, round.getStatus());
        assertNotNull(round.getSettledAt());
        assertEquals(72L, round.getScoreA());
        assertEquals(5L, round.getScoreB());
        assertEquals(72L, match.getScoreA());
        assertEquals(5L, match.getScoreB());
        assertEquals(2, match.getCurrentRound());
        assertTrue(settlement.score().bTrapped());
        // 72 * 10000 / 77
        assertEquals(9_350, settlement.splitABps());

        verify(roundRepository).save(round);
        verify(matchRepository).save(match);
        verify(eventPublisher).publish(new RoundSettledEvent(MATCH_ID, 1, 72L, 5L, 9_350));
        verifyNoInteractions(stakeLedger);
    }

    @Test
    void settlingLastRoundKeepsCurrentRoundAtThree() {
        LastChairMatch match = activeMatch(1_000L, 3);
        match.setScoreA(100L);
        match.setScoreB(60L);
        LastChairRound round = revealedRound(3, new RevealedChoice(1, 2, 3, 4), new RevealedChoice(2, 5, 6, 7));
        when(matchRepository.findByMatchIdForUpdate(MATCH_ID)).thenReturn(Optional.of(match));
        when(roundRepository.findByMatchIdAndRoundNumberForUpdate(MATCH_ID, 3)).thenReturn(Optional.of(round));

        settlementService.settleRound(MATCH_ID, 3);

        assertEquals(3, match.getCurrentRound());
        // B sat on one of A's traps: A 1 * 4 + 32, B 2 * 1
        assertEquals(136L, match.getScoreA());
        assertEquals(62L, match.getScoreB());
    }

    @Test
    void settleRoundRequiresBothReveals() {
        LastChairRound round = revealedRound(1, new RevealedChoice(10, 5, 6, 7), new RevealedChoice(5, 1, 2, 3));
        round.setStatus(RoundStatus.REVEALED_A);
        when(matchRepository.findByMatchIdForUpdate(MATCH_ID)).thenReturn(Optional.of(activeMatch(1_000L, 1)));
        when(roundRepository.findByMatchIdAndRoundNumberForUpdate(MATCH_ID, 1)).thenReturn(Optional.of(round));

        LastChairException error = assertThrows(LastChairException.class, () -> settlementService.settleRound(MATCH_ID, 1));

        assertEquals(ErrorKind.STATE_MISMATCH, error.getKind());
        assertEquals("round_not_ready", error.getCode());
        verify(roundRepository, never()).save(any());
    }

    @Test
    void settledRoundCannotBeScoredTwice() {
        LastChairRound round = revealedRound(1, new RevealedChoice(10, 5, 6, 7), new RevealedChoice(5, 1, 2, 3));
        round.setStatus(RoundStatus.SETTLED);
        when(matchRepository.findByMatchIdForUpdate(MATCH_ID)).thenReturn(Optional.of(activeMatch(1_000L, 2)));
        when(roundRepository.findByMatchIdAndRoundNumberForUpdate(MATCH_ID, 1)).thenReturn(Optional.of(round));

        LastChairException error = assertThrows(LastChairException.class, () -> settlementService.settleRound(MATCH_ID, 1));

        assertEquals(ErrorKind.DUPLICATE_ACTION, error.getKind());
        assertEquals("already_settled", error.getCode());
    }

    @Test
    void roundsSettleInOrder() {
        LastChairRound round = revealedRound(2, new RevealedChoice(10, 5, 6, 7), new RevealedChoice(5, 1, 2, 3));
        when(matchRepository.findByMatchIdForUpdate(MATCH_ID)).thenReturn(Optional.of(activeMatch(1_000L, 1)));
        when(roundRepository.findByMatchIdAndRoundNumberForUpdate(MATCH_ID, 2)).thenReturn(Optional.of(round));

        LastChairException error = assertThrows(LastChairException.class, () -> settlementService.settleRound(MATCH_ID, 2));

        assertEquals(ErrorKind.STATE_MISMATCH, error.getKind());
        assertEquals(RoundStatus.BOTH_REVEALED, round.getStatus());
    }

    @Test
    void settleRoundOnWaitingMatchIsStateMismatch() {
        LastChairMatch waiting = activeMatch(1_000L, 1);
        waiting.setStatus(MatchStatus.WAITING);
        when(matchRepository.findByMatchIdForUpdate(MATCH_ID)).thenReturn(Optional.of(waiting));

        LastChairException error = assertThrows(LastChairException.class, () -> settlementService.settleRound(MATCH_ID, 1));

        assertEquals(ErrorKind.STATE_MISMATCH, error.getKind());
        verifyNoInteractions(roundRepository);
    }

    @Test
    void settleMatchPaysBothSidesAndRetainsFee() {
        LastChairMatch match = activeMatch(1_000L, 3);
        match.setScoreA(336L);
        match.setScoreB(144L);
        when(matchRepository.findByMatchIdForUpdate(MATCH_ID)).thenReturn(Optional.of(match));
        when(roundRepository.findByMatchIdAndRoundNumber(MATCH_ID, 3)).thenReturn(Optional.of(settledRound(3)));
        when(matchRepository.save(any(LastChairMatch.class))).thenAnswer(invocation -> invocation.getArgument(0));

        SettlementService.MatchSettlement settlement = settlementService.settleMatch(MATCH_ID);

        InOrder ledger = inOrder(stakeLedger);
        ledger.verify(stakeLedger).holdAccounts(List.of("alice", "bob"));
        ledger.verify(stakeLedger).pay(MATCH_ID, "alice", 1_380L);
        ledger.verify(stakeLedger).pay(MATCH_ID, "bob", 600L);
        ledger.verify(stakeLedger).retainFee(MATCH_ID, 20L);

        LastChairMatch finished = settlement.match();
        assertEquals(MatchStatus.FINISHED, finished.getStatus());
        assertEquals(1_380L, finished.getPayoutA());
        assertEquals(600L, finished.getPayoutB());
        assertEquals(20L, finished.getFee());
        assertEquals(7_000, finished.getFinalSplitABps());
        assertEquals(FeeTier.DECISIVE, finished.getFeeTier());
        assertNotNull(finished.getFinishedAt());
        verify(eventPublisher).publish(new MatchFinishedEvent(MATCH_ID, 1_380L, 600L, 20L, 7_000));
    }

    @Test
    void zeroPayoutSideIsNotPaid() {
        LastChairMatch match = activeMatch(1L, 3);
        match.setScoreA(120L);
        match.setScoreB(0L);
        when(matchRepository.findByMatchIdForUpdate(MATCH_ID)).thenReturn(Optional.of(match));
        when(roundRepository.findByMatchIdAndRoundNumber(MATCH_ID, 3)).thenReturn(Optional.of(settledRound(3)));
        when(matchRepository.save(any(LastChairMatch.class))).thenAnswer(invocation -> invocation.getArgument(0));

        SettlementService.MatchSettlement settlement = settlementService.settleMatch(MATCH_ID);

        assertEquals(2L, settlement.split().payoutA());
        assertEquals(0L, settlement.split().payoutB());
        verify(stakeLedger).pay(MATCH_ID, "alice", 2L);
        verify(stakeLedger, never()).pay(eq(MATCH_ID), eq("bob"), anyLong());
    }

    @Test
    void finishedMatchCannotSettleAgain() {
        LastChairMatch match = activeMatch(1_000L, 3);
        match.setStatus(MatchStatus.FINISHED);
        when(matchRepository.findByMatchIdForUpdate(MATCH_ID)).thenReturn(Optional.of(match));

        LastChairException error = assertThrows(LastChairException.class, () -> settlementService.settleMatch(MATCH_ID));

        assertEquals(ErrorKind.DUPLICATE_ACTION, error.getKind());
        verifyNoInteractions(stakeLedger);
    }

    @Test
    void settleMatchRequiresScoredFinalRound() {
        LastChairRound finalRound = revealedRound(3, new RevealedChoice(1, 2, 3, 4), new RevealedChoice(2, 5, 6, 7));
        when(matchRepository.findByMatchIdForUpdate(MATCH_ID)).thenReturn(Optional.of(activeMatch(1_000L, 3)));
        when(roundRepository.findByMatchIdAndRoundNumber(MATCH_ID, 3)).thenReturn(Optional.of(finalRound));

        LastChairException error = assertThrows(LastChairException.class, () -> settlementService.settleMatch(MATCH_ID));

        assertEquals(ErrorKind.STATE_MISMATCH, error.getKind());
        verify(stakeLedger, never()).pay(any(), anyString(), anyLong());
    }

    @Test
    void settleMatchOnUnknownMatchIsNotFound() {
        when(matchRepository.findByMatchIdForUpdate(MATCH_ID)).thenReturn(Optional.empty());

        LastChairException error = assertThrows(LastChairException.class, () -> settlementService.settleMatch(MATCH_ID));

        assertEquals(ErrorKind.NOT_FOUND, error.getKind());
    }

    private static LastChairMatch activeMatch(long stake, int currentRound) {
        LastChairMatch match = new LastChairMatch();
        match.setMatchId(MATCH_ID);
        match.setPlayerA("alice");
        match.setPlayerB("bob");
        match.setStake(stake);
        match.setCurrentRound(currentRound);
        match.setStatus(MatchStatus.ACTIVE);
        return match;
    }

    private static LastChairRound revealedRound(int roundNumber, RevealedChoice choiceA, RevealedChoice choiceB) {
        LastChairRound round = new LastChairRound();
        round.setMatchId(MATCH_ID);
        round.setRoundNumber(roundNumber);
        round.recordReveal(PlayerSide.A, choiceA);
        round.recordReveal(PlayerSide.B, choiceB);
        round.setStatus(RoundStatus.BOTH_REVEALED);
        return round;
    }

    private static LastChairRound settledRound(int roundNumber) {
        LastChairRound round = revealedRound(roundNumber, new RevealedChoice(10, 5, 6, 7), new RevealedChoice(5, 1, 2, 3));
        round.setScoreA(72L);
        round.setScoreB(5L);
        round.setStatus(RoundStatus.SETTLED);
        return round;
    }
}

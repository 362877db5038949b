package com.lastchair.service;

import com.lastchair.event.LastChairEventPublisher;
import com.lastchair.event.MatchFinishedEvent;
import com.lastchair.event.RoundSettledEvent;
import com.lastchair.model.LastChairMatch;
import com.lastchair.model.LastChairRound;
import com.lastchair.model.MatchStatus;
import com.lastchair.model.PlayerSide;
import com.lastchair.model.RevealedChoice;
import com.lastchair.model.RoundStatus;
import com.lastchair.model.ScaledScore;
import com.lastchair.repository.LastChairMatchRepository;
import com.lastchair.repository.LastChairRoundRepository;
import com.lastchair.web.LastChairException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Round and match settlement. Either can be triggered by anyone once its preconditions hold;
 * both are guarded so that a repeated call fails instead of scoring or paying twice.
 */
@Service
@RequiredArgsConstructor
public class SettlementService {

    private static final Logger log = LoggerFactory.getLogger(SettlementService.class);

    private final LastChairMatchRepository matchRepository;
    private final LastChairRoundRepository roundRepository;
    private final StakeLedger stakeLedger;
    private final MatchLockManager matchLockManager;
    private final LastChairEventPublisher eventPublisher;

    /**
     * Scores a round whose two reveals have landed and adds the scores to the match totals.
     * Rounds settle in order; {@code currentRound} advances by one and stays on the last round.
     */
    public RoundSettlement settleRound(Long matchId, int roundNumber) {
        MatchLifecycleService.requireValidMatchId(matchId);

        return matchLockManager.withMatchLock(matchId, () -> {
            LastChairMatch match = matchRepository.findByMatchIdForUpdate(matchId)
                    .orElseThrow(() -> LastChairException.matchNotFound(matchId));
            RoundRevealService.requireRoundInRange(roundNumber);
            if (match.getStatus() == MatchStatus.WAITING) {
                throw LastChairException.wrongStatus("Match " + matchId + " has not started");
            }

            LastChairRound round = roundRepository.findByMatchIdAndRoundNumberForUpdate(matchId, roundNumber)
                    .orElseThrow(() -> new IllegalStateException(
                            "Round " + roundNumber + " missing for match " + matchId));
            if (round.isScored()) {
                throw LastChairException.alreadySettled(
                        "Round " + roundNumber + " of match " + matchId + " is already settled");
            }
            if (match.getStatus() != MatchStatus.ACTIVE) {
                throw LastChairException.wrongStatus("Match " + matchId + " is " + match.getStatus());
            }
            if (round.getStatus() != RoundStatus.BOTH_REVEALED) {
                throw LastChairException.roundNotReady(
                        "Round " + roundNumber + " of match " + matchId + " is " + round.getStatus());
            }
            if (roundNumber != match.getCurrentRound()) {
                throw LastChairException.roundNotReady(
                        "Round " + match.getCurrentRound() + " of match " + matchId + " must settle first");
            }

            RevealedChoice choiceA = round.revealedChoice(PlayerSide.A);
            RevealedChoice choiceB = round.revealedChoice(PlayerSide.B);
            ChairScoring.RoundScore score = ChairScoring.score(choiceA, choiceB);

            OffsetDateTime now = OffsetDateTime.now();
            round.setScoreA(score.scoreA().scaled());
            round.setScoreB(score.scoreB().scaled());
            round.setStatus(RoundStatus.SETTLED);
            round.setSettledAt(now);
            round.setUpdatedAt(now);
            roundRepository.save(round);

            ScaledScore totalA = ScaledScore.of(match.getScoreA()).plus(score.scoreA());
            ScaledScore totalB = ScaledScore.of(match.getScoreB()).plus(score.scoreB());
            match.setScoreA(totalA.scaled());
            match.setScoreB(totalB.scaled());
            match.setCurrentRound(Math.min(match.getCurrentRound() + 1, MatchLifecycleService.ROUNDS_PER_MATCH));
            match.setUpdatedAt(now);
            matchRepository.save(match);

            int splitABps = PotSplitCalculator.splitABps(totalA.scaled(), totalB.scaled());
            eventPublisher.publish(new RoundSettledEvent(
                    matchId, roundNumber, score.scoreA().scaled(), score.scoreB().scaled(), splitABps));
            log.info("Match {} round {} settled: A={} (trapped={}), B={} (trapped={}), running split {} bps",
                    matchId, roundNumber, score.scoreA().scaled(), score.aTrapped(),
                    score.scoreB().scaled(), score.bTrapped(), splitABps);

            return new RoundSettlement(match, round, score, splitABps);
        });
    }

    /**
     * Splits the pot after the last round has been scored and pays both players.
     */
    public MatchSettlement settleMatch(Long matchId) {
        MatchLifecycleService.requireValidMatchId(matchId);

        return matchLockManager.withMatchLock(matchId, () -> {
            LastChairMatch match = matchRepository.findByMatchIdForUpdate(matchId)
                    .orElseThrow(() -> LastChairException.matchNotFound(matchId));
            if (match.getStatus() == MatchStatus.FINISHED) {
                throw LastChairException.alreadySettled("Match " + matchId + " is already finished");
            }
            if (match.getStatus() != MatchStatus.ACTIVE) {
                throw LastChairException.wrongStatus("Match " + matchId + " has not started");
            }

            int lastRound = MatchLifecycleService.ROUNDS_PER_MATCH;
            LastChairRound finalRound = roundRepository.findByMatchIdAndRoundNumber(matchId, lastRound)
                    .orElseThrow(() -> new IllegalStateException(
                            "Round " + lastRound + " missing for match " + matchId));
            if (!finalRound.isScored() || finalRound.getScoreA() + finalRound.getScoreB() == 0) {
                throw LastChairException.roundNotReady(
                        "Round " + lastRound + " of match " + matchId + " is not settled yet");
            }

            PotSplitCalculator.PotSplit split =
                    PotSplitCalculator.split(match.getStake(), match.getScoreA(), match.getScoreB());

            // Swapped-seat matches settle concurrently; account locks must be taken in wallet order.
            stakeLedger.holdAccounts(List.of(match.getPlayerA(), match.getPlayerB()));
            if (split.payoutA() > 0) {
                stakeLedger.pay(matchId, match.getPlayerA(), split.payoutA());
            }
            if (split.payoutB() > 0) {
                stakeLedger.pay(matchId, match.getPlayerB(), split.payoutB());
            }
            stakeLedger.retainFee(matchId, split.fee());

            OffsetDateTime now = OffsetDateTime.now();
            match.setPayoutA(split.payoutA());
            match.setPayoutB(split.payoutB());
            match.setFee(split.fee());
            match.setFinalSplitABps(split.splitABps());
            match.setFeeTier(split.tier());
            match.setStatus(MatchStatus.FINISHED);
            match.setFinishedAt(now);
            match.setUpdatedAt(now);
            LastChairMatch saved = matchRepository.save(match);

            eventPublisher.publish(new MatchFinishedEvent(
                    matchId, split.payoutA(), split.payoutB(), split.fee(), split.splitABps()));
            log.info("Match {} finished ({}): pot {}, A gets {}, B gets {}, fee {}, split {} bps",
                    matchId, split.tier(), split.pot(), split.payoutA(), split.payoutB(), split.fee(),
                    split.splitABps());

            return new MatchSettlement(saved, split);
        });
    }

    public record RoundSettlement(
            LastChairMatch match,
            LastChairRound round,
            ChairScoring.RoundScore score,
            int splitABps
    ) {
    }

    public record MatchSettlement(LastChairMatch match, PotSplitCalculator.PotSplit split) {
    }
}

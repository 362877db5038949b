package com.lastchair.mapper;

import com.lastchair.controller.dto.LedgerResponses;
import com.lastchair.controller.dto.MatchResponses;
import com.lastchair.model.LastChairMatch;
import com.lastchair.model.LastChairRound;
import com.lastchair.model.PendingCommitment;
import com.lastchair.model.PlayerAccount;
import com.lastchair.model.PlayerSide;
import com.lastchair.model.RevealedChoice;
import com.lastchair.model.ScaledScore;
import com.lastchair.service.PotSplitCalculator;
import com.lastchair.service.SettlementService;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;

/**
 * Entity to response mapping. The only place scaled scores are turned into real points.
 */
@Component
public class LastChairResponseMapper {

    public MatchResponses.MatchDetail toMatchDetailResponse(LastChairMatch match) {
        return new MatchResponses.MatchDetail(
                match.getMatchId(),
                match.getPlayerA(),
                match.getPlayerB(),
                match.getStake(),
                match.getStake() * 2,
                match.getCurrentRound(),
                match.getStatus(),
                match.getScoreA(),
                match.getScoreB(),
                realPoints(match.getScoreA()),
                realPoints(match.getScoreB()),
                match.getPayoutA(),
                match.getPayoutB(),
                match.getFee(),
                match.getFeeTier(),
                match.getFinalSplitABps(),
                match.getActivatedAt(),
                match.getFinishedAt(),
                match.getCreatedAt(),
                match.getUpdatedAt()
        );
    }

    public MatchResponses.RoundDetail toRoundDetailResponse(LastChairRound round) {
        return new MatchResponses.RoundDetail(
                round.getMatchId(),
                round.getRoundNumber(),
                round.getStatus(),
                round.getCommitmentA(),
                round.getCommitmentB(),
                toRevealedChoiceView(round.revealedChoice(PlayerSide.A)),
                toRevealedChoiceView(round.revealedChoice(PlayerSide.B)),
                round.getScoreA(),
                round.getScoreB(),
                realPoints(round.getScoreA()),
                realPoints(round.getScoreB()),
                round.getSettledAt(),
                round.getUpdatedAt()
        );
    }

    public List<MatchResponses.RoundDetail> toRoundDetailResponses(Collection<LastChairRound> rounds) {
        return rounds.stream()
                .map(this::toRoundDetailResponse)
                .toList();
    }

    public MatchResponses.CommitmentDetail toCommitmentDetailResponse(PendingCommitment commitment) {
        return new MatchResponses.CommitmentDetail(
                commitment.getMatchId(),
                commitment.getPlayerWallet(),
                commitment.getRoundNumber(),
                commitment.getCommitment(),
                commitment.getCreatedAt()
        );
    }

    public MatchResponses.RoundSettlement toRoundSettlementResponse(SettlementService.RoundSettlement settlement) {
        LastChairMatch match = settlement.match();
        return new MatchResponses.RoundSettlement(
                match.getMatchId(),
                settlement.round().getRoundNumber(),
                settlement.score().scoreA().scaled(),
                settlement.score().scoreB().scaled(),
                settlement.score().aTrapped(),
                settlement.score().bTrapped(),
                match.getScoreA(),
                match.getScoreB(),
                settlement.splitABps(),
                PotSplitCalculator.FULL_BPS - settlement.splitABps(),
                match.getCurrentRound()
        );
    }

    public MatchResponses.MatchSettlement toMatchSettlementResponse(SettlementService.MatchSettlement settlement) {
        PotSplitCalculator.PotSplit split = settlement.split();
        return new MatchResponses.MatchSettlement(
                settlement.match().getMatchId(),
                settlement.match().getStatus(),
                split.pot(),
                split.payoutA(),
                split.payoutB(),
                split.fee(),
                split.tier(),
                split.splitABps(),
                split.splitBBps()
        );
    }

    public LedgerResponses.AccountBalance toAccountBalanceResponse(PlayerAccount account) {
        return new LedgerResponses.AccountBalance(
                account.getWalletAddress(),
                account.getBalance(),
                account.getUpdatedAt()
        );
    }

    private static MatchResponses.RevealedChoiceView toRevealedChoiceView(RevealedChoice choice) {
        if (choice == null) {
            return null;
        }
        return new MatchResponses.RevealedChoiceView(choice.chair(), choice.traps());
    }

    private static BigDecimal realPoints(Long scaled) {
        if (scaled == null) {
            return null;
        }
        return ScaledScore.of(scaled).toReal();
    }
}

package com.lastchair.controller.dto;

import com.lastchair.model.FeeTier;
import com.lastchair.model.MatchStatus;
import com.lastchair.model.RoundStatus;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

public final class MatchResponses {

    private MatchResponses() {
    }

    public record MatchDetail(
            Long matchId,
            String playerA,
            String playerB,
            Long stake,
            Long pot,
            Integer currentRound,
            MatchStatus status,
            Long scoreA,
            Long scoreB,
            BigDecimal scoreARealPoints,
            BigDecimal scoreBRealPoints,
            Long payoutA,
            Long payoutB,
            Long fee,
            FeeTier feeTier,
            Integer finalSplitABps,
            OffsetDateTime activatedAt,
            OffsetDateTime finishedAt,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record RevealedChoiceView(
            Integer chair,
            List<Integer> traps
    ) {
    }

    public record RoundDetail(
            Long matchId,
            Integer roundNumber,
            RoundStatus status,
            String commitmentA,
            String commitmentB,
            RevealedChoiceView revealA,
            RevealedChoiceView revealB,
            Long scoreA,
            Long scoreB,
            BigDecimal scoreARealPoints,
            BigDecimal scoreBRealPoints,
            OffsetDateTime settledAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record CommitmentDetail(
            Long matchId,
            String player,
            Integer roundNumber,
            String commitment,
            OffsetDateTime createdAt
    ) {
    }

    public record RoundSettlement(
            Long matchId,
            Integer roundNumber,
            Long scoreA,
            Long scoreB,
            boolean playerATrapped,
            boolean playerBTrapped,
            Long cumulativeScoreA,
            Long cumulativeScoreB,
            Integer splitABps,
            Integer splitBBps,
            Integer currentRound
    ) {
    }

    public record MatchSettlement(
            Long matchId,
            MatchStatus status,
            Long pot,
            Long payoutA,
            Long payoutB,
            Long fee,
            FeeTier feeTier,
            Integer splitABps,
            Integer splitBBps
    ) {
    }
}

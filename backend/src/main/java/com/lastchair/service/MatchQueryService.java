package com.lastchair.service;

import com.lastchair.model.LastChairMatch;
import com.lastchair.model.LastChairRound;
import com.lastchair.model.PendingCommitment;
import com.lastchair.repository.LastChairMatchRepository;
import com.lastchair.repository.LastChairRoundRepository;
import com.lastchair.repository.PendingCommitmentRepository;
import com.lastchair.web.LastChairException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MatchQueryService {

    private final LastChairMatchRepository matchRepository;
    private final LastChairRoundRepository roundRepository;
    private final PendingCommitmentRepository pendingCommitmentRepository;

    public LastChairMatch getMatch(Long matchId) {
        return matchRepository.findById(matchId)
                .orElseThrow(() -> LastChairException.matchNotFound(matchId));
    }

    public LastChairRound getRound(Long matchId, int roundNumber) {
        RoundRevealService.requireRoundInRange(roundNumber);
        requireMatchExists(matchId);
        return roundRepository.findByMatchIdAndRoundNumber(matchId, roundNumber)
                .orElseThrow(() -> LastChairException.notFound(
                        "Round " + roundNumber + " not found for match " + matchId));
    }

    public List<LastChairRound> listRounds(Long matchId) {
        requireMatchExists(matchId);
        return roundRepository.findByMatchIdOrderByRoundNumberAsc(matchId);
    }

    public PendingCommitment getCommitment(Long matchId, String player, int roundNumber) {
        RoundRevealService.requireRoundInRange(roundNumber);
        requireMatchExists(matchId);
        return pendingCommitmentRepository.findByMatchIdAndPlayerWalletAndRoundNumber(matchId, player, roundNumber)
                .orElseThrow(() -> LastChairException.notFound(
                        "No commitment from " + player + " for round " + roundNumber + " of match " + matchId));
    }

    private void requireMatchExists(Long matchId) {
        if (!matchRepository.existsById(matchId)) {
            throw LastChairException.matchNotFound(matchId);
        }
    }
}

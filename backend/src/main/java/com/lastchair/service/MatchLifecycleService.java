package com.lastchair.service;

import com.lastchair.config.LastChairProperties;
import com.lastchair.event.LastChairEventPublisher;
import com.lastchair.event.MatchQueuedEvent;
import com.lastchair.event.MatchStartedEvent;
import com.lastchair.model.LastChairMatch;
import com.lastchair.model.LastChairRound;
import com.lastchair.model.MatchStatus;
import com.lastchair.model.PendingCommitment;
import com.lastchair.model.RoundStatus;
import com.lastchair.repository.LastChairMatchRepository;
import com.lastchair.repository.LastChairRoundRepository;
import com.lastchair.repository.PendingCommitmentRepository;
import com.lastchair.web.LastChairException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Two-phase match start. The first call for a match id queues the caller as player A; the second
 * call from another player with the same stake activates the match. Each caller locks their stake
 * and commits to all three rounds up front.
 */
@Service
@RequiredArgsConstructor
public class MatchLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(MatchLifecycleService.class);

    public static final int ROUNDS_PER_MATCH = 3;

    private final LastChairMatchRepository matchRepository;
    private final LastChairRoundRepository roundRepository;
    private final PendingCommitmentRepository pendingCommitmentRepository;
    private final StakeLedger stakeLedger;
    private final MatchLockManager matchLockManager;
    private final LastChairEventPublisher eventPublisher;
    private final LastChairProperties lastChairProperties;

    public StartResult startMatch(Long matchId, String caller, long stake, List<String> commitments) {
        requireValidMatchId(matchId);
        if (caller == null || caller.isBlank()) {
            throw LastChairException.invalidInput("player is required");
        }
        List<String> normalizedCommitments = normalizeCommitments(commitments);

        return matchLockManager.withMatchLock(matchId, () -> {
            LastChairMatch existing = matchRepository.findByMatchIdForUpdate(matchId).orElse(null);
            if (existing == null) {
                return new StartResult(createMatch(matchId, caller, stake, normalizedCommitments), true);
            }
            return new StartResult(joinMatch(existing, caller, stake, normalizedCommitments), false);
        });
    }

    private LastChairMatch createMatch(Long matchId, String caller, long stake, List<String> commitments) {
        if (stake <= 0) {
            throw LastChairException.invalidInput("stake must be positive");
        }
        long maxStake = lastChairProperties.getLedger().getMaxStake();
        if (stake > maxStake) {
            throw LastChairException.invalidInput("stake must be at most " + maxStake);
        }

        stakeLedger.lock(matchId, caller, stake);

        OffsetDateTime now = OffsetDateTime.now();
        LastChairMatch match = new LastChairMatch();
        match.setMatchId(matchId);
        match.setPlayerA(caller);
        match.setStake(stake);
        match.setCurrentRound(1);
        match.setStatus(MatchStatus.WAITING);
        match.setCreatedAt(now);
        match.setUpdatedAt(now);
        LastChairMatch saved = matchRepository.save(match);

        savePendingCommitments(matchId, caller, commitments, now);

        List<LastChairRound> rounds = new ArrayList<>(ROUNDS_PER_MATCH);
        for (int roundNumber = 1; roundNumber <= ROUNDS_PER_MATCH; roundNumber++) {
            LastChairRound round = new LastChairRound();
            round.setMatchId(matchId);
            round.setRoundNumber(roundNumber);
            round.setStatus(RoundStatus.PENDING);
            round.setCreatedAt(now);
            round.setUpdatedAt(now);
            rounds.add(round);
        }
        roundRepository.saveAll(rounds);

        eventPublisher.publish(new MatchQueuedEvent(matchId, caller, stake));
        log.info("Match {} queued by {} with stake {}", matchId, caller, stake);
        return saved;
    }

    private LastChairMatch joinMatch(LastChairMatch match, String caller, long stake, List<String> commitments) {
        Long matchId = match.getMatchId();
        if (match.getStatus() != MatchStatus.WAITING) {
            throw LastChairException.alreadyStarted("Match already started: " + matchId);
        }
        if (caller.equals(match.getPlayerA())) {
            throw LastChairException.alreadyJoined("Player already queued for match: " + matchId);
        }
        if (stake != match.getStake()) {
            throw LastChairException.stakeMismatch(
                    "Stake " + stake + " does not match stake " + match.getStake() + " of match " + matchId);
        }

        stakeLedger.lock(matchId, caller, stake);

        OffsetDateTime now = OffsetDateTime.now();
        savePendingCommitments(matchId, caller, commitments, now);

        List<PendingCommitment> firstPlayerCommitments =
                pendingCommitmentRepository.findByMatchIdAndPlayerWalletOrderByRoundNumberAsc(matchId, match.getPlayerA());
        if (firstPlayerCommitments.size() != ROUNDS_PER_MATCH) {
            throw new IllegalStateException("Match " + matchId + " is missing commitments of its first player");
        }

        List<LastChairRound> rounds = roundRepository.findByMatchIdOrderByRoundNumberAsc(matchId);
        if (rounds.size() != ROUNDS_PER_MATCH) {
            throw new IllegalStateException("Match " + matchId + " has " + rounds.size() + " rounds");
        }
        for (LastChairRound round : rounds) {
            int index = round.getRoundNumber() - 1;
            round.setCommitmentA(firstPlayerCommitments.get(index).getCommitment());
            round.setCommitmentB(commitments.get(index));
            round.setUpdatedAt(now);
        }
        roundRepository.saveAll(rounds);

        match.setPlayerB(caller);
        match.setStatus(MatchStatus.ACTIVE);
        match.setCurrentRound(1);
        match.setActivatedAt(now);
        match.setUpdatedAt(now);
        LastChairMatch saved = matchRepository.save(match);

        eventPublisher.publish(new MatchStartedEvent(matchId, match.getPlayerA(), caller, stake));
        log.info("Match {} started: {} vs {}, stake {}", matchId, match.getPlayerA(), caller, stake);
        return saved;
    }

    private void savePendingCommitments(Long matchId, String player, List<String> commitments, OffsetDateTime now) {
        List<PendingCommitment> rows = new ArrayList<>(ROUNDS_PER_MATCH);
        for (int i = 0; i < ROUNDS_PER_MATCH; i++) {
            PendingCommitment row = new PendingCommitment();
            row.setMatchId(matchId);
            row.setPlayerWallet(player);
            row.setRoundNumber(i + 1);
            row.setCommitment(commitments.get(i));
            row.setCreatedAt(now);
            rows.add(row);
        }
        pendingCommitmentRepository.saveAll(rows);
    }

    private static List<String> normalizeCommitments(List<String> commitments) {
        if (commitments == null || commitments.size() != ROUNDS_PER_MATCH) {
            throw LastChairException.invalidInput("Exactly " + ROUNDS_PER_MATCH + " commitments are required");
        }
        List<String> normalized = new ArrayList<>(ROUNDS_PER_MATCH);
        for (String commitment : commitments) {
            try {
                normalized.add(CommitmentCodec.normalizeCommitment(commitment));
            } catch (IllegalArgumentException e) {
                throw LastChairException.invalidInput(e.getMessage());
            }
        }
        return normalized;
    }

    static void requireValidMatchId(Long matchId) {
        if (matchId == null || matchId <= 0) {
            throw LastChairException.invalidInput("matchId must be positive");
        }
    }

    public record StartResult(LastChairMatch match, boolean created) {
    }
}

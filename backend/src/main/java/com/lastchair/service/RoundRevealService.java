package com.lastchair.service;

import com.lastchair.config.LastChairProperties;
import com.lastchair.event.LastChairEventPublisher;
import com.lastchair.event.RevealSubmittedEvent;
import com.lastchair.model.LastChairMatch;
import com.lastchair.model.LastChairRound;
import com.lastchair.model.MatchStatus;
import com.lastchair.model.PlayerSide;
import com.lastchair.model.RevealedChoice;
import com.lastchair.model.RoundStatus;
import com.lastchair.repository.LastChairMatchRepository;
import com.lastchair.repository.LastChairRoundRepository;
import com.lastchair.web.LastChairException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * Records one player's opening for one round. Every check runs before the round is written and a
 * verifier rejection leaves the round untouched.
 */
@Service
@RequiredArgsConstructor
public class RoundRevealService {

    private static final Logger log = LoggerFactory.getLogger(RoundRevealService.class);

    private final LastChairMatchRepository matchRepository;
    private final LastChairRoundRepository roundRepository;
    private final ProofVerifier proofVerifier;
    private final MatchLockManager matchLockManager;
    private final LastChairEventPublisher eventPublisher;
    private final LastChairProperties lastChairProperties;

    public LastChairRound submitReveal(Long matchId, int roundNumber, String caller, String credentialBase64) {
        MatchLifecycleService.requireValidMatchId(matchId);
        if (credentialBase64 != null && credentialBase64.length() > encodedLimit()) {
            throw LastChairException.invalidReveal("Reveal credential exceeds "
                    + lastChairProperties.getReveal().getMaxCredentialBytes() + " bytes");
        }

        return matchLockManager.withMatchLock(matchId, () -> {
            LastChairMatch match = matchRepository.findByMatchIdForUpdate(matchId)
                    .orElseThrow(() -> LastChairException.matchNotFound(matchId));
            if (match.getStatus() != MatchStatus.ACTIVE) {
                throw LastChairException.wrongStatus(
                        "Match " + matchId + " is not active: " + match.getStatus());
            }
            requireRoundInRange(roundNumber);

            PlayerSide side = match.sideOf(caller);
            if (side == null) {
                throw LastChairException.notAPlayer(caller + " is not a player of match " + matchId);
            }

            CommitmentCodec.RevealCredential credential = decode(credentialBase64);

            LastChairRound round = roundRepository.findByMatchIdAndRoundNumberForUpdate(matchId, roundNumber)
                    .orElseThrow(() -> new IllegalStateException(
                            "Round " + roundNumber + " missing for match " + matchId));
            if (round.hasRevealed(side)) {
                throw LastChairException.alreadyRevealed(
                        "Player " + side + " already revealed round " + roundNumber + " of match " + matchId);
            }

            RevealedChoice claimed = credential.claimed();
            validateChoice(claimed);

            RevealedChoice attested = verify(match, round, side, caller, credential);
            if (!attested.equals(claimed)) {
                throw LastChairException.attestationMismatch(
                        "Verified opening does not match the revealed values for round " + roundNumber);
            }

            round.recordReveal(side, attested);
            round.setStatus(nextStatus(round.getStatus(), side));
            round.setUpdatedAt(OffsetDateTime.now());
            LastChairRound saved = roundRepository.save(round);

            eventPublisher.publish(new RevealSubmittedEvent(matchId, roundNumber, caller, attested.chair()));
            log.info("Match {} round {}: player {} revealed chair {}, round now {}",
                    matchId, roundNumber, side, attested.chair(), saved.getStatus());
            return saved;
        });
    }

    /**
     * Chair and traps must lie in [1, 12], the traps must be pairwise distinct and the chair
     * must not be one of them.
     */
    static void validateChoice(RevealedChoice choice) {
        requirePosition("chair", choice.chair());
        requirePosition("trap1", choice.trap1());
        requirePosition("trap2", choice.trap2());
        requirePosition("trap3", choice.trap3());

        Set<Integer> distinctTraps = new HashSet<>(choice.traps());
        if (distinctTraps.size() != ChairScoring.TRAP_COUNT) {
            throw LastChairException.invalidReveal("Traps must be distinct: " + choice.traps());
        }
        if (distinctTraps.contains(choice.chair())) {
            throw LastChairException.invalidReveal("Chair " + choice.chair() + " cannot be one of the traps");
        }
    }

    static RoundStatus nextStatus(RoundStatus current, PlayerSide revealed) {
        return switch (current) {
            case PENDING -> revealed == PlayerSide.A ? RoundStatus.REVEALED_A : RoundStatus.REVEALED_B;
            case REVEALED_A -> {
                if (revealed != PlayerSide.B) {
                    throw new IllegalStateException("Player A revealed twice");
                }
                yield RoundStatus.BOTH_REVEALED;
            }
            case REVEALED_B -> {
                if (revealed != PlayerSide.A) {
                    throw new IllegalStateException("Player B revealed twice");
                }
                yield RoundStatus.BOTH_REVEALED;
            }
            case BOTH_REVEALED, SETTLED -> throw new IllegalStateException("Round already has both reveals");
        };
    }

    private RevealedChoice verify(
            LastChairMatch match,
            LastChairRound round,
            PlayerSide side,
            String caller,
            CommitmentCodec.RevealCredential credential
    ) {
        ProofVerificationRequest request = new ProofVerificationRequest(
                match.getMatchId(),
                round.getRoundNumber(),
                caller,
                round.commitmentOf(side),
                credential
        );
        try {
            RevealedChoice attested = proofVerifier.verify(request);
            if (attested == null) {
                throw LastChairException.proofRejected("Verifier returned no attested values", null);
            }
            return attested;
        } catch (ProofVerificationException e) {
            throw LastChairException.proofRejected("Reveal proof rejected: " + e.getMessage(), e);
        }
    }

    private static CommitmentCodec.RevealCredential decode(String credentialBase64) {
        try {
            return CommitmentCodec.decodeCredentialBase64(credentialBase64);
        } catch (IllegalArgumentException e) {
            throw LastChairException.invalidReveal(e.getMessage());
        }
    }

    private static void requirePosition(String name, int value) {
        if (value < 1 || value > ChairScoring.CHAIR_COUNT) {
            throw LastChairException.invalidReveal(
                    name + " must be between 1 and " + ChairScoring.CHAIR_COUNT + ", got " + value);
        }
    }

    static void requireRoundInRange(int roundNumber) {
        if (roundNumber < 1 || roundNumber > MatchLifecycleService.ROUNDS_PER_MATCH) {
            throw LastChairException.invalidInput(
                    "round must be between 1 and " + MatchLifecycleService.ROUNDS_PER_MATCH + ", got " + roundNumber);
        }
    }

    private int encodedLimit() {
        // base64 expands 3 bytes into 4 characters
        return (lastChairProperties.getReveal().getMaxCredentialBytes() + 2) / 3 * 4;
    }
}

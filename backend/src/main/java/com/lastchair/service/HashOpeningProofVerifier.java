package com.lastchair.service;

import com.lastchair.model.RevealedChoice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Verifier for credentials whose proof section is the 32-byte commitment salt. The opening is
 * accepted when re-hashing the trailing values with the salt reproduces the stored commitment.
 */
@Service
public class HashOpeningProofVerifier implements ProofVerifier {

    private static final Logger log = LoggerFactory.getLogger(HashOpeningProofVerifier.class);

    @Override
    public RevealedChoice verify(ProofVerificationRequest request) {
        if (request.commitment() == null) {
            throw new ProofVerificationException("No commitment stored for player in round " + request.roundNumber());
        }

        byte[] salt = request.credential().proof();
        if (salt.length != CommitmentCodec.SALT_BYTES) {
            throw new ProofVerificationException(
                    "Opening proof must be a " + CommitmentCodec.SALT_BYTES + "-byte salt, got " + salt.length + " bytes");
        }

        RevealedChoice opened = request.credential().claimed();
        String recomputed = CommitmentCodec.computeCommitment(opened, salt);
        String expected = CommitmentCodec.normalizeCommitment(request.commitment());
        if (!MessageDigest.isEqual(
                recomputed.getBytes(StandardCharsets.US_ASCII),
                expected.getBytes(StandardCharsets.US_ASCII))) {
            log.debug("Opening for match {} round {} does not match commitment {}",
                    request.matchId(), request.roundNumber(), expected);
            throw new ProofVerificationException("Opening does not match the stored commitment");
        }

        return new RevealedChoice(opened.chair(), opened.trap1(), opened.trap2(), opened.trap3());
    }
}

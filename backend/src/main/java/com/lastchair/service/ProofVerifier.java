package com.lastchair.service;

import com.lastchair.model.RevealedChoice;

/**
 * Checks that a reveal credential opens the commitment stored for a player and round.
 * Implementations return the values they attest to; callers must not trust anything else.
 */
public interface ProofVerifier {

    RevealedChoice verify(ProofVerificationRequest request) throws ProofVerificationException;
}

package com.lastchair.service;

public record ProofVerificationRequest(
        Long matchId,
        int roundNumber,
        String playerWallet,
        String commitment,
        CommitmentCodec.RevealCredential credential
) {
}

package com.lastchair.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Rejection of a match operation. Thrown before any state is written, or inside the operation's
 * transaction so that everything it wrote is rolled back.
 */
@Getter
public class LastChairException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;

    public LastChairException(ErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public LastChairException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public HttpStatus getStatus() {
        return kind.status();
    }

    public static LastChairException notAPlayer(String detail) {
        return new LastChairException(ErrorKind.AUTHORIZATION, "not_a_player", detail);
    }

    public static LastChairException wrongStatus(String detail) {
        return new LastChairException(ErrorKind.STATE_MISMATCH, "wrong_status", detail);
    }

    public static LastChairException roundNotReady(String detail) {
        return new LastChairException(ErrorKind.STATE_MISMATCH, "round_not_ready", detail);
    }

    public static LastChairException alreadyStarted(String detail) {
        return new LastChairException(ErrorKind.DUPLICATE_ACTION, "already_started", detail);
    }

    public static LastChairException alreadyJoined(String detail) {
        return new LastChairException(ErrorKind.DUPLICATE_ACTION, "already_joined", detail);
    }

    public static LastChairException alreadyRevealed(String detail) {
        return new LastChairException(ErrorKind.DUPLICATE_ACTION, "already_revealed", detail);
    }

    public static LastChairException alreadySettled(String detail) {
        return new LastChairException(ErrorKind.DUPLICATE_ACTION, "already_settled", detail);
    }

    public static LastChairException stakeMismatch(String detail) {
        return new LastChairException(ErrorKind.VALUE_MISMATCH, "stake_mismatch", detail);
    }

    public static LastChairException invalidInput(String detail) {
        return new LastChairException(ErrorKind.VALIDATION, "invalid_input", detail);
    }

    public static LastChairException invalidReveal(String detail) {
        return new LastChairException(ErrorKind.VALIDATION, "invalid_reveal", detail);
    }

    public static LastChairException proofRejected(String detail, Throwable cause) {
        return new LastChairException(ErrorKind.CRYPTOGRAPHIC, "proof_rejected", detail, cause);
    }

    public static LastChairException attestationMismatch(String detail) {
        return new LastChairException(ErrorKind.CRYPTOGRAPHIC, "attestation_mismatch", detail);
    }

    public static LastChairException matchNotFound(Long matchId) {
        return new LastChairException(ErrorKind.NOT_FOUND, "match_not_found", "Match not found: " + matchId);
    }

    public static LastChairException notFound(String detail) {
        return new LastChairException(ErrorKind.NOT_FOUND, "not_found", detail);
    }

    public static LastChairException insufficientFunds(String detail) {
        return new LastChairException(ErrorKind.LEDGER_REJECTED, "insufficient_funds", detail);
    }

    public static LastChairException fundingDisabled(String detail) {
        return new LastChairException(ErrorKind.LEDGER_REJECTED, "funding_disabled", detail);
    }
}

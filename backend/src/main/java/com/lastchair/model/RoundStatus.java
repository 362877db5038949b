package com.lastchair.model;

/**
 * Reveal progress of one round. {@link #BOTH_REVEALED} means both openings landed but the
 * round has not been scored yet; only {@link #SETTLED} is terminal.
 */
public enum RoundStatus {
    PENDING,
    REVEALED_A,
    REVEALED_B,
    BOTH_REVEALED,
    SETTLED
}

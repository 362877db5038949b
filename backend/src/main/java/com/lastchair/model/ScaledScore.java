package com.lastchair.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point score: the stored integer is the real score multiplied by {@link #SCALE}.
 * Scale 4 keeps the 0.25x trapped multiplier integral.
 */
public record ScaledScore(long scaled) {

    public static final int SCALE = 4;
    public static final ScaledScore ZERO = new ScaledScore(0L);

    public ScaledScore {
        if (scaled < 0) {
            throw new IllegalArgumentException("Scaled score must be non-negative: " + scaled);
        }
    }

    public static ScaledScore of(long scaled) {
        return new ScaledScore(scaled);
    }

    public ScaledScore plus(ScaledScore other) {
        return new ScaledScore(Math.addExact(scaled, other.scaled));
    }

    /**
     * Real units for display only; never feed the result back into scoring or settlement.
     */
    public BigDecimal toReal() {
        return BigDecimal.valueOf(scaled).divide(BigDecimal.valueOf(SCALE), 2, RoundingMode.UNNECESSARY);
    }
}

package com.lastchair.service;

import com.lastchair.model.FeeTier;

/**
 * Splits the pooled stake by cumulative score. All amounts are integral; truncation always lands
 * in the fee so that {@code payoutA + payoutB + fee == pot}.
 */
public final class PotSplitCalculator {

    public static final int FULL_BPS = 10_000;
    public static final int EVEN_BPS = 5_000;
    public static final int CLOSE_BAND_LOW_BPS = 4_500;
    public static final int CLOSE_BAND_HIGH_BPS = 5_500;

    // 0.5% of the pot from each side
    private static final long SHARED_FEE_DIVISOR = 200;
    // 1% of the pot from the winner
    private static final long WINNER_FEE_DIVISOR = 100;

    private PotSplitCalculator() {
    }

    public static int splitABps(long scoreA, long scoreB) {
        long total = Math.addExact(scoreA, scoreB);
        if (total == 0) {
            return EVEN_BPS;
        }
        return (int) (Math.multiplyExact(scoreA, FULL_BPS) / total);
    }

    public static FeeTier feeTier(long scoreA, long scoreB) {
        if (scoreA + scoreB == 0) {
            return FeeTier.TIE;
        }
        int splitA = splitABps(scoreA, scoreB);
        if (splitA >= CLOSE_BAND_LOW_BPS && splitA <= CLOSE_BAND_HIGH_BPS) {
            return FeeTier.CLOSE;
        }
        return FeeTier.DECISIVE;
    }

    public static PotSplit split(long stake, long scoreA, long scoreB) {
        if (stake <= 0) {
            throw new IllegalArgumentException("stake must be positive");
        }
        long pot = Math.multiplyExact(stake, 2L);
        int splitA = splitABps(scoreA, scoreB);
        FeeTier tier = feeTier(scoreA, scoreB);

        long grossA = tier == FeeTier.TIE
                ? pot / 2
                : Math.multiplyExact(pot, (long) splitA) / FULL_BPS;
        long grossB = pot - grossA;

        long payoutA;
        long payoutB;
        if (tier == FeeTier.DECISIVE) {
            long winnerFee = pot / WINNER_FEE_DIVISOR;
            if (scoreA > scoreB) {
                payoutA = grossA - winnerFee;
                payoutB = grossB;
            } else {
                payoutA = grossA;
                payoutB = grossB - winnerFee;
            }
        } else {
            long feeEach = pot / SHARED_FEE_DIVISOR;
            payoutA = grossA - feeEach;
            payoutB = grossB - feeEach;
        }

        long fee = pot - payoutA - payoutB;
        return new PotSplit(pot, splitA, FULL_BPS - splitA, tier, payoutA, payoutB, fee);
    }

    public record PotSplit(
            long pot,
            int splitABps,
            int splitBBps,
            FeeTier tier,
            long payoutA,
            long payoutB,
            long fee
    ) {
        public long distributable() {
            return pot - fee;
        }
    }
}

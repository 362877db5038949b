package com.lastchair.service;

import com.lastchair.model.FeeTier;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PotSplitCalculatorTest {

    @Test
    void zeroScoresSplitEvenlyAndChargeBothSides() {
        PotSplitCalculator.PotSplit split = PotSplitCalculator.split(1_000L, 0L, 0L);

        assertEquals(FeeTier.TIE, split.tier());
        assertEquals(5_000, split.splitABps());
        assertEquals(990L, split.payoutA());
        assertEquals(990L, split.payoutB());
        assertEquals(20L, split.fee());
        assertEquals(1_980L, split.distributable());
    }

    @Test
    void closeBandIncludesBothEdges() {
        PotSplitCalculator.PotSplit low = PotSplitCalculator.split(1_000L, 45L, 55L);
        PotSplitCalculator.PotSplit high = PotSplitCalculator.split(1_000L, 55L, 45L);

        assertEquals(FeeTier.CLOSE, low.tier());
        assertEquals(4_500, low.splitABps());
        assertEquals(890L, low.payoutA());
        assertEquals(1_090L, low.payoutB());
        assertEquals(20L, low.fee());

        assertEquals(FeeTier.CLOSE, high.tier());
        assertEquals(5_500, high.splitABps());
        assertEquals(1_090L, high.payoutA());
        assertEquals(890L, high.payoutB());
    }

    @Test
    void justOutsideCloseBandChargesOnlyTheWinner() {
        PotSplitCalculator.PotSplit belowBand = PotSplitCalculator.split(1_000L, 4_499L, 5_501L);

        assertEquals(FeeTier.DECISIVE, belowBand.tier());
        assertEquals(4_499, belowBand.splitABps());
        assertEquals(899L, belowBand.payoutA());
        assertEquals(1_081L, belowBand.payoutB());
        assertEquals(20L, belowBand.fee());

        PotSplitCalculator.PotSplit aboveBand = PotSplitCalculator.split(1_000L, 5_501L, 4_499L);
        assertEquals(FeeTier.DECISIVE, aboveBand.tier());
        assertEquals(5_501, aboveBand.splitABps());
    }

    @Test
    void decisiveMatchTakesOnePercentFromWinner() {
        // cumulative 84 vs 36 real points, i.e. 336 vs 144 scaled
        PotSplitCalculator.PotSplit split = PotSplitCalculator.split(1_000L, 336L, 144L);

        assertEquals(FeeTier.DECISIVE, split.tier());
        assertEquals(7_000, split.splitABps());
        assertEquals(3_000, split.splitBBps());
        assertEquals(1_380L, split.payoutA());
        assertEquals(600L, split.payoutB());
        assertEquals(20L, split.fee());
    }

    @Test
    void equalNonZeroScoresAreClose() {
        assertEquals(FeeTier.CLOSE, PotSplitCalculator.feeTier(100L, 100L));
        assertEquals(5_000, PotSplitCalculator.splitABps(100L, 100L));
    }

    @Test
    void truncationAlwaysLandsInFee() {
        PotSplitCalculator.PotSplit split = PotSplitCalculator.split(333L, 1L, 2L);

        assertEquals(3_333, split.splitABps());
        assertEquals(221L, split.payoutA());
        assertEquals(439L, split.payoutB());
        assertEquals(6L, split.fee());
    }

    @Test
    void payoutsAndFeeAlwaysAddUpToPot() {
        long[] stakes = {1L, 2L, 7L, 99L, 101L, 333L, 1_000L, 123_457L, 1_000_000_000_000L};
        for (long stake : stakes) {
            for (long scoreA = 0; scoreA <= 200; scoreA += 7) {
                for (long scoreB = 0; scoreB <= 200; scoreB += 11) {
                    PotSplitCalculator.PotSplit split = PotSplitCalculator.split(stake, scoreA, scoreB);

                    assertEquals(split.pot(), split.payoutA() + split.payoutB() + split.fee(),
                            "stake=" + stake + " scores=" + scoreA + "/" + scoreB);
                    assertEquals(PotSplitCalculator.FULL_BPS, split.splitABps() + split.splitBBps());
                    assertTrue(split.payoutA() >= 0 && split.payoutB() >= 0 && split.fee() >= 0);
                }
            }
        }
    }

    @Test
    void rejectsNonPositiveStake() {
        assertThrows(IllegalArgumentException.class, () -> PotSplitCalculator.split(0L, 1L, 1L));
    }
}

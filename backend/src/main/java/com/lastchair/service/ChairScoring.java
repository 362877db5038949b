package com.lastchair.service;

import com.lastchair.model.RevealedChoice;
import com.lastchair.model.ScaledScore;

/**
 * Round scoring for Last Chair. Pure and symmetric: a round's scores are re-derivable from the
 * two revealed choices alone.
 * <ul>
 *     <li>safe chair scores {@code chair * 4} (1.0x), a trapped chair scores {@code chair * 1} (0.25x)</li>
 *     <li>a player whose opponent got trapped gets {@value #TRAP_BONUS} (8.0 real points)</li>
 * </ul>
 * A player is trapped by the opponent's traps, never their own.
 */
public final class ChairScoring {

    public static final int CHAIR_COUNT = 12;
    public static final int TRAP_COUNT = 3;
    public static final int SAFE_MULTIPLIER = ScaledScore.SCALE;
    public static final int TRAPPED_MULTIPLIER = 1;
    public static final int TRAP_BONUS = ScaledScore.SCALE * 8;

    private ChairScoring() {
    }

    public static boolean isTrapped(int position, RevealedChoice opponent) {
        return opponent.traps(position);
    }

    public static RoundScore score(RevealedChoice playerA, RevealedChoice playerB) {
        return score(playerA.chair(), playerB, playerB.chair(), playerA);
    }

    /**
     * @param chairA    chair revealed by player A
     * @param trapsOfB  choice of player B, whose traps decide whether A is trapped
     * @param chairB    chair revealed by player B
     * @param trapsOfA  choice of player A, whose traps decide whether B is trapped
     */
    public static RoundScore score(int chairA, RevealedChoice trapsOfB, int chairB, RevealedChoice trapsOfA) {
        boolean aTrapped = isTrapped(chairA, trapsOfB);
        boolean bTrapped = isTrapped(chairB, trapsOfA);

        long scoreA = playerScore(chairA, aTrapped, bTrapped);
        long scoreB = playerScore(chairB, bTrapped, aTrapped);
        return new RoundScore(ScaledScore.of(scoreA), ScaledScore.of(scoreB), aTrapped, bTrapped);
    }

    private static long playerScore(int chair, boolean trapped, boolean opponentTrapped) {
        long multiplier = trapped ? TRAPPED_MULTIPLIER : SAFE_MULTIPLIER;
        long bonus = opponentTrapped ? TRAP_BONUS : 0;
        return chair * multiplier + bonus;
    }

    public record RoundScore(ScaledScore scoreA, ScaledScore scoreB, boolean aTrapped, boolean bTrapped) {

        public long combined() {
            return scoreA.scaled() + scoreB.scaled();
        }
    }
}

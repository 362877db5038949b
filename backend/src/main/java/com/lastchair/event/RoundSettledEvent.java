package com.lastchair.event;

/**
 * @param splitABps informational split of the cumulative score so far, not a payout
 */
public record RoundSettledEvent(
        Long matchId,
        int roundNumber,
        long scoreA,
        long scoreB,
        int splitABps
) implements LastChairEvent {

    @Override
    public String type() {
        return "round_settled";
    }
}

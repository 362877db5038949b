package com.lastchair.event;

public record MatchFinishedEvent(
        Long matchId,
        long payoutA,
        long payoutB,
        long fee,
        int finalSplitABps
) implements LastChairEvent {

    @Override
    public String type() {
        return "match_finished";
    }
}

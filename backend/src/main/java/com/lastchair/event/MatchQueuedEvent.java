package com.lastchair.event;

public record MatchQueuedEvent(Long matchId, String player, long stake) implements LastChairEvent {

    @Override
    public String type() {
        return "match_queued";
    }
}

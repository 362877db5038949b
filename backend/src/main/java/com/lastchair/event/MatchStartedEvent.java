package com.lastchair.event;

public record MatchStartedEvent(Long matchId, String playerA, String playerB, long stake) implements LastChairEvent {

    @Override
    public String type() {
        return "match_started";
    }
}

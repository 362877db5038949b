package com.lastchair.event;

public record RevealSubmittedEvent(Long matchId, int roundNumber, String player, int chair) implements LastChairEvent {

    @Override
    public String type() {
        return "reveal_submitted";
    }
}

package com.lastchair.event;

/**
 * Notification for off-chain observers. Has no effect on match state.
 */
public interface LastChairEvent {

    Long matchId();

    String type();
}

package com.lastchair.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingEventSink implements LastChairEventSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventSink.class);

    @Override
    public void accept(LastChairEvent event) {
        log.info("event={} matchId={} payload={}", event.type(), event.matchId(), event);
    }
}

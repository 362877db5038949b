package com.lastchair.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Objects;

/**
 * Hands events to every sink once the emitting transaction has committed; a rolled back
 * operation emits nothing.
 */
@Service
public class LastChairEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(LastChairEventPublisher.class);

    private final List<LastChairEventSink> sinks;

    public LastChairEventPublisher(List<LastChairEventSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public void publish(LastChairEvent event) {
        LastChairEvent requiredEvent = Objects.requireNonNull(event, "event is required");
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(requiredEvent);
                }
            });
            return;
        }
        dispatch(requiredEvent);
    }

    private void dispatch(LastChairEvent event) {
        for (LastChairEventSink sink : sinks) {
            try {
                sink.accept(event);
            } catch (RuntimeException e) {
                log.warn("Event sink {} failed for {} on match {}",
                        sink.getClass().getSimpleName(), event.type(), event.matchId(), e);
            }
        }
    }
}

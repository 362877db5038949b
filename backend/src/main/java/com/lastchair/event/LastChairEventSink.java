package com.lastchair.event;

public interface LastChairEventSink {

    void accept(LastChairEvent event);
}

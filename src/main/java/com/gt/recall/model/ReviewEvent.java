package com.gt.recall.model;

import java.time.Instant;

public record ReviewEvent(String itemId,
                          Instant eventInstant,
                          ReviewSignal signal,
                          double quality,
                          SchedulingState resultingState,
                          String sessionId,
                          boolean redrill) {

    public ReviewEvent withSession(String sessionId, boolean redrill) {
        return new ReviewEvent(itemId, eventInstant, signal, quality, resultingState, sessionId, redrill);
    }
}

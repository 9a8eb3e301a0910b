package com.gt.recall.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.recall.serialization.SessionStatusSerializer;

@JsonSerialize(using = SessionStatusSerializer.class, as = Integer.class)
public enum SessionStatus {
    Created(0, false),
    InProgress(1, false),
    Completed(2, true),
    Abandoned(3, true);

    private int sessionStatusId;
    private boolean terminal;

    SessionStatus(int sessionStatusId, boolean terminal) {
        this.sessionStatusId = sessionStatusId;
        this.terminal = terminal;
    }

    public int getSessionStatusId() {
        return sessionStatusId;
    }

    public boolean isTerminal() {
        return terminal;
    }
}

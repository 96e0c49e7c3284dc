package com.gamelog.core.model;

import java.util.Objects;

/**
 * One decoded log line. The timestamp is the raw clock text ({@code "20:34"});
 * ordering between events comes from file order only.
 */
public record GameEvent(String timestamp, Action action) {

    public GameEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(action, "action");
    }

    public ActionType type() {
        return action.type();
    }
}

package com.gamelog.core.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One session of the server, from an InitGame line to a ShutdownGame line
 * (or to whatever cut it short).
 * <p>
 * Kill statistics are updated as events are added, never recomputed.
 * After {@link #close()} the game is read-only.
 */
public class Game {

    @Getter
    private final int id;

    private final List<GameEvent> events = new ArrayList<>();
    private final KillTally tally = new KillTally();

    private String initDetails;

    @Getter
    private boolean completed;

    @Getter
    private boolean closed;

    public Game(int id) {
        if (id < 1) {
            throw new IllegalArgumentException("game ids start at 1: " + id);
        }
        this.id = id;
    }

    public void addEvent(GameEvent event) {
        if (closed) {
            throw new IllegalStateException("game " + id + " is already finalized");
        }
        Action action = event.action();
        switch (action.type()) {
            case INIT_GAME -> initDetails = ((Action.InitGame) action).details();
            case SHUTDOWN_GAME -> completed = true;
            case KILL -> tally.record((Action.Kill) action);
            default -> {
                // no aggregate for the rest
            }
        }
        events.add(event);
    }

    /**
     * Marks this game finalized. Further {@link #addEvent} calls fail.
     */
    public void close() {
        closed = true;
    }

    public List<GameEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public Optional<String> getInitDetails() {
        return Optional.ofNullable(initDetails);
    }

    // package-private so the counts of a finalized game cannot be changed from outside
    KillTally tally() {
        return tally;
    }

    public Map<String, Integer> getKillsByMeans() {
        return tally.getKillsByMeans();
    }

    public Map<String, Integer> getKillers() {
        return tally.getKillers();
    }

    /**
     * Player id to display name, from the userinfo changes seen in this game.
     * A later rename of the same id replaces the earlier name.
     */
    public Map<Long, String> getPlayers() {
        Map<Long, String> players = new TreeMap<>();
        for (GameEvent event : events) {
            if (event.action() instanceof Action.ClientUserinfoChanged changed) {
                UserInfo.playerName(changed.info())
                        .ifPresent(name -> players.put(changed.playerId(), name));
            }
        }
        return players;
    }

    public List<GameEvent> getKills() {
        List<GameEvent> kills = new ArrayList<>();
        for (GameEvent event : events) {
            if (event.type() == ActionType.KILL) {
                kills.add(event);
            }
        }
        return kills;
    }

    public int getTotalKills() {
        return tally.getTotalKills();
    }

    @Override
    public String toString() {
        return "Game{id=" + id + ", events=" + events.size() + ", completed=" + completed + '}';
    }
}

package com.gamelog.core.parser;

import com.gamelog.core.model.Game;
import com.gamelog.core.model.GameEvent;
import com.gamelog.core.model.KillTally;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Groups decoded events into games.
 * <p>
 * At most one game is open at a time. InitGame opens a new game, closing any
 * open one first (servers that restart without a shutdown line). ShutdownGame
 * completes and closes the open game. Everything else is appended to the open
 * game, or dropped when none is open. {@link #finish()} closes a game still
 * open at end of input without marking it completed.
 * <p>
 * Not thread-safe; use one instance per log.
 */
@Slf4j
public class GameSegmenter {

    private final List<Game> games = new ArrayList<>();
    private final KillTally overall = new KillTally();

    private Game currentGame;
    private int gameCounter;
    private long droppedEvents;

    public void accept(GameEvent event) {
        Objects.requireNonNull(event, "event");
        switch (event.type()) {
            case INIT_GAME -> {
                if (currentGame != null) {
                    log.debug("Game {} restarted without shutdown at {}", currentGame.getId(), event.timestamp());
                    closeCurrent();
                }
                Game game = new Game(++gameCounter);
                game.addEvent(event);
                currentGame = game;
            }
            case SHUTDOWN_GAME -> {
                if (currentGame == null) {
                    droppedEvents++;
                    return;
                }
                currentGame.addEvent(event);
                closeCurrent();
            }
            default -> {
                if (currentGame == null) {
                    droppedEvents++;
                    return;
                }
                currentGame.addEvent(event);
            }
        }
    }

    /**
     * Closes the open game, if any. Safe to call more than once.
     */
    public void finish() {
        if (currentGame != null) {
            log.debug("Game {} still open at end of input", currentGame.getId());
            closeCurrent();
        }
    }

    private void closeCurrent() {
        Game game = currentGame;
        currentGame = null;
        game.close();
        overall.mergeFrom(game);
        games.add(game);
        log.debug("Finalized game {}: {} events, {} kills, completed={}",
                game.getId(), game.getEvents().size(), game.getTotalKills(), game.isCompleted());
    }

    /** Finalized games, oldest first. */
    public List<Game> getGames() {
        return Collections.unmodifiableList(games);
    }

    /** Kills by cause, summed over finalized games only. */
    public Map<String, Integer> getOverallKillsByMeans() {
        return overall.getKillsByMeans();
    }

    /** Kills by player, summed over finalized games only. */
    public Map<String, Integer> getOverallKillers() {
        return overall.getKillers();
    }

    public Optional<Game> currentGame() {
        return Optional.ofNullable(currentGame);
    }

    /** Events that arrived while no game was open. */
    public long getDroppedEvents() {
        return droppedEvents;
    }
}

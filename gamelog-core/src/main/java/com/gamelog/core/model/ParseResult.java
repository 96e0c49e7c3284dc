package com.gamelog.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one pass over a log produces. Immutable; the totals are copies
 * taken when the pass ends.
 *
 * @param games               finalized games in the order they started
 * @param overallKillsByMeans kills by cause, summed over every game
 * @param overallKillers      kills by player, summed over every game
 * @param linesRead           lines offered to the parser, blank ones included
 * @param eventsDecoded       lines that became an event (dropped or not)
 */
public record ParseResult(List<Game> games,
                          Map<String, Integer> overallKillsByMeans,
                          Map<String, Integer> overallKillers,
                          long linesRead,
                          long eventsDecoded) {

    public ParseResult {
        games = List.copyOf(games);
        overallKillsByMeans = Collections.unmodifiableMap(new LinkedHashMap<>(overallKillsByMeans));
        overallKillers = Collections.unmodifiableMap(new LinkedHashMap<>(overallKillers));
    }

    public long linesSkipped() {
        return linesRead - eventsDecoded;
    }

    public long incompleteGames() {
        return games.stream().filter(game -> !game.isCompleted()).count();
    }
}

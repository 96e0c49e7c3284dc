package com.gamelog.report.service;

import com.gamelog.core.model.Game;
import com.gamelog.core.model.KillTally;
import com.gamelog.core.model.ParseResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders a {@link ParseResult} as the plain-text summary printed by the runner:
 * per-game details, overall totals and the player ranking.
 * <p>
 * Counts are listed highest first; equal counts are ordered by name.
 */
@Service
public class ReportService {

    private final boolean showPlayers;
    private final int rankingLimit;

    public ReportService(@Value("${gamelog.report.show-players:true}") boolean showPlayers,
                         @Value("${gamelog.report.ranking-limit:0}") int rankingLimit) {
        if (rankingLimit < 0) {
            throw new IllegalArgumentException("gamelog.report.ranking-limit must be >= 0: " + rankingLimit);
        }
        this.showPlayers = showPlayers;
        this.rankingLimit = rankingLimit;
    }

    public String render(ParseResult result) {
        StringWriter buffer = new StringWriter();
        PrintWriter out = new PrintWriter(buffer);

        out.printf("Parsed %d games:%n", result.games().size());
        for (Game game : result.games()) {
            renderGame(out, game);
        }

        out.printf("%n=== Overall Statistics ===%n");
        if (!result.overallKillsByMeans().isEmpty()) {
            out.printf("%nOverall kills by means:%n");
            for (Map.Entry<String, Integer> e : sorted(result.overallKillsByMeans())) {
                out.printf("  %s: %d%n", e.getKey(), e.getValue());
            }
        }
        if (!result.overallKillers().isEmpty()) {
            out.printf("%nOverall killers (top players by kills):%n");
            for (Map.Entry<String, Integer> e : sorted(result.overallKillers())) {
                out.printf("  %s: %d kills%n", e.getKey(), e.getValue());
            }
            renderRanking(out, sorted(result.overallKillers()));
        }

        out.flush();
        return buffer.toString();
    }

    private void renderGame(PrintWriter out, Game game) {
        out.printf("%nGame %d: %d events (%s)%n",
                game.getId(), game.getEvents().size(), game.isCompleted() ? "completed" : "incomplete");

        Map<Long, String> players = game.getPlayers();
        out.printf("  Players: %d%n", players.size());
        if (showPlayers) {
            players.forEach((id, name) -> out.printf("    %d: %s%n", id, name));
        }

        out.printf("  Kills: %d%n", game.getKills().size());
        if (!game.getKillsByMeans().isEmpty()) {
            out.printf("  Kills by means:%n");
            for (Map.Entry<String, Integer> e : sorted(game.getKillsByMeans())) {
                out.printf("    %s: %d%n", e.getKey(), e.getValue());
            }
        }
        if (!game.getKillers().isEmpty()) {
            out.printf("  Killers:%n");
            for (Map.Entry<String, Integer> e : sorted(game.getKillers())) {
                out.printf("    %s: %d kills%n", e.getKey(), e.getValue());
            }
        }
    }

    private void renderRanking(PrintWriter out, List<Map.Entry<String, Integer>> killers) {
        out.printf("%n=== PLAYER RANKING REPORT ===%n");
        int shown = rankingLimit == 0 ? killers.size() : Math.min(rankingLimit, killers.size());
        for (int i = 0; i < shown; i++) {
            Map.Entry<String, Integer> e = killers.get(i);
            out.printf("%4s place: %s with %d kills%n", ordinal(i + 1), e.getKey(), e.getValue());
        }
    }

    // ranking() is stable, so feeding it names in order settles ties by name
    private static List<Map.Entry<String, Integer>> sorted(Map<String, Integer> counts) {
        return KillTally.ranking(new TreeMap<>(counts));
    }

    /**
     * 1st, 2nd, 3rd, then Nth for every other position.
     */
    static String ordinal(int position) {
        return switch (position) {
            case 1 -> "1st";
            case 2 -> "2nd";
            case 3 -> "3rd";
            default -> position + "th";
        };
    }
}

package com.gamelog.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kill counts by cause of death and by killer.
 * <p>
 * Used per game, where it is fed one kill at a time, and for the whole log,
 * where finalized games are folded in with {@link #mergeFrom(Game)}.
 * Environmental kills count towards their cause but never towards a killer.
 */
public class KillTally {

    private final Map<String, Integer> killsByMeans = new LinkedHashMap<>();
    private final Map<String, Integer> killers = new LinkedHashMap<>();

    public void record(Action.Kill kill) {
        killsByMeans.merge(kill.method(), 1, Integer::sum);
        if (!kill.isWorldKill()) {
            killers.merge(kill.playerName(), 1, Integer::sum);
        }
    }

    /**
     * Adds every count of {@code other} into this tally, key by key.
     */
    public void mergeFrom(KillTally other) {
        other.killsByMeans.forEach((means, count) -> killsByMeans.merge(means, count, Integer::sum));
        other.killers.forEach((killer, count) -> killers.merge(killer, count, Integer::sum));
    }

    /**
     * Adds the counts of {@code game} into this tally. The game itself is left untouched.
     */
    public void mergeFrom(Game game) {
        mergeFrom(game.tally());
    }

    public Map<String, Integer> getKillsByMeans() {
        return Collections.unmodifiableMap(killsByMeans);
    }

    public Map<String, Integer> getKillers() {
        return Collections.unmodifiableMap(killers);
    }

    public int getTotalKills() {
        int total = 0;
        for (int count : killsByMeans.values()) {
            total += count;
        }
        return total;
    }

    public boolean isEmpty() {
        return killsByMeans.isEmpty();
    }

    /**
     * Entries of {@code counts} ordered by count, highest first.
     * Equal counts keep the map's own iteration order.
     */
    public static List<Map.Entry<String, Integer>> ranking(Map<String, Integer> counts) {
        List<Map.Entry<String, Integer>> sorted = new ArrayList<>(counts.entrySet());
        sorted.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
        return sorted;
    }

    @Override
    public String toString() {
        return "KillTally{killsByMeans=" + killsByMeans + ", killers=" + killers + '}';
    }
}

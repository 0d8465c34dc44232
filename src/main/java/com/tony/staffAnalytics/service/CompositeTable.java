package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.model.CompositeValue;
import com.tony.staffAnalytics.model.PerformanceKey;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Composite tabulaire, indexé par (saison, équipe). La première ligne compatible l'emporte.
 */
public class CompositeTable implements PerformanceSource {

    private final String name;
    private final Map<String, List<CompositeValue>> bySeasonAndTeam = new HashMap<>();

    public CompositeTable(String name, List<CompositeValue> values) {
        this.name = name;
        for (CompositeValue v : values) {
            bySeasonAndTeam.computeIfAbsent(index(v.getSeason(), v.getTeam()), k -> new ArrayList<>()).add(v);
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public OptionalDouble lookup(PerformanceKey key) {
        List<CompositeValue> candidates = bySeasonAndTeam.get(index(key.getSeason(), key.getTeam()));
        if (candidates == null) return OptionalDouble.empty();
        for (CompositeValue v : candidates) {
            if (v.matches(key)) return OptionalDouble.of(v.getValue());
        }
        return OptionalDouble.empty();
    }

    public int size() {
        return bySeasonAndTeam.values().stream().mapToInt(List::size).sum();
    }

    private static String index(int season, String team) {
        return season + "|" + (team == null ? "" : team.trim().toUpperCase());
    }
}

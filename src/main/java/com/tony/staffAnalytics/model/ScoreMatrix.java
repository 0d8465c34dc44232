package com.tony.staffAnalytics.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Matrice poste x head coach du meilleur score de connexion.
 * 0 signifie "aucun candidat viable trouvé", jamais "non calculé".
 */
public class ScoreMatrix {

    private final List<String> positionKeys;
    private final List<String> headCoaches;
    private final Map<String, Double> scores;

    public ScoreMatrix(List<PositionAggregate> aggregates, List<String> headCoaches) {
        Set<String> positions = new LinkedHashSet<>();
        Set<String> coaches = new LinkedHashSet<>(headCoaches);
        Map<String, Double> values = new HashMap<>();
        for (PositionAggregate a : aggregates) {
            positions.add(a.getPositionKey());
            coaches.add(a.getHeadCoach());
            values.put(cell(a.getPositionKey(), a.getHeadCoach()), a.getMaxConnectionScore());
        }
        this.positionKeys = Collections.unmodifiableList(new ArrayList<>(positions));
        this.headCoaches = Collections.unmodifiableList(new ArrayList<>(coaches));
        this.scores = Collections.unmodifiableMap(values);
    }

    public double get(String positionKey, String headCoach) {
        return scores.getOrDefault(cell(positionKey, headCoach), 0.0);
    }

    public List<String> getPositionKeys() {
        return positionKeys;
    }

    public List<String> getHeadCoaches() {
        return headCoaches;
    }

    /** Ligne complète d'un poste, dans l'ordre des head coachs. */
    public List<Double> row(String positionKey) {
        List<Double> row = new ArrayList<>(headCoaches.size());
        for (String hc : headCoaches) row.add(get(positionKey, hc));
        return row;
    }

    private static String cell(String positionKey, String headCoach) {
        return positionKey + "\u0000" + headCoach;
    }
}

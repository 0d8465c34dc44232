package com.tony.staffAnalytics.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Table de proximité entre rôles (relation orientée from -> to).
 * L'ordre d'itération est celui du fichier source.
 */
public class ClosenessTable {

    private final Map<String, ClosenessEntry> entries = new LinkedHashMap<>();

    public ClosenessTable(List<ClosenessEntry> rows) {
        for (ClosenessEntry row : rows) {
            // Première occurrence conservée si le fichier contient des doublons
            entries.putIfAbsent(key(row.getFrom(), row.getTo()), row);
        }
    }

    public Optional<ClosenessEntry> lookup(RoleSide from, RoleSide to) {
        return Optional.ofNullable(entries.get(key(from, to)));
    }

    public List<ClosenessEntry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries.values()));
    }

    /**
     * Lignes dont la destination est le poste de Head Coach. Les lignes "Both" ne sont gardées
     * que pour le Head Coach lui-même.
     */
    public List<ClosenessEntry> headCoachLadder() {
        List<ClosenessEntry> ladder = new ArrayList<>();
        for (ClosenessEntry e : entries.values()) {
            if (!e.getTo().isHeadCoach()) continue;
            if (e.getFrom().isBothSides() && !e.getFrom().isHeadCoach()) continue;
            ladder.add(e);
        }
        return ladder;
    }

    public int size() {
        return entries.size();
    }

    private static String key(RoleSide from, RoleSide to) {
        return from.getRole() + "|" + from.getSide() + "|" + to.getRole() + "|" + to.getSide();
    }
}

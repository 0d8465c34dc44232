package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.model.ClosenessEntry;
import com.tony.staffAnalytics.model.ClosenessTable;
import com.tony.staffAnalytics.model.RoleSide;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Associe le rôle actuel d'un coach aux postes atteignables (même niveau ou un échelon au-dessus),
 * en se basant sur la proximité de chaque rôle avec le poste de Head Coach.
 */
public class RolePromotionMapper {

    private final List<ClosenessEntry> ladder;
    private final double step;
    private final Map<RoleSide, List<RoleSide>> cache = new ConcurrentHashMap<>();

    public RolePromotionMapper(ClosenessTable table, double step) {
        this.ladder = table.headCoachLadder();
        this.step = step;
    }

    /**
     * Postes atteignables depuis (role, side). Rôle inconnu : seul le rôle actuel est renvoyé.
     */
    public List<RoleSide> promotionTargets(RoleSide current) {
        return cache.computeIfAbsent(current, this::computeTargets);
    }

    private List<RoleSide> computeTargets(RoleSide current) {
        Double currentCloseness = null;
        for (ClosenessEntry e : ladder) {
            RoleSide from = e.getFrom();
            if (from.getRole().equals(current.getRole())
                    && (from.getSide().equals(current.getSide()) || from.isBothSides())) {
                currentCloseness = e.getCloseness();
                break;
            }
        }
        if (currentCloseness == null) {
            return List.of(current);
        }

        Set<RoleSide> targets = new LinkedHashSet<>();
        for (ClosenessEntry e : ladder) {
            double c = e.getCloseness();
            if (c < currentCloseness || c > currentCloseness + step) continue;
            RoleSide target = e.getFrom();
            // "Both" peut aller des deux côtés, sinon on reste de son côté (ou Both)
            if (!current.isBothSides() && !target.getSide().equals(current.getSide()) && !target.isBothSides()) continue;
            targets.add(target);
        }
        return List.copyOf(targets);
    }

    /**
     * Vrai si un coach occupant actuellement 'current' peut être promu au poste 'position'.
     */
    public boolean canFill(RoleSide current, RoleSide position) {
        for (RoleSide target : promotionTargets(current)) {
            if (target.getRole().equals(position.getRole())
                    && (target.getSide().equals(position.getSide()) || position.isBothSides())) {
                return true;
            }
        }
        return false;
    }

    /** Catalogue des postes à pourvoir : toute l'échelle sauf le Head Coach, dans l'ordre de la table. */
    public List<RoleSide> openPositions() {
        List<RoleSide> positions = new ArrayList<>();
        for (ClosenessEntry e : ladder) {
            if (e.getFrom().isHeadCoach()) continue;
            if (!positions.contains(e.getFrom())) positions.add(e.getFrom());
        }
        return positions;
    }

    public double getStep() {
        return step;
    }
}

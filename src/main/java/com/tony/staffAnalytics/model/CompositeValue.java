package com.tony.staffAnalytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Valeur précalculée d'un composite. Les dimensions nulles ou vides sont des jokers.
 */
@Value
@Builder
public class CompositeValue {
    String composite;
    int season;
    String team;
    String role;
    String side;
    String subcategory;
    String positionGroup;
    double value;

    public boolean matches(PerformanceKey key) {
        return season == key.getSeason()
                && same(team, key.getTeam())
                && same(role, key.getRole())
                && same(side, key.getSide())
                && same(subcategory, key.getSubcategory())
                && same(positionGroup, key.getPositionGroup());
    }

    private static boolean same(String expected, String actual) {
        if (expected == null || expected.isBlank()) return true;
        return actual != null && expected.equalsIgnoreCase(actual.trim());
    }
}

package com.tony.staffAnalytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Clé de recherche d'un composite de performance pour une ligne de staff.
 */
@Value
@Builder
public class PerformanceKey {
    int season;
    String team;
    String role;
    String side;
    String subcategory;
    String positionGroup;

    public static PerformanceKey of(StaffRecord record) {
        return PerformanceKey.builder()
                .season(record.getYear())
                .team(record.getTeam())
                .role(record.getRole())
                .side(record.getSideOfBall())
                .subcategory(record.getRoleSubcategory())
                .positionGroup(record.getPositionGroup())
                .build();
    }
}

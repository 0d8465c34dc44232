package com.tony.staffAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Une ligne de l'historique : un coach, un rôle, une équipe, une saison.
 */
@Value
@Builder
@AllArgsConstructor
public class StaffRecord {
    int year;
    String team;
    long coachId;
    String coachName;
    String role;
    String sideOfBall;
    String roleSubcategory;
    String positionGroup;
    @With
    Double performanceValue; // null = pas de composite connu

    public RoleSide roleSide() {
        return RoleSide.of(role, sideOfBall);
    }
}

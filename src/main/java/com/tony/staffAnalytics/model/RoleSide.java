package com.tony.staffAnalytics.model;

import lombok.Value;

/**
 * Couple (catégorie de rôle, côté du ballon). Ex : (Offensive Coordinator, Offense), (Head Coach, Both).
 */
@Value
public class RoleSide {
    public static final String HEAD_COACH = "Head Coach";
    public static final String BOTH = "Both";

    String role;
    String side;

    public static RoleSide of(String role, String side) {
        return new RoleSide(role, side);
    }

    public boolean isHeadCoach() {
        return HEAD_COACH.equals(role);
    }

    public boolean isBothSides() {
        return BOTH.equals(side);
    }

    /** Clé de poste utilisée dans les exports, ex : "Offensive Coordinator_Offense". */
    public String positionKey() {
        return role + "_" + side;
    }

    @Override
    public String toString() {
        return role + " (" + side + ")";
    }
}

package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.model.ClosenessEntry;
import com.tony.staffAnalytics.model.ClosenessTable;
import com.tony.staffAnalytics.model.Coach;
import com.tony.staffAnalytics.model.RoleSide;
import com.tony.staffAnalytics.model.StaffRecord;

import java.util.List;

/**
 * Petit réseau de test partagé entre les classes de test.
 */
final class StaffFixtures {

    static final RoleSide HC = RoleSide.of("Head Coach", "Both");
    static final RoleSide OC = RoleSide.of("Offensive Coordinator", "Offense");
    static final RoleSide DC = RoleSide.of("Defensive Coordinator", "Defense");
    static final RoleSide QB = RoleSide.of("QB Coach", "Offense");
    static final RoleSide LB = RoleSide.of("LB Coach", "Defense");
    static final RoleSide ST = RoleSide.of("Special Teams Coordinator", "Both");

    private StaffFixtures() {
    }

    /** Échelle : HC 1.0, OC/DC 0.6, ST (Both) 0.5, QB/LB 0.2. */
    static ClosenessTable closenessTable() {
        return new ClosenessTable(List.of(
                new ClosenessEntry(HC, HC, 1.0, 1),
                new ClosenessEntry(OC, HC, 0.6, 2),
                new ClosenessEntry(DC, HC, 0.6, 2),
                new ClosenessEntry(ST, HC, 0.5, 3),
                new ClosenessEntry(QB, HC, 0.2, 4),
                new ClosenessEntry(LB, HC, 0.2, 4),
                new ClosenessEntry(QB, OC, 0.7, 1)
        ));
    }

    static Coach coach(long id, String name, RoleSide role, Double value) {
        return Coach.builder()
                .coachId(id)
                .name(name)
                .currentRole(role)
                .lastActiveYear(2024)
                .performanceValue(value)
                .build();
    }

    static StaffRecord record(int year, String team, long id, String name, RoleSide role, Double value) {
        return StaffRecord.builder()
                .year(year)
                .team(team)
                .coachId(id)
                .coachName(name)
                .role(role.getRole())
                .sideOfBall(role.getSide())
                .performanceValue(value)
                .build();
    }
}

package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.model.CompositeValue;
import com.tony.staffAnalytics.model.PerformanceKey;
import com.tony.staffAnalytics.model.StaffRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tony.staffAnalytics.service.StaffFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class CoalescingPerformanceResolverTest {

    private CoalescingPerformanceResolver resolver;

    @BeforeEach
    void setUp() {
        CompositeTable epa = new CompositeTable("epa", List.of(
                CompositeValue.builder().composite("epa").season(2023).team("kc")
                        .role("Offensive Coordinator").side("Offense").value(0.7).build()));
        CompositeTable wins = new CompositeTable("wins", List.of(
                CompositeValue.builder().composite("wins").season(2023).team("KC").value(0.5).build()));
        resolver = new CoalescingPerformanceResolver(List.of(epa, wins));
    }

    @Test
    @DisplayName("La première source qui connaît la clé l'emporte")
    void firstMatchingSourceShouldWin() {
        PerformanceKey oc = PerformanceKey.builder().season(2023).team("KC")
                .role("Offensive Coordinator").side("Offense").build();
        PerformanceKey qb = PerformanceKey.builder().season(2023).team("KC")
                .role("QB Coach").side("Offense").build();
        PerformanceKey other = PerformanceKey.builder().season(2022).team("KC").build();

        assertThat(resolver.resolve(oc).getAsDouble()).isEqualTo(0.7);
        assertThat(resolver.resolve(qb).getAsDouble()).isEqualTo(0.5);
        assertThat(resolver.resolve(other)).isEmpty();
    }

    @Test
    @DisplayName("Une valeur déjà présente n'est jamais écrasée")
    void enrichShouldOnlyFillMissingValues() {
        List<StaffRecord> enriched = resolver.enrich(List.of(
                record(2023, "KC", 1, "Alpha", OC, 0.9),
                record(2023, "KC", 2, "Bravo", OC, null),
                record(2021, "KC", 3, "Charlie", QB, null)));

        assertThat(enriched).extracting(StaffRecord::getPerformanceValue).containsExactly(0.9, 0.7, null);
    }
}

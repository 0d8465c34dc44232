package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.config.StaffBuilderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConnectionScorerTest {

    private ConnectionScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new ConnectionScorer(new StaffBuilderProperties());
    }

    @Test
    @DisplayName("Valeur manquante : 0.3 par défaut, jamais zéro")
    void missingValueShouldDefaultToPointThree() {
        assertThat(scorer.score(null, 1, 1)).isCloseTo(0.3, within(1e-9));
        assertThat(scorer.score(Double.NaN, 1, 2)).isCloseTo(0.15, within(1e-9));
    }

    @Test
    @DisplayName("3 saisons ensemble en direct : x2.0")
    void threeYearsDirectShouldDoubleTheValue() {
        assertThat(scorer.score(0.8, 3, 1)).isCloseTo(1.6, within(1e-9));
    }

    @Test
    @DisplayName("Paliers d'ancienneté et de distance")
    void multipliersShouldFollowSteps() {
        assertThat(scorer.tenureMultiplier(0)).isEqualTo(1.0);
        assertThat(scorer.tenureMultiplier(2)).isEqualTo(1.5);
        assertThat(scorer.tenureMultiplier(7)).isEqualTo(2.5);
        assertThat(scorer.degreeMultiplier(1)).isEqualTo(1.0);
        assertThat(scorer.degreeMultiplier(2)).isEqualTo(0.5);
        assertThat(scorer.degreeMultiplier(3)).isEqualTo(0.1);
    }

    @Test
    @DisplayName("Le score croît avec l'ancienneté et décroît avec la distance")
    void scoreShouldBeMonotonic() {
        double previous = 0;
        for (int years = 0; years <= 5; years++) {
            double s = scorer.score(0.5, years, 1);
            assertThat(s).isGreaterThanOrEqualTo(previous);
            previous = s;
        }
        assertThat(scorer.score(0.5, 2, 1)).isGreaterThan(scorer.score(0.5, 2, 2));
        assertThat(scorer.score(0.5, 2, 2)).isGreaterThan(scorer.score(0.5, 2, 3));
    }

    @Test
    @DisplayName("La valeur par défaut est configurable")
    void unknownValueShouldComeFromProperties() {
        StaffBuilderProperties props = new StaffBuilderProperties();
        props.setUnknownPerformanceValue(0.1);

        assertThat(new ConnectionScorer(props).score(null, 1, 1)).isCloseTo(0.1, within(1e-9));
    }
}

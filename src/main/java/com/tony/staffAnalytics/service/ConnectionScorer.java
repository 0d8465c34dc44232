package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.config.StaffBuilderProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ConnectionScorer {

    private final StaffBuilderProperties properties;

    /**
     * Score de connexion = performance x bonus d'ancienneté x pénalité de distance.
     *
     * @param coachValue    Valeur de performance du candidat (null = inconnue)
     * @param yearsTogether Saisons passées avec le head coach cible
     * @param degree        Distance réseau (1 = direct, 2 = indirect)
     */
    public double score(Double coachValue, int yearsTogether, int degree) {
        return performanceWeight(coachValue) * tenureMultiplier(yearsTogether) * degreeMultiplier(degree);
    }

    public double performanceWeight(Double coachValue) {
        return coachValue == null || coachValue.isNaN() ? unknownValue() : coachValue;
    }

    // 1 an = x1.0, 2 ans = x1.5, 3 ans = x2.0, 4+ ans = x2.5
    public double tenureMultiplier(int yearsTogether) {
        if (yearsTogether >= 4) return 2.5;
        if (yearsTogether == 3) return 2.0;
        if (yearsTogether == 2) return 1.5;
        return 1.0;
    }

    // On privilégie les connexions directes
    public double degreeMultiplier(int degree) {
        if (degree == 1) return 1.0;
        if (degree == 2) return 0.5;
        return 0.1;
    }

    private double unknownValue() {
        return properties != null ? properties.getUnknownPerformanceValue() : 0.3;
    }
}

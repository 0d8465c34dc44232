package com.tony.staffAnalytics.model;

import lombok.Value;

/**
 * Coach du voisinage de la cible, déjà scoré (le score ne dépend pas du poste visé).
 */
@Value
public class PoolCandidate {
    Coach coach;
    int degree;
    int yearsTogether;
    double connectionScore;

    public long getCoachId() {
        return coach.getCoachId();
    }
}

package com.tony.staffAnalytics.model;

import lombok.Value;

/**
 * Relation de co-staff entre deux coachs, toujours stockée avec coachId1 < coachId2.
 */
@Value
public class RelationshipEdge {
    long coachId1;
    long coachId2;
    int yearsTogether;
    Double averageValue1; // valeur moyenne du coach 1 sur les saisons partagées
    Double averageValue2;

    public RelationshipEdge(long coachId1, long coachId2, int yearsTogether, Double averageValue1, Double averageValue2) {
        if (coachId1 >= coachId2) {
            throw new IllegalArgumentException("Edge must be canonical (id1 < id2): " + coachId1 + "-" + coachId2);
        }
        this.coachId1 = coachId1;
        this.coachId2 = coachId2;
        this.yearsTogether = yearsTogether;
        this.averageValue1 = averageValue1;
        this.averageValue2 = averageValue2;
    }

    public boolean involves(long coachId) {
        return coachId1 == coachId || coachId2 == coachId;
    }

    public long otherCoach(long coachId) {
        if (coachId == coachId1) return coachId2;
        if (coachId == coachId2) return coachId1;
        throw new IllegalArgumentException("Coach " + coachId + " is not part of edge " + coachId1 + "-" + coachId2);
    }

    public Double averageValueOf(long coachId) {
        if (coachId == coachId1) return averageValue1;
        if (coachId == coachId2) return averageValue2;
        throw new IllegalArgumentException("Coach " + coachId + " is not part of edge " + coachId1 + "-" + coachId2);
    }

    /** Clé canonique d'une paire non ordonnée. */
    public static String pairKey(long a, long b) {
        return Math.min(a, b) + "-" + Math.max(a, b);
    }
}

package com.tony.staffAnalytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Agrégat d'un poste pour un head coach (tous les candidats listés, pas seulement le premier).
 */
@Value
@Builder
public class PositionAggregate {
    String headCoach;
    String positionKey;
    String targetPosition;
    String targetSide;
    double avgConnectionScore;
    double maxConnectionScore;
    int numCandidates;
    Double avgCoachValue;
    double avgYearsTogether;
    double pctDirectConnections;
}

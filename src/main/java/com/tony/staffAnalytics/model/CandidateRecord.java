package com.tony.staffAnalytics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * Un candidat évalué pour un poste ouvert d'un head coach donné.
 */
@Value
@Builder
public class CandidateRecord {
    long coachId;
    String candidateName;
    String currentRole;
    String currentSide;
    String targetPosition;
    String targetSide;
    int degree;
    int yearsTogether;
    Double coachValue;
    double connectionScore;
    boolean assigned;

    @JsonIgnore
    public String getPositionKey() {
        return targetPosition + "_" + targetSide;
    }
}

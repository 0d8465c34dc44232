package com.tony.staffAnalytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Un individu unique, décrit par son rôle le plus récent.
 */
@Value
@Builder
public class Coach {
    long coachId;
    String name;
    RoleSide currentRole;
    int lastActiveYear;
    Double performanceValue;
}

package com.tony.staffAnalytics.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Staff recommandé pour un head coach : top candidats par poste, dans l'ordre du catalogue.
 */
@Getter
public class StaffRecommendation {
    private final long headCoachId;
    private final String headCoachName;
    private final Map<String, List<CandidateRecord>> positions;

    public StaffRecommendation(long headCoachId, String headCoachName, Map<String, List<CandidateRecord>> positions) {
        this.headCoachId = headCoachId;
        this.headCoachName = headCoachName;
        Map<String, List<CandidateRecord>> copy = new LinkedHashMap<>();
        positions.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        this.positions = Collections.unmodifiableMap(copy);
    }

    public List<CandidateRecord> allCandidates() {
        List<CandidateRecord> all = new ArrayList<>();
        positions.values().forEach(all::addAll);
        return all;
    }

    /** Candidats retenus (un par poste). */
    public List<CandidateRecord> assignedCandidates() {
        return allCandidates().stream().filter(CandidateRecord::isAssigned).toList();
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }
}

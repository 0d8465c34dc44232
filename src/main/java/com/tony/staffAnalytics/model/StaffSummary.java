package com.tony.staffAnalytics.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Résumé d'un staff recommandé (meilleur candidat de chaque poste) et ses rangs dans la comparaison.
 */
@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "staff_summary", indexes = {
        @Index(columnList = "runId")
})
public class StaffSummary {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Identifiant du run d'agrégation
    @Column(nullable = false)
    private String runId;

    @Column(nullable = false)
    private String headCoach;
    private String sourceFile;

    private int totalPositions;
    private double avgConnectionScore;
    private double medianConnectionScore;
    private Double avgCoachValue;       // null si aucun candidat n'a de valeur connue
    private double avgYearsTogether;
    private double pctDirectConnections;
    private double pctQualityCandidates;
    private int totalYearsExperience;
    private double top3AvgScore;
    private Double coordinatorAvgScore; // null si aucun poste de coordinateur

    // --- Classements ---
    private Integer overallRank;
    private Integer coordinatorRank;
    private Integer experienceRank;

    private LocalDateTime createdAt;

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StaffSummary)) return false;
        return id != null && id.equals(((StaffSummary) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}

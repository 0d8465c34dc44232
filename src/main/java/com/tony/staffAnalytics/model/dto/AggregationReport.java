package com.tony.staffAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tony.staffAnalytics.model.CandidateRecord;
import com.tony.staffAnalytics.model.PositionAggregate;
import com.tony.staffAnalytics.model.ScoreMatrix;
import com.tony.staffAnalytics.model.StaffSummary;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class AggregationReport {
    private String runId;
    private List<StaffSummary> rankings;          // triés par rang général
    private List<PositionAggregate> positionAggregates;
    @JsonIgnore
    private ScoreMatrix scoreMatrix;
    @JsonIgnore
    private Map<String, List<CandidateRecord>> candidatesByHeadCoach;
    private List<String> skippedFiles;

    // --- Statistiques globales ---
    private int totalHeadCoaches;
    private int totalPositions;
    private int totalCandidates;
    private double averageStaffScore;
    private double bestStaffScore;
    private String bestStaff;
    private double worstStaffScore;
}

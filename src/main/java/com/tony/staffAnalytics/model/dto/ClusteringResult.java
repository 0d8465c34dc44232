package com.tony.staffAnalytics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class ClusteringResult {
    private int k;
    private List<Double> elbowCurve; // WSS pour k = 1..maxK
    private List<ClusterAssignment> assignments;
}

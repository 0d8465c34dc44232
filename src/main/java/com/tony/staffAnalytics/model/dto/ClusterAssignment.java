package com.tony.staffAnalytics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ClusterAssignment {
    private String name;
    private double compositeValue; // Valeur personnelle
    private double staffValue;     // Valeur moyenne du staff recommandé
    private int cluster;           // 1..k, par centroïde croissant
}

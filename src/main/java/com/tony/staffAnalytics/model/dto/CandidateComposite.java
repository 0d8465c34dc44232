package com.tony.staffAnalytics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CandidateComposite {
    private String name;
    private double compositeValue; // Valeur personnelle du candidat HC
}

package com.tony.staffAnalytics.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "staff.builder")
@Data
@Validated
public class StaffBuilderProperties {
    // --- Recherche dans le réseau ---
    @Min(1)
    private int maxDegree = 2;          // 2 = amis d'amis
    private int recencyCutoffYear = 2024; // Un coach doit être actif depuis cette saison pour être un noeud

    // --- Promotion de rôle ---
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double promotionStep = 0.4; // Un seul échelon au-dessus max

    // --- Score de connexion ---
    private double unknownPerformanceValue = 0.3; // Coach sans valeur connue (pas zéro !)
    @Min(1)
    private int candidatesPerPosition = 5;

    // --- Agrégation ---
    private double minQualityScore = 0.5;

    // --- Clustering ---
    @Min(0)
    private int clusterCount = 3;       // 0 = choix automatique par la méthode du coude
    @Min(1)
    private int maxElbowK = 20;
    private int kmeansStarts = 25;
    private long randomSeed = 42L;

    // --- Fichiers ---
    @NotBlank
    private String staffRecordsPath = "data/staff_records.csv";
    @NotBlank
    private String closenessPath = "data/closeness_mapping.csv";
    private String performancePath = "";  // Optionnel : composites de performance
    private String candidatesPath = "data/coaching_candidates.csv";
    @NotBlank
    private String outputDirectory = "staff_recommendations";
}

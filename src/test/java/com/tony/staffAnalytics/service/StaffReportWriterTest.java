package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.model.CandidateRecord;
import com.tony.staffAnalytics.model.PositionAggregate;
import com.tony.staffAnalytics.model.ScoreMatrix;
import com.tony.staffAnalytics.model.StaffSummary;
import com.tony.staffAnalytics.model.dto.AggregationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.tony.staffAnalytics.service.StaffMetricsCalculatorTest.candidate;
import static org.assertj.core.api.Assertions.assertThat;

class StaffReportWriterTest {

    private final StaffReportWriter writer = new StaffReportWriter();

    @TempDir
    Path tempDir;

    private AggregationReport report;

    @BeforeEach
    void setUp() {
        List<PositionAggregate> aggregates = List.of(
                aggregate("Alpha", "Offensive Coordinator", 1.6, 0.8),
                aggregate("Alpha", "QB Coach", 0.4, null),
                aggregate("Bravo", "Offensive Coordinator", 0.15, 0.2));

        StaffSummary alpha = StaffSummary.builder().headCoach("Alpha").sourceFile("Alpha_staff_recommendations.csv")
                .totalPositions(2).avgConnectionScore(1.0).medianConnectionScore(1.0).avgCoachValue(0.8)
                .top3AvgScore(1.0).coordinatorAvgScore(1.6).overallRank(1).coordinatorRank(1).experienceRank(1)
                .totalYearsExperience(4).build();
        StaffSummary bravo = StaffSummary.builder().headCoach("Bravo").sourceFile("Bravo_staff_recommendations.csv")
                .totalPositions(1).avgConnectionScore(0.15).medianConnectionScore(0.15)
                .top3AvgScore(0.15).overallRank(2).coordinatorRank(null).experienceRank(2).build();

        Map<String, List<CandidateRecord>> candidates = new LinkedHashMap<>();
        candidates.put("Alpha", List.of(candidate(2, "Offensive Coordinator", "Offense", 1, 3, 0.8, 1.6)));
        candidates.put("Bravo", List.of(candidate(7, "Offensive Coordinator", "Offense", 2, 0, null, 0.15)));

        report = AggregationReport.builder()
                .rankings(List.of(alpha, bravo))
                .positionAggregates(aggregates)
                .scoreMatrix(new ScoreMatrix(aggregates, List.of("Alpha", "Bravo")))
                .candidatesByHeadCoach(candidates)
                .build();
    }

    @Test
    @DisplayName("Les quatre fichiers de comparaison sont écrits")
    void shouldWriteFourComparisonFiles() throws IOException {
        List<Path> written = writer.write(report, tempDir.resolve("comparison"));

        assertThat(written).extracting(p -> p.getFileName().toString()).containsExactly(
                StaffReportWriter.COMPARISON_FILE, StaffReportWriter.RANKINGS_FILE,
                StaffReportWriter.ALL_CANDIDATES_FILE, StaffReportWriter.MATRIX_FILE);
        assertThat(written).allMatch(Files::isRegularFile);
    }

    @Test
    @DisplayName("Matrice exportée : 0.000000 là où aucun candidat n'a été trouvé")
    void matrixFileShouldBeZeroFilled() throws IOException {
        writer.write(report, tempDir);

        List<String> lines = Files.readAllLines(tempDir.resolve(StaffReportWriter.MATRIX_FILE));

        assertThat(lines).containsExactly(
                "position_key,Alpha,Bravo",
                "Offensive Coordinator_Offense,1.600000,0.150000",
                "QB Coach_Offense,0.400000,0.000000");
    }

    @Test
    @DisplayName("Classement exporté : NA pour les valeurs et rangs manquants")
    void rankingsFileShouldWriteNaForMissingValues() throws IOException {
        writer.write(report, tempDir);

        List<String> lines = Files.readAllLines(tempDir.resolve(StaffReportWriter.RANKINGS_FILE));

        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).startsWith("target_hc,filename,total_positions,avg_connection_score");
        assertThat(lines.get(1)).startsWith("Alpha,Alpha_staff_recommendations.csv,2,1.000000")
                .endsWith(",1.600000,1,1,1");
        // avg_coach_value, coordinator_avg_score et coordinator_rank manquants
        assertThat(lines.get(2).split(",")).containsSubsequence("0.150000", "NA").endsWith("0.150000", "NA", "2", "NA", "2");
    }

    @Test
    @DisplayName("Agrégats par poste et liste complète des candidats")
    void positionAndCandidateFilesShouldListEveryRow() throws IOException {
        writer.write(report, tempDir);

        List<String> comparison = Files.readAllLines(tempDir.resolve(StaffReportWriter.COMPARISON_FILE));
        List<String> all = Files.readAllLines(tempDir.resolve(StaffReportWriter.ALL_CANDIDATES_FILE));

        assertThat(comparison).hasSize(4);
        assertThat(comparison.get(2)).isEqualTo(
                "Alpha,QB Coach_Offense,0.400000,0.400000,1,NA,1.000000,100.000000,QB Coach,Offense");
        assertThat(all).hasSize(3);
        assertThat(all.get(2)).isEqualTo(
                "Bravo,Offensive Coordinator_Offense,7,Coach 7,QB Coach,Offense,Offensive Coordinator,Offense,2,0,NA,0.150000");
    }

    private static PositionAggregate aggregate(String headCoach, String position, double score, Double value) {
        String side = "Offense";
        return PositionAggregate.builder()
                .headCoach(headCoach)
                .positionKey(position + "_" + side)
                .targetPosition(position)
                .targetSide(side)
                .avgConnectionScore(score)
                .maxConnectionScore(score)
                .numCandidates(1)
                .avgCoachValue(value)
                .avgYearsTogether(1.0)
                .pctDirectConnections(100.0)
                .build();
    }
}

package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.config.StaffBuilderProperties;
import com.tony.staffAnalytics.model.CandidateRecord;
import com.tony.staffAnalytics.model.StaffSummary;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

@Service
@RequiredArgsConstructor
public class StaffMetricsCalculator {

    static final Comparator<CandidateRecord> BY_SCORE = Comparator
            .comparingDouble(CandidateRecord::getConnectionScore).reversed()
            .thenComparingLong(CandidateRecord::getCoachId);

    private final StaffBuilderProperties properties;

    /**
     * Meilleur candidat de chaque (poste, côté), dans l'ordre d'apparition des postes.
     */
    public List<CandidateRecord> topCandidates(List<CandidateRecord> candidates) {
        Map<String, CandidateRecord> best = new LinkedHashMap<>();
        for (CandidateRecord c : candidates) {
            best.merge(c.getPositionKey(), c, (a, b) -> BY_SCORE.compare(a, b) <= 0 ? a : b);
        }
        return new ArrayList<>(best.values());
    }

    /**
     * Statistiques du staff d'un head coach. Les rangs restent vides (voir RankingService).
     */
    public StaffSummary summarize(String headCoach, String sourceFile, List<CandidateRecord> candidates) {
        List<CandidateRecord> top = topCandidates(candidates);
        StaffSummary.StaffSummaryBuilder summary = StaffSummary.builder()
                .headCoach(headCoach)
                .sourceFile(sourceFile)
                .totalPositions(top.size());

        if (top.isEmpty()) {
            // Aucun candidat trouvé : staff vide, pas une erreur
            return summary.build();
        }

        double[] scores = top.stream().mapToDouble(CandidateRecord::getConnectionScore).toArray();
        int n = top.size();
        int totalYears = top.stream().mapToInt(CandidateRecord::getYearsTogether).sum();
        long direct = top.stream().filter(c -> c.getDegree() == 1).count();
        long quality = top.stream().filter(c -> c.getConnectionScore() >= properties.getMinQualityScore()).count();

        List<CandidateRecord> coordinators = top.stream()
                .filter(c -> c.getTargetPosition() != null && c.getTargetPosition().contains("Coordinator"))
                .toList();

        OptionalDouble avgValue = top.stream()
                .filter(c -> c.getCoachValue() != null && !c.getCoachValue().isNaN())
                .mapToDouble(CandidateRecord::getCoachValue)
                .average();

        return summary
                .avgConnectionScore(mean(scores))
                .medianConnectionScore(new Median().evaluate(scores))
                .avgCoachValue(avgValue.isPresent() ? avgValue.getAsDouble() : null)
                .avgYearsTogether((double) totalYears / n)
                .pctDirectConnections(direct * 100.0 / n)
                .pctQualityCandidates(quality * 100.0 / n)
                .totalYearsExperience(totalYears)
                .top3AvgScore(top.stream().sorted(BY_SCORE).limit(3)
                        .mapToDouble(CandidateRecord::getConnectionScore).average().orElse(0.0))
                .coordinatorAvgScore(coordinators.isEmpty() ? null
                        : coordinators.stream().mapToDouble(CandidateRecord::getConnectionScore).average().orElse(0.0))
                .build();
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return values.length == 0 ? 0.0 : sum / values.length;
    }
}

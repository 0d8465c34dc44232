package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.model.CandidateRecord;
import com.tony.staffAnalytics.model.PositionAggregate;
import com.tony.staffAnalytics.model.ScoreMatrix;
import com.tony.staffAnalytics.model.StaffRecommendation;
import com.tony.staffAnalytics.model.StaffSummary;
import com.tony.staffAnalytics.model.dto.AggregationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Stream;

/**
 * Compare les staffs recommandés de plusieurs head coachs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StaffAggregationService {

    private final RecommendationFileService recommendationFileService;
    private final StaffMetricsCalculator metricsCalculator;
    private final RankingService rankingService;

    /**
     * Agrège tous les CSV d'un dossier. Un fichier illisible est ignoré, le lot continue.
     */
    public AggregationReport aggregateDirectory(Path directory, String runId) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalStateException("Dossier de recommandations introuvable : " + directory.toAbsolutePath());
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(p -> p.getFileName().toString().toLowerCase().endsWith(".csv"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Impossible de lister " + directory, e);
        }
        if (files.isEmpty()) {
            throw new IllegalStateException("Aucun fichier CSV trouvé dans " + directory.toAbsolutePath());
        }
        log.info("📂 {} fichiers CSV à traiter dans {}", files.size(), directory);

        Map<String, List<CandidateRecord>> staffs = new LinkedHashMap<>();
        Map<String, String> sources = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            try {
                String headCoach = RecommendationFileService.headCoachFromFileName(fileName);
                if (staffs.containsKey(headCoach)) {
                    // Deux fichiers pour le même head coach : le premier (ordre alphabétique) est gardé
                    skipped.add(fileName);
                    log.warn("⚠️ {} ignoré : {} déjà chargé depuis {}", fileName, headCoach, sources.get(headCoach));
                    continue;
                }
                List<CandidateRecord> candidates = recommendationFileService.read(file);
                staffs.put(headCoach, candidates);
                sources.put(headCoach, fileName);
                log.info("✓ Traité : {} ({} candidats)", headCoach, candidates.size());
            } catch (Exception e) {
                skipped.add(fileName);
                log.warn("✗ Erreur sur {} : {}", fileName, e.getMessage());
            }
        }
        if (staffs.isEmpty()) {
            throw new IllegalStateException("Aucune donnée valide dans " + directory.toAbsolutePath());
        }
        return aggregate(staffs, sources, skipped, runId);
    }

    /** Agrège des recommandations calculées en mémoire. */
    public AggregationReport aggregateRecommendations(List<StaffRecommendation> recommendations, String runId) {
        Map<String, List<CandidateRecord>> staffs = new LinkedHashMap<>();
        for (StaffRecommendation r : recommendations) {
            staffs.put(r.getHeadCoachName(), r.allCandidates());
        }
        return aggregate(staffs, Map.of(), List.of(), runId);
    }

    private AggregationReport aggregate(Map<String, List<CandidateRecord>> staffs,
                                        Map<String, String> sources,
                                        List<String> skipped,
                                        String runId) {
        // 1. Résumé par head coach puis classement
        List<StaffSummary> summaries = new ArrayList<>();
        staffs.forEach((hc, candidates) ->
                summaries.add(metricsCalculator.summarize(hc, sources.get(hc), candidates)));
        List<StaffSummary> rankings = rankingService.updateRankings(runId, summaries);

        // 2. Agrégats par (head coach, poste) et matrice de comparaison
        List<PositionAggregate> aggregates = new ArrayList<>();
        staffs.forEach((hc, candidates) -> aggregates.addAll(positionAggregates(hc, candidates)));
        ScoreMatrix matrix = new ScoreMatrix(aggregates, new ArrayList<>(staffs.keySet()));

        int totalCandidates = staffs.values().stream().mapToInt(List::size).sum();
        AggregationReport.AggregationReportBuilder report = AggregationReport.builder()
                .runId(runId)
                .rankings(rankings)
                .positionAggregates(aggregates)
                .scoreMatrix(matrix)
                .candidatesByHeadCoach(staffs)
                .skippedFiles(skipped)
                .totalHeadCoaches(rankings.size())
                .totalPositions(matrix.getPositionKeys().size())
                .totalCandidates(totalCandidates);

        if (!rankings.isEmpty()) {
            report.averageStaffScore(rankings.stream().mapToDouble(StaffSummary::getAvgConnectionScore).average().orElse(0.0))
                    .bestStaffScore(rankings.get(0).getAvgConnectionScore())
                    .bestStaff(rankings.get(0).getHeadCoach())
                    .worstStaffScore(rankings.get(rankings.size() - 1).getAvgConnectionScore());
        }

        AggregationReport built = report.build();
        log.info("📊 {} head coachs analysés, {} postes, {} candidats. Meilleur staff : {} ({})",
                built.getTotalHeadCoaches(), built.getTotalPositions(), built.getTotalCandidates(),
                built.getBestStaff(), String.format("%.3f", built.getBestStaffScore()));
        return built;
    }

    /**
     * Un agrégat par poste, sur tous les candidats listés pour ce poste.
     */
    public List<PositionAggregate> positionAggregates(String headCoach, List<CandidateRecord> candidates) {
        Map<String, List<CandidateRecord>> byPosition = new LinkedHashMap<>();
        for (CandidateRecord c : candidates) {
            byPosition.computeIfAbsent(c.getPositionKey(), k -> new ArrayList<>()).add(c);
        }

        List<PositionAggregate> result = new ArrayList<>();
        byPosition.forEach((key, list) -> {
            int n = list.size();
            OptionalDouble avgValue = list.stream()
                    .filter(c -> c.getCoachValue() != null && !c.getCoachValue().isNaN())
                    .mapToDouble(CandidateRecord::getCoachValue)
                    .average();
            result.add(PositionAggregate.builder()
                    .headCoach(headCoach)
                    .positionKey(key)
                    .targetPosition(list.get(0).getTargetPosition())
                    .targetSide(list.get(0).getTargetSide())
                    .avgConnectionScore(list.stream().mapToDouble(CandidateRecord::getConnectionScore).average().orElse(0.0))
                    .maxConnectionScore(list.stream().mapToDouble(CandidateRecord::getConnectionScore).max().orElse(0.0))
                    .numCandidates(n)
                    .avgCoachValue(avgValue.isPresent() ? avgValue.getAsDouble() : null)
                    .avgYearsTogether(list.stream().mapToInt(CandidateRecord::getYearsTogether).average().orElse(0.0))
                    .pctDirectConnections(list.stream().filter(c -> c.getDegree() == 1).count() * 100.0 / n)
                    .build());
        });
        return result;
    }
}

package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.config.StaffBuilderProperties;
import com.tony.staffAnalytics.exception.CoachNotFoundException;
import com.tony.staffAnalytics.model.NetworkSnapshot;
import com.tony.staffAnalytics.model.StaffRecommendation;
import com.tony.staffAnalytics.model.dto.AggregationReport;
import com.tony.staffAnalytics.model.dto.BatchStaffResult;
import com.tony.staffAnalytics.model.dto.CandidateComposite;
import com.tony.staffAnalytics.model.dto.ClusteringResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Enchaîne les étapes : staff par head coach -> comparaison -> clustering.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisOrchestrator {

    static final String COMPARISON_DIR = "comparison";

    private final CoachingNetworkService networkService;
    private final StaffAssembler staffAssembler;
    private final RecommendationFileService recommendationFileService;
    private final StaffAggregationService aggregationService;
    private final StaffReportWriter reportWriter;
    private final CandidateClusteringService clusteringService;
    private final StaffDataImportService importService;
    private final RankingService rankingService;
    private final StaffBuilderProperties properties;

    /**
     * Construit et sauvegarde le staff d'un head coach.
     *
     * @throws CoachNotFoundException si le coach n'est pas dans le réseau
     */
    public StaffRecommendation buildStaff(String headCoach, Integer maxDegree) {
        NetworkSnapshot network = networkService.current();
        int degree = maxDegree != null ? maxDegree : properties.getMaxDegree();
        StaffRecommendation recommendation = staffAssembler.assemble(network, headCoach, degree);
        try {
            recommendationFileService.write(recommendation, outputDirectory());
        } catch (IOException e) {
            throw new UncheckedIOException("Écriture impossible pour " + headCoach, e);
        }
        return recommendation;
    }

    /**
     * Un coach introuvable n'interrompt que son propre run.
     */
    public BatchStaffResult buildStaffs(List<String> headCoaches) {
        BatchStaffResult result = new BatchStaffResult();
        log.info("🔄 Orchestrator: construction de {} staffs...", headCoaches.size());
        for (String headCoach : headCoaches) {
            try {
                StaffRecommendation rec = buildStaff(headCoach, null);
                result.getBuiltFiles().add(RecommendationFileService.fileNameFor(rec.getHeadCoachName()));
            } catch (CoachNotFoundException e) {
                log.warn("⚠️ {}", e.getMessage());
                result.getFailures().put(headCoach, e.getMessage());
            } catch (UncheckedIOException e) {
                log.error("❌ Échec du staff de {}", headCoach, e);
                result.getFailures().put(headCoach, e.getMessage());
            }
        }
        log.info("✅ Orchestrator: {} staffs construits, {} échecs.",
                result.getBuiltFiles().size(), result.getFailures().size());
        return result;
    }

    /**
     * Compare tous les fichiers de recommandations du dossier de sortie et écrit les rapports
     * dans son sous-dossier "comparison".
     */
    public AggregationReport aggregateOutputs() {
        String runId = UUID.randomUUID().toString();
        AggregationReport report = aggregationService.aggregateDirectory(outputDirectory(), runId);
        try {
            reportWriter.write(report, outputDirectory().resolve(COMPARISON_DIR));
        } catch (IOException e) {
            throw new UncheckedIOException("Écriture des rapports de comparaison impossible", e);
        }
        return report;
    }

    /**
     * Clustering des candidats sur le dernier classement sauvegardé.
     */
    public ClusteringResult clusterCandidates() {
        List<CandidateComposite> composites = importService.importCandidateComposites(Path.of(properties.getCandidatesPath()));
        return clusteringService.cluster(composites, rankingService.latestRankings());
    }

    private Path outputDirectory() {
        return Path.of(properties.getOutputDirectory());
    }
}

package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.config.StaffBuilderProperties;
import com.tony.staffAnalytics.exception.CoachNotFoundException;
import com.tony.staffAnalytics.model.StaffRecommendation;
import com.tony.staffAnalytics.model.StaffSummary;
import com.tony.staffAnalytics.model.dto.AggregationReport;
import com.tony.staffAnalytics.model.dto.BatchStaffResult;
import com.tony.staffAnalytics.model.dto.CandidateComposite;
import com.tony.staffAnalytics.model.dto.ClusteringResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnalysisOrchestratorTest {

    @Mock private CoachingNetworkService networkService;
    @Mock private StaffAssembler staffAssembler;
    @Mock private RecommendationFileService fileService;
    @Mock private StaffAggregationService aggregationService;
    @Mock private StaffReportWriter reportWriter;
    @Mock private CandidateClusteringService clusteringService;
    @Mock private StaffDataImportService importService;
    @Mock private RankingService rankingService;

    @TempDir
    Path tempDir;

    private StaffBuilderProperties props;
    private AnalysisOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        props = new StaffBuilderProperties();
        props.setOutputDirectory(tempDir.toString());
        orchestrator = new AnalysisOrchestrator(networkService, staffAssembler, fileService, aggregationService,
                reportWriter, clusteringService, importService, rankingService, props);
    }

    @Test
    @DisplayName("Batch : un head coach introuvable n'arrête pas les autres")
    void missingCoachShouldOnlyAbortItsOwnRun() throws IOException {
        StaffRecommendation alpha = new StaffRecommendation(1, "Alpha One", Map.of());
        when(staffAssembler.assemble(any(), eq("Ghost"), anyInt())).thenThrow(new CoachNotFoundException("Ghost"));
        when(staffAssembler.assemble(any(), eq("Alpha One"), anyInt())).thenReturn(alpha);

        BatchStaffResult result = orchestrator.buildStaffs(List.of("Ghost", "Alpha One"));

        assertThat(result.getBuiltFiles()).containsExactly("Alpha_One_staff_recommendations.csv");
        assertThat(result.getFailures()).containsOnlyKeys("Ghost");
        verify(fileService, times(1)).write(alpha, tempDir);
    }

    @Test
    @DisplayName("Sans degré explicite, le degré configuré est utilisé")
    void defaultDegreeShouldComeFromProperties() {
        StaffRecommendation alpha = new StaffRecommendation(1, "Alpha One", Map.of());
        when(staffAssembler.assemble(any(), eq("Alpha One"), eq(2))).thenReturn(alpha);

        assertThat(orchestrator.buildStaff("Alpha One", null)).isSameAs(alpha);
    }

    @Test
    @DisplayName("Comparaison : rapports écrits dans le sous-dossier comparison")
    void aggregateOutputsShouldWriteReports() throws IOException {
        AggregationReport report = AggregationReport.builder().runId("run-1").build();
        when(aggregationService.aggregateDirectory(eq(tempDir), anyString())).thenReturn(report);

        assertThat(orchestrator.aggregateOutputs()).isSameAs(report);
        verify(reportWriter, times(1)).write(report, tempDir.resolve("comparison"));
    }

    @Test
    @DisplayName("Clustering sur les composites candidats et le dernier classement")
    void clusterCandidatesShouldUseLatestRankings() {
        props.setCandidatesPath(tempDir.resolve("candidates.csv").toString());
        List<CandidateComposite> composites = List.of(new CandidateComposite("Alpha One", 0.7));
        List<StaffSummary> latest = List.of(StaffSummary.builder().headCoach("Alpha One").avgCoachValue(0.5).build());
        ClusteringResult expected = new ClusteringResult(1, List.of(0.0), List.of());
        when(importService.importCandidateComposites(tempDir.resolve("candidates.csv"))).thenReturn(composites);
        when(rankingService.latestRankings()).thenReturn(latest);
        when(clusteringService.cluster(composites, latest)).thenReturn(expected);

        assertThat(orchestrator.clusterCandidates()).isSameAs(expected);
    }
}

package com.tony.staffAnalytics.controller;

import com.tony.staffAnalytics.exception.CoachNotFoundException;
import com.tony.staffAnalytics.model.StaffRecommendation;
import com.tony.staffAnalytics.model.StaffSummary;
import com.tony.staffAnalytics.model.dto.AggregationReport;
import com.tony.staffAnalytics.model.dto.BatchStaffResult;
import com.tony.staffAnalytics.model.dto.ClusteringResult;
import com.tony.staffAnalytics.model.dto.NetworkStats;
import com.tony.staffAnalytics.service.AnalysisOrchestrator;
import com.tony.staffAnalytics.service.CoachingNetworkService;
import com.tony.staffAnalytics.service.RankingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/staff")
@RequiredArgsConstructor
@Slf4j
public class StaffController {

    private final AnalysisOrchestrator orchestrator;
    private final CoachingNetworkService networkService;
    private final RankingService rankingService;

    /**
     * Exemple : POST /api/v1/staff/recommendations?coach=Jim Schwartz&maxDegree=2
     */
    @PostMapping("/recommendations")
    public ResponseEntity<?> buildStaff(@RequestParam String coach,
                                        @RequestParam(required = false) Integer maxDegree) {
        if (maxDegree != null && maxDegree < 1) {
            return ResponseEntity.badRequest().body(Map.of("error", "maxDegree doit être >= 1"));
        }
        try {
            StaffRecommendation recommendation = orchestrator.buildStaff(coach, maxDegree);
            return ResponseEntity.ok(recommendation);
        } catch (CoachNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/recommendations/batch")
    public ResponseEntity<BatchStaffResult> buildStaffs(@RequestBody List<String> coaches) {
        return ResponseEntity.ok(orchestrator.buildStaffs(coaches));
    }

    @PostMapping("/aggregate")
    public ResponseEntity<?> aggregate() {
        log.info("📊 Comparaison des staffs demandée");
        try {
            AggregationReport report = orchestrator.aggregateOutputs();
            return ResponseEntity.ok(report);
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/rankings")
    public ResponseEntity<List<StaffSummary>> getRankings() {
        return ResponseEntity.ok(rankingService.latestRankings());
    }

    @GetMapping("/rankings/{headCoach}/history")
    public ResponseEntity<List<StaffSummary>> getRankingHistory(@PathVariable String headCoach) {
        return ResponseEntity.ok(rankingService.history(headCoach));
    }

    @GetMapping("/network/stats")
    public ResponseEntity<NetworkStats> getNetworkStats() {
        return ResponseEntity.ok(networkService.stats());
    }

    @PostMapping("/network/reload")
    public ResponseEntity<?> reloadNetwork() {
        try {
            networkService.reload();
            return ResponseEntity.ok(Map.of("message", "Réseau rechargé avec succès !"));
        } catch (IllegalStateException e) {
            log.error("❌ Rechargement du réseau impossible", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/clusters")
    public ResponseEntity<?> clusterCandidates() {
        try {
            ClusteringResult result = orchestrator.clusterCandidates();
            return ResponseEntity.ok(result);
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("error", e.getMessage()));
        }
    }
}

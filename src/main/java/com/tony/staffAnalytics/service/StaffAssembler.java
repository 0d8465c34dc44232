package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.config.StaffBuilderProperties;
import com.tony.staffAnalytics.exception.CoachNotFoundException;
import com.tony.staffAnalytics.model.CandidateRecord;
import com.tony.staffAnalytics.model.CoStaffGraph;
import com.tony.staffAnalytics.model.Coach;
import com.tony.staffAnalytics.model.NetworkSnapshot;
import com.tony.staffAnalytics.model.PoolCandidate;
import com.tony.staffAnalytics.model.RelationshipEdge;
import com.tony.staffAnalytics.model.RoleSide;
import com.tony.staffAnalytics.model.StaffRecommendation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class StaffAssembler {

    private final ConnectionScorer connectionScorer;
    private final AssignmentStrategy assignmentStrategy;
    private final StaffBuilderProperties properties;

    public StaffRecommendation assemble(NetworkSnapshot network, String targetHeadCoach) {
        return assemble(network, targetHeadCoach, properties.getMaxDegree());
    }

    /**
     * Construit le staff recommandé d'un head coach.
     *
     * @param targetHeadCoach nom du coach, ou son coach_id
     * @param maxDegree       distance réseau maximale (2 = amis d'amis)
     * @throws CoachNotFoundException si la cible n'est pas un noeud du graphe
     */
    public StaffRecommendation assemble(NetworkSnapshot network, String targetHeadCoach, int maxDegree) {
        CoStaffGraph graph = network.getGraph();
        Coach target = resolveTarget(graph, targetHeadCoach);
        RolePromotionMapper mapper = network.getPromotionMapper();

        log.info("🔎 Recherche des candidats à {} degré(s) de {}...", maxDegree, target.getName());

        // 1. Pool : tout le voisinage à distance <= maxDegree
        List<PoolCandidate> pool = new ArrayList<>();
        for (Map.Entry<Long, Integer> entry : graph.neighborsWithin(target.getCoachId(), maxDegree).entrySet()) {
            Coach candidate = graph.coach(entry.getKey()).orElseThrow();
            int degree = entry.getValue();
            // Ancienneté avec la cible uniquement (0 si pas de lien direct)
            int yearsTogether = graph.edge(target.getCoachId(), candidate.getCoachId())
                    .map(RelationshipEdge::getYearsTogether)
                    .orElse(0);
            double score = connectionScorer.score(candidate.getPerformanceValue(), yearsTogether, degree);
            pool.add(new PoolCandidate(candidate, degree, yearsTogether, score));
        }

        // 2. Affectation poste par poste
        List<RoleSide> positions = mapper.openPositions();
        Map<String, List<CandidateRecord>> byPosition = assignmentStrategy.assign(
                positions,
                pool,
                (candidate, position) -> mapper.canFill(candidate.getCoach().getCurrentRole(), position),
                properties.getCandidatesPerPosition());

        log.info("✅ Staff de {} : {} candidats dans le voisinage, {}/{} postes pourvus.",
                target.getName(), pool.size(), byPosition.size(), positions.size());
        return new StaffRecommendation(target.getCoachId(), target.getName(), byPosition);
    }

    /**
     * Recherche par nom d'abord, puis par coach_id si la chaîne est numérique.
     */
    static Coach resolveTarget(CoStaffGraph graph, String targetHeadCoach) {
        if (targetHeadCoach == null || targetHeadCoach.isBlank()) {
            throw new CoachNotFoundException(String.valueOf(targetHeadCoach));
        }
        String key = targetHeadCoach.trim();
        return graph.findByName(key)
                .or(() -> parseId(key).flatMap(graph::coach))
                .orElseThrow(() -> new CoachNotFoundException(key));
    }

    private static Optional<Long> parseId(String raw) {
        try {
            return Optional.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}

package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.model.CandidateRecord;
import com.tony.staffAnalytics.model.Coach;
import com.tony.staffAnalytics.model.PoolCandidate;
import com.tony.staffAnalytics.model.RoleSide;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Affectation gloutonne poste par poste, sans retour arrière : le meilleur candidat d'un poste
 * est retiré du pool pour les postes suivants. Dépend donc de l'ordre du catalogue.
 * Égalité de score : le plus petit coach_id passe devant.
 */
@Component
public class GreedyAssignmentStrategy implements AssignmentStrategy {

    static final Comparator<PoolCandidate> BY_SCORE = Comparator
            .comparingDouble(PoolCandidate::getConnectionScore).reversed()
            .thenComparingLong(PoolCandidate::getCoachId);

    @Override
    public Map<String, List<CandidateRecord>> assign(List<RoleSide> positions,
                                                     List<PoolCandidate> pool,
                                                     BiPredicate<PoolCandidate, RoleSide> eligible,
                                                     int candidatesPerPosition) {
        Map<String, List<CandidateRecord>> result = new LinkedHashMap<>();
        Set<Long> assigned = new HashSet<>();

        for (RoleSide position : positions) {
            List<PoolCandidate> ranked = pool.stream()
                    .filter(c -> !assigned.contains(c.getCoachId()))
                    .filter(c -> eligible.test(c, position))
                    .sorted(BY_SCORE)
                    .toList();
            if (ranked.isEmpty()) continue; // Poste sans candidat : pas de ligne

            assigned.add(ranked.get(0).getCoachId());

            List<CandidateRecord> top = new ArrayList<>();
            for (int i = 0; i < Math.min(candidatesPerPosition, ranked.size()); i++) {
                top.add(toRecord(ranked.get(i), position, i == 0));
            }
            result.put(position.positionKey(), top);
        }
        return result;
    }

    private CandidateRecord toRecord(PoolCandidate candidate, RoleSide position, boolean assigned) {
        Coach coach = candidate.getCoach();
        return CandidateRecord.builder()
                .coachId(coach.getCoachId())
                .candidateName(coach.getName())
                .currentRole(coach.getCurrentRole().getRole())
                .currentSide(coach.getCurrentRole().getSide())
                .targetPosition(position.getRole())
                .targetSide(position.getSide())
                .degree(candidate.getDegree())
                .yearsTogether(candidate.getYearsTogether())
                .coachValue(coach.getPerformanceValue())
                .connectionScore(candidate.getConnectionScore())
                .assigned(assigned)
                .build();
    }
}

package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.model.StaffSummary;
import com.tony.staffAnalytics.repository.StaffSummaryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

@Service
@RequiredArgsConstructor
@Slf4j
public class RankingService {

    private final StaffSummaryRepository staffSummaryRepository;

    /**
     * Classe les staffs entre eux :
     * Score moyen (Desc) -> rang général ; Moyenne coordinateurs (Desc) et Expérience (Desc) -> rangs secondaires.
     */
    public List<StaffSummary> rankStaffs(List<StaffSummary> summaries) {
        List<StaffSummary> ranked = new ArrayList<>(summaries);

        // 1. Rang général : score moyen décroissant, puis nom pour la stabilité
        ranked.sort(Comparator.comparingDouble(StaffSummary::getAvgConnectionScore).reversed()
                .thenComparing(StaffSummary::getHeadCoach));
        int rank = 1;
        for (StaffSummary s : ranked) {
            s.setOverallRank(rank++);
        }

        // 2. Rangs secondaires (ex-aequo au rang minimum, valeurs manquantes en dernier)
        assignMinRanks(ranked, StaffSummary::getCoordinatorAvgScore, StaffSummary::setCoordinatorRank);
        assignMinRanks(ranked, s -> (double) s.getTotalYearsExperience(), StaffSummary::setExperienceRank);
        return ranked;
    }

    /**
     * Classe puis sauvegarde un run complet d'agrégation.
     */
    @Transactional
    public List<StaffSummary> updateRankings(String runId, List<StaffSummary> summaries) {
        if (summaries.isEmpty()) return List.of();

        LocalDateTime now = LocalDateTime.now();
        List<StaffSummary> ranked = rankStaffs(summaries);
        ranked.forEach(s -> {
            s.setRunId(runId);
            s.setCreatedAt(now);
        });

        List<StaffSummary> saved = staffSummaryRepository.saveAll(ranked);
        log.info("🏆 Classement de {} staffs sauvegardé (run {}).", saved.size(), runId);
        return saved;
    }

    public List<StaffSummary> latestRankings() {
        return staffSummaryRepository.findFirstByOrderByCreatedAtDesc()
                .map(s -> staffSummaryRepository.findByRunIdOrderByOverallRankAsc(s.getRunId()))
                .orElse(List.of());
    }

    /** Historique des classements d'un head coach, du plus récent au plus ancien. */
    public List<StaffSummary> history(String headCoach) {
        return staffSummaryRepository.findByHeadCoachOrderByCreatedAtDesc(headCoach);
    }

    private void assignMinRanks(List<StaffSummary> staffs,
                                Function<StaffSummary, Double> metric,
                                BiConsumer<StaffSummary, Integer> setter) {
        for (StaffSummary s : staffs) {
            Double value = metric.apply(s);
            if (value == null) continue;
            int better = 0;
            for (StaffSummary other : staffs) {
                Double o = metric.apply(other);
                if (o != null && o > value) better++;
            }
            setter.accept(s, better + 1);
        }

        // Les valeurs manquantes passent après toutes les autres, dans l'ordre du classement général
        int missingRank = (int) staffs.stream().filter(s -> metric.apply(s) != null).count() + 1;
        for (StaffSummary s : staffs) {
            if (metric.apply(s) == null) setter.accept(s, missingRank++);
        }
    }
}

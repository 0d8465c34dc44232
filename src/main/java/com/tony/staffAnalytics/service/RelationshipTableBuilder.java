package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.model.CoStaffGraph;
import com.tony.staffAnalytics.model.Coach;
import com.tony.staffAnalytics.model.RelationshipEdge;
import com.tony.staffAnalytics.model.StaffRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Service
@Slf4j
public class RelationshipTableBuilder {

    /**
     * Une relation par paire de coachs ayant partagé au moins une (saison, équipe).
     * years_together = saisons distinctes, toutes équipes confondues.
     */
    public List<RelationshipEdge> buildRelationships(List<StaffRecord> records) {
        // 1. Regrouper par (saison, équipe)
        Map<String, List<StaffRecord>> rosters = new LinkedHashMap<>();
        for (StaffRecord r : records) {
            rosters.computeIfAbsent(r.getYear() + "|" + r.getTeam(), k -> new ArrayList<>()).add(r);
        }

        // 2. Accumuler chaque co-occurrence sur la paire canonique
        Map<String, PairAccumulator> pairs = new TreeMap<>();
        for (List<StaffRecord> roster : rosters.values()) {
            for (int i = 0; i < roster.size(); i++) {
                for (int j = i + 1; j < roster.size(); j++) {
                    StaffRecord a = roster.get(i);
                    StaffRecord b = roster.get(j);
                    if (a.getCoachId() == b.getCoachId()) continue; // Pas de boucle

                    StaffRecord first = a.getCoachId() < b.getCoachId() ? a : b;
                    StaffRecord second = first == a ? b : a;
                    pairs.computeIfAbsent(RelationshipEdge.pairKey(a.getCoachId(), b.getCoachId()),
                                    k -> new PairAccumulator(first.getCoachId(), second.getCoachId()))
                            .add(first, second);
                }
            }
        }

        List<RelationshipEdge> edges = new ArrayList<>(pairs.size());
        pairs.values().forEach(acc -> edges.add(acc.toEdge()));
        log.info("🔗 {} relations de co-staff construites à partir de {} lignes.", edges.size(), records.size());
        return edges;
    }

    /**
     * Un coach par individu, décrit par sa ligne la plus récente.
     * À saison égale, la première ligne du fichier l'emporte.
     */
    public List<Coach> buildCoaches(List<StaffRecord> records) {
        Map<Long, StaffRecord> latest = new TreeMap<>();
        for (StaffRecord r : records) {
            StaffRecord current = latest.get(r.getCoachId());
            if (current == null || r.getYear() > current.getYear()) {
                latest.put(r.getCoachId(), r);
            }
        }
        return latest.values().stream()
                .map(r -> Coach.builder()
                        .coachId(r.getCoachId())
                        .name(r.getCoachName())
                        .currentRole(r.roleSide())
                        .lastActiveYear(r.getYear())
                        .performanceValue(r.getPerformanceValue())
                        .build())
                .toList();
    }

    /**
     * Graphe des coachs actifs depuis recencyCutoffYear. Tout l'historique alimente years_together.
     */
    public CoStaffGraph buildGraph(List<StaffRecord> records, int recencyCutoffYear) {
        List<Coach> active = buildCoaches(records).stream()
                .filter(c -> c.getLastActiveYear() >= recencyCutoffYear)
                .toList();
        Set<Long> activeIds = new HashSet<>();
        active.forEach(c -> activeIds.add(c.getCoachId()));

        List<StaffRecord> relevant = records.stream()
                .filter(r -> activeIds.contains(r.getCoachId()))
                .toList();

        CoStaffGraph graph = new CoStaffGraph(active, buildRelationships(relevant));
        log.info("🕸️ Graphe construit : {} coachs actifs (>= {}), {} arêtes, densité {}",
                graph.nodeCount(), recencyCutoffYear, graph.edgeCount(), String.format("%.4f", graph.density()));
        return graph;
    }

    private static class PairAccumulator {
        final long coachId1;
        final long coachId2;
        final Set<Integer> years = new HashSet<>();
        double sum1 = 0; int count1 = 0;
        double sum2 = 0; int count2 = 0;

        PairAccumulator(long coachId1, long coachId2) {
            this.coachId1 = coachId1;
            this.coachId2 = coachId2;
        }

        void add(StaffRecord first, StaffRecord second) {
            years.add(first.getYear());
            if (first.getPerformanceValue() != null) { sum1 += first.getPerformanceValue(); count1++; }
            if (second.getPerformanceValue() != null) { sum2 += second.getPerformanceValue(); count2++; }
        }

        RelationshipEdge toEdge() {
            return new RelationshipEdge(coachId1, coachId2, years.size(),
                    count1 > 0 ? sum1 / count1 : null,
                    count2 > 0 ? sum2 / count2 : null);
        }
    }
}

package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.config.StaffBuilderProperties;
import com.tony.staffAnalytics.model.ClosenessTable;
import com.tony.staffAnalytics.model.CoStaffGraph;
import com.tony.staffAnalytics.model.NetworkSnapshot;
import com.tony.staffAnalytics.model.StaffRecord;
import com.tony.staffAnalytics.model.dto.NetworkStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Construit une seule fois le réseau (graphe + table de proximité) et le partage par référence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CoachingNetworkService {

    private final StaffDataImportService importService;
    private final RelationshipTableBuilder relationshipTableBuilder;
    private final StaffBuilderProperties properties;

    private final AtomicReference<NetworkSnapshot> snapshot = new AtomicReference<>();

    public NetworkSnapshot current() {
        NetworkSnapshot current = snapshot.get();
        if (current != null) return current;
        synchronized (this) {
            if (snapshot.get() == null) {
                snapshot.set(loadFromFiles());
            }
            return snapshot.get();
        }
    }

    public synchronized NetworkSnapshot reload() {
        NetworkSnapshot fresh = loadFromFiles();
        snapshot.set(fresh);
        return fresh;
    }

    /**
     * Construit un snapshot à partir de données déjà en mémoire.
     */
    public NetworkSnapshot build(List<StaffRecord> records, ClosenessTable closenessTable) {
        CoStaffGraph graph = relationshipTableBuilder.buildGraph(records, properties.getRecencyCutoffYear());
        if (graph.nodeCount() == 0) {
            throw new IllegalStateException("Réseau vide : aucun coach actif depuis " + properties.getRecencyCutoffYear());
        }
        RolePromotionMapper mapper = new RolePromotionMapper(closenessTable, properties.getPromotionStep());
        return new NetworkSnapshot(graph, closenessTable, mapper, LocalDateTime.now());
    }

    public NetworkStats stats() {
        NetworkSnapshot current = current();
        CoStaffGraph graph = current.getGraph();
        List<NetworkStats.ConnectedCoach> top = graph.coachesSortedByConnections().stream()
                .limit(10)
                .map(c -> new NetworkStats.ConnectedCoach(c.getCoachId(), c.getName(), graph.connectionCount(c.getCoachId())))
                .toList();
        return new NetworkStats(graph.nodeCount(), graph.edgeCount(), graph.density(),
                current.getPromotionMapper().openPositions().size(), current.getBuiltAt(), top);
    }

    private NetworkSnapshot loadFromFiles() {
        long start = System.currentTimeMillis();
        log.info("🚀 Chargement du réseau de coachs...");

        List<StaffRecord> records = importService.importStaffRecords(Path.of(properties.getStaffRecordsPath()));
        String performancePath = properties.getPerformancePath();
        if (performancePath != null && !performancePath.isBlank()) {
            List<PerformanceSource> sources = importService.importPerformanceSources(Path.of(performancePath));
            records = new CoalescingPerformanceResolver(sources).enrich(records);
        }
        ClosenessTable closenessTable = importService.importClosenessTable(Path.of(properties.getClosenessPath()));

        NetworkSnapshot built = build(records, closenessTable);
        log.info("✅ Réseau prêt en {} ms ({} coachs).", System.currentTimeMillis() - start, built.getGraph().nodeCount());
        return built;
    }
}

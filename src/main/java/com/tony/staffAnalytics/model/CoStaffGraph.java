package com.tony.staffAnalytics.model;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Graphe non orienté et simple des coachs ayant partagé un staff.
 * Les distances sont non pondérées : years_together et les valeurs ne servent qu'au score.
 * Immuable après construction, partageable sans verrou.
 */
public class CoStaffGraph {

    public static final int UNREACHABLE = Integer.MAX_VALUE;

    private final Map<Long, Coach> coaches;
    private final Map<Long, Set<Long>> adjacency;
    private final Map<String, RelationshipEdge> edges;

    /**
     * @param nodes         coachs retenus (un par coach_id)
     * @param relationships au plus une arête par paire, déjà fusionnée (voir RelationshipTableBuilder) ;
     *                      les arêtes vers un coach absent de {@code nodes} sont ignorées
     * @throws IllegalArgumentException si une paire apparaît deux fois
     */
    public CoStaffGraph(Collection<Coach> nodes, Collection<RelationshipEdge> relationships) {
        Map<Long, Coach> nodeMap = new TreeMap<>();
        Map<Long, Set<Long>> adj = new TreeMap<>();
        for (Coach coach : nodes) {
            nodeMap.put(coach.getCoachId(), coach);
            adj.put(coach.getCoachId(), new TreeSet<>());
        }

        Map<String, RelationshipEdge> edgeMap = new LinkedHashMap<>();
        for (RelationshipEdge edge : relationships) {
            // On ne garde que les arêtes entre noeuds retenus
            if (!nodeMap.containsKey(edge.getCoachId1()) || !nodeMap.containsKey(edge.getCoachId2())) continue;
            String key = RelationshipEdge.pairKey(edge.getCoachId1(), edge.getCoachId2());
            if (edgeMap.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate relationship for pair " + key);
            }
            edgeMap.put(key, edge);
            adj.get(edge.getCoachId1()).add(edge.getCoachId2());
            adj.get(edge.getCoachId2()).add(edge.getCoachId1());
        }

        adj.replaceAll((id, neighbors) -> Collections.unmodifiableSet(neighbors));
        this.coaches = Collections.unmodifiableMap(nodeMap);
        this.adjacency = Collections.unmodifiableMap(adj);
        this.edges = Collections.unmodifiableMap(edgeMap);
    }

    public boolean contains(long coachId) {
        return coaches.containsKey(coachId);
    }

    public Optional<Coach> coach(long coachId) {
        return Optional.ofNullable(coaches.get(coachId));
    }

    /** Premier coach (plus petit id) portant ce nom. */
    public Optional<Coach> findByName(String name) {
        return coaches.values().stream()
                .filter(c -> c.getName() != null && c.getName().equals(name))
                .findFirst();
    }

    public Collection<Coach> coaches() {
        return coaches.values();
    }

    public Collection<RelationshipEdge> edges() {
        return edges.values();
    }

    public Optional<RelationshipEdge> edge(long a, long b) {
        return Optional.ofNullable(edges.get(RelationshipEdge.pairKey(a, b)));
    }

    public Set<Long> neighbors(long coachId) {
        return adjacency.getOrDefault(coachId, Set.of());
    }

    /** Nombre de relations directes d'un coach. */
    public int connectionCount(long coachId) {
        return neighbors(coachId).size();
    }

    public int nodeCount() {
        return coaches.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public double density() {
        long n = coaches.size();
        if (n < 2) return 0.0;
        return (2.0 * edges.size()) / (n * (n - 1));
    }

    /**
     * Plus court chemin en nombre d'arêtes. UNREACHABLE si pas de chemin ou coach absent.
     */
    public int distance(long from, long to) {
        if (!contains(from) || !contains(to)) return UNREACHABLE;
        if (from == to) return 0;
        return distancesFrom(from, UNREACHABLE).getOrDefault(to, UNREACHABLE);
    }

    /**
     * Coachs à distance 0 < d <= maxDegree de la cible, triés par id.
     */
    public Map<Long, Integer> neighborsWithin(long target, int maxDegree) {
        Map<Long, Integer> result = new TreeMap<>();
        if (!contains(target) || maxDegree < 1) return result;
        distancesFrom(target, maxDegree).forEach((id, d) -> {
            if (d > 0) result.put(id, d);
        });
        return result;
    }

    // Parcours en largeur borné
    private Map<Long, Integer> distancesFrom(long source, int maxDepth) {
        Map<Long, Integer> dist = new HashMap<>();
        Deque<Long> queue = new ArrayDeque<>();
        dist.put(source, 0);
        queue.add(source);
        while (!queue.isEmpty()) {
            long current = queue.poll();
            int d = dist.get(current);
            if (d >= maxDepth) continue;
            for (long next : neighbors(current)) {
                if (!dist.containsKey(next)) {
                    dist.put(next, d + 1);
                    queue.add(next);
                }
            }
        }
        return dist;
    }

    public List<Coach> coachesSortedByConnections() {
        return coaches.values().stream()
                .sorted((a, b) -> {
                    int cmp = Integer.compare(connectionCount(b.getCoachId()), connectionCount(a.getCoachId()));
                    return cmp != 0 ? cmp : Long.compare(a.getCoachId(), b.getCoachId());
                })
                .toList();
    }
}

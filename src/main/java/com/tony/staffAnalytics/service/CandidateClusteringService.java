package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.config.StaffBuilderProperties;
import com.tony.staffAnalytics.model.StaffSummary;
import com.tony.staffAnalytics.model.dto.CandidateComposite;
import com.tony.staffAnalytics.model.dto.ClusterAssignment;
import com.tony.staffAnalytics.model.dto.ClusteringResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.clustering.MultiKMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Regroupe les candidats head coach selon (valeur personnelle, valeur du staff).
 * Étape terminale de présentation : rien ne remonte vers le scoring.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CandidateClusteringService {

    private static final int MAX_ITERATIONS = 100;

    private final StaffBuilderProperties properties;

    /**
     * Jointure par nom entre composites et résumés de staff ; les candidats sans staff sont écartés.
     */
    public ClusteringResult cluster(List<CandidateComposite> composites, List<StaffSummary> staffs) {
        Map<String, Double> staffValue = new HashMap<>();
        for (StaffSummary s : staffs) {
            if (s.getAvgCoachValue() != null) staffValue.put(s.getHeadCoach(), s.getAvgCoachValue());
        }

        List<CandidatePoint> points = new ArrayList<>();
        for (CandidateComposite c : composites) {
            Double value = staffValue.get(c.getName());
            if (value == null) continue;
            points.add(new CandidatePoint(c.getName(), c.getCompositeValue(), value));
        }
        log.info("🎯 Clustering de {} candidats ({} écartés sans staff).", points.size(), composites.size() - points.size());
        return clusterPoints(points);
    }

    ClusteringResult clusterPoints(List<CandidatePoint> input) {
        // Ordre fixe -> résultat reproductible
        List<CandidatePoint> points = new ArrayList<>(input);
        points.sort(Comparator.comparing(CandidatePoint::getName));
        if (points.isEmpty()) {
            return new ClusteringResult(0, List.of(), List.of());
        }

        int maxK = Math.min(properties.getMaxElbowK(), distinctCount(points));
        List<Double> elbow = elbowCurve(points, maxK);

        int k = properties.getClusterCount() > 0 ? properties.getClusterCount() : elbowPoint(elbow);
        k = Math.max(1, Math.min(k, distinctCount(points)));

        List<CentroidCluster<CandidatePoint>> clusters = new ArrayList<>(runKMeans(points, k));
        // Étiquettes stables : centroïde croissant sur la valeur personnelle puis celle du staff
        clusters.sort(Comparator.<CentroidCluster<CandidatePoint>>comparingDouble(c -> c.getCenter().getPoint()[0])
                .thenComparingDouble(c -> c.getCenter().getPoint()[1]));

        List<ClusterAssignment> assignments = new ArrayList<>();
        for (int i = 0; i < clusters.size(); i++) {
            for (CandidatePoint p : clusters.get(i).getPoints()) {
                assignments.add(new ClusterAssignment(p.getName(), p.getCompositeValue(), p.getStaffValue(), i + 1));
            }
        }
        assignments.sort(Comparator.comparing(ClusterAssignment::getName));
        return new ClusteringResult(k, elbow, assignments);
    }

    /**
     * Somme des carrés intra-cluster pour k = 1..maxK.
     */
    public List<Double> elbowCurve(List<CandidatePoint> points, int maxK) {
        List<Double> wss = new ArrayList<>();
        for (int k = 1; k <= maxK; k++) {
            wss.add(withinSumOfSquares(runKMeans(points, k)));
        }
        return wss;
    }

    /**
     * Coude = point le plus éloigné de la droite entre le premier et le dernier point de la courbe.
     */
    static int elbowPoint(List<Double> wss) {
        int n = wss.size();
        if (n <= 2) return n;
        double x1 = 1, y1 = wss.get(0);
        double x2 = n, y2 = wss.get(n - 1);
        double norm = Math.hypot(x2 - x1, y2 - y1);
        int best = 1;
        double bestDistance = -1;
        for (int i = 0; i < n; i++) {
            double x = i + 1, y = wss.get(i);
            double d = Math.abs((y2 - y1) * x - (x2 - x1) * y + x2 * y1 - y2 * x1) / norm;
            if (d > bestDistance) {
                bestDistance = d;
                best = i + 1;
            }
        }
        return best;
    }

    private List<CentroidCluster<CandidatePoint>> runKMeans(List<CandidatePoint> points, int k) {
        KMeansPlusPlusClusterer<CandidatePoint> clusterer = new KMeansPlusPlusClusterer<>(
                k, MAX_ITERATIONS, new EuclideanDistance(), new Well19937c(properties.getRandomSeed()));
        MultiKMeansPlusPlusClusterer<CandidatePoint> multi =
                new MultiKMeansPlusPlusClusterer<>(clusterer, Math.max(1, properties.getKmeansStarts()));
        return multi.cluster(points);
    }

    private static double withinSumOfSquares(List<CentroidCluster<CandidatePoint>> clusters) {
        double total = 0;
        for (CentroidCluster<CandidatePoint> cluster : clusters) {
            double[] center = cluster.getCenter().getPoint();
            for (CandidatePoint p : cluster.getPoints()) {
                double[] v = p.getPoint();
                total += Math.pow(v[0] - center[0], 2) + Math.pow(v[1] - center[1], 2);
            }
        }
        return total;
    }

    private static int distinctCount(List<CandidatePoint> points) {
        Set<String> distinct = new HashSet<>();
        points.forEach(p -> distinct.add(p.getCompositeValue() + "|" + p.getStaffValue()));
        return distinct.size();
    }

    /** Un candidat dans l'espace 2-D (valeur personnelle, valeur du staff). */
    public static class CandidatePoint implements Clusterable {
        private final String name;
        private final double[] point;

        public CandidatePoint(String name, double compositeValue, double staffValue) {
            this.name = name;
            this.point = new double[]{compositeValue, staffValue};
        }

        public String getName() {
            return name;
        }

        public double getCompositeValue() {
            return point[0];
        }

        public double getStaffValue() {
            return point[1];
        }

        @Override
        public double[] getPoint() {
            return point;
        }
    }
}

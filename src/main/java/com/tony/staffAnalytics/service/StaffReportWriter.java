package com.tony.staffAnalytics.service;

import com.opencsv.CSVWriter;
import com.tony.staffAnalytics.model.CandidateRecord;
import com.tony.staffAnalytics.model.PositionAggregate;
import com.tony.staffAnalytics.model.ScoreMatrix;
import com.tony.staffAnalytics.model.StaffSummary;
import com.tony.staffAnalytics.model.dto.AggregationReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Exports CSV de la comparaison des staffs.
 */
@Service
@Slf4j
public class StaffReportWriter {

    public static final String COMPARISON_FILE = "staff_comparison.csv";
    public static final String RANKINGS_FILE = "staff_rankings.csv";
    public static final String ALL_CANDIDATES_FILE = "staff_comparison_all_candidates.csv";
    public static final String MATRIX_FILE = "staff_comparison_position_matrix.csv";

    public List<Path> write(AggregationReport report, Path directory) throws IOException {
        Files.createDirectories(directory);
        List<Path> written = new ArrayList<>();
        written.add(writePositionAggregates(report.getPositionAggregates(), directory.resolve(COMPARISON_FILE)));
        written.add(writeRankings(report.getRankings(), directory.resolve(RANKINGS_FILE)));
        written.add(writeAllCandidates(report.getCandidatesByHeadCoach(), directory.resolve(ALL_CANDIDATES_FILE)));
        written.add(writeMatrix(report.getScoreMatrix(), directory.resolve(MATRIX_FILE)));
        log.info("💾 {} fichiers de comparaison écrits dans {}", written.size(), directory);
        return written;
    }

    Path writePositionAggregates(List<PositionAggregate> aggregates, Path file) throws IOException {
        try (CSVWriter csv = open(file)) {
            csv.writeNext(new String[]{"target_hc", "position_key", "avg_connection_score", "max_connection_score",
                    "num_candidates", "avg_coach_value", "avg_years_together", "pct_direct_connections",
                    "target_position", "target_side"}, false);
            for (PositionAggregate a : aggregates) {
                csv.writeNext(new String[]{a.getHeadCoach(), a.getPositionKey(), num(a.getAvgConnectionScore()),
                        num(a.getMaxConnectionScore()), String.valueOf(a.getNumCandidates()), num(a.getAvgCoachValue()),
                        num(a.getAvgYearsTogether()), num(a.getPctDirectConnections()),
                        a.getTargetPosition(), a.getTargetSide()}, false);
            }
        }
        return file;
    }

    Path writeRankings(List<StaffSummary> rankings, Path file) throws IOException {
        try (CSVWriter csv = open(file)) {
            csv.writeNext(new String[]{"target_hc", "filename", "total_positions", "avg_connection_score",
                    "median_connection_score", "avg_coach_value", "avg_years_together", "pct_direct_connections",
                    "pct_quality_candidates", "total_years_experience", "top_3_avg_score", "coordinator_avg_score",
                    "overall_rank", "coordinator_rank", "experience_rank"}, false);
            for (StaffSummary s : rankings) {
                csv.writeNext(new String[]{s.getHeadCoach(), s.getSourceFile(), String.valueOf(s.getTotalPositions()),
                        num(s.getAvgConnectionScore()), num(s.getMedianConnectionScore()), num(s.getAvgCoachValue()),
                        num(s.getAvgYearsTogether()), num(s.getPctDirectConnections()), num(s.getPctQualityCandidates()),
                        String.valueOf(s.getTotalYearsExperience()), num(s.getTop3AvgScore()),
                        num(s.getCoordinatorAvgScore()), str(s.getOverallRank()), str(s.getCoordinatorRank()),
                        str(s.getExperienceRank())}, false);
            }
        }
        return file;
    }

    Path writeAllCandidates(Map<String, List<CandidateRecord>> byHeadCoach, Path file) throws IOException {
        try (CSVWriter csv = open(file)) {
            csv.writeNext(new String[]{"target_hc", "position_key", "coach_id", "candidate_name", "current_role",
                    "current_side", "target_position", "target_side", "degree", "years_together", "coach_value",
                    "connection_score"}, false);
            for (Map.Entry<String, List<CandidateRecord>> e : byHeadCoach.entrySet()) {
                for (CandidateRecord c : e.getValue()) {
                    csv.writeNext(new String[]{e.getKey(), c.getPositionKey(), String.valueOf(c.getCoachId()),
                            c.getCandidateName(), c.getCurrentRole(), c.getCurrentSide(), c.getTargetPosition(),
                            c.getTargetSide(), String.valueOf(c.getDegree()), String.valueOf(c.getYearsTogether()),
                            num(c.getCoachValue()), num(c.getConnectionScore())}, false);
                }
            }
        }
        return file;
    }

    Path writeMatrix(ScoreMatrix matrix, Path file) throws IOException {
        try (CSVWriter csv = open(file)) {
            List<String> header = new ArrayList<>();
            header.add("position_key");
            header.addAll(matrix.getHeadCoaches());
            csv.writeNext(header.toArray(new String[0]), false);
            for (String position : matrix.getPositionKeys()) {
                List<String> row = new ArrayList<>();
                row.add(position);
                matrix.row(position).forEach(v -> row.add(num(v)));
                csv.writeNext(row.toArray(new String[0]), false);
            }
        }
        return file;
    }

    private CSVWriter open(Path file) throws IOException {
        Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        return new CSVWriter(writer);
    }

    private static String num(Double value) {
        return value == null ? "NA" : String.format(Locale.ROOT, "%.6f", value);
    }

    private static String str(Integer value) {
        return value == null ? "NA" : String.valueOf(value);
    }
}

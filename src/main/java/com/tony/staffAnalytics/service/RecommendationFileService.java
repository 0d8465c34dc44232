package com.tony.staffAnalytics.service;

import com.opencsv.CSVWriter;
import com.opencsv.bean.CsvBindByName;
import com.opencsv.bean.CsvToBeanBuilder;
import com.tony.staffAnalytics.model.CandidateRecord;
import com.tony.staffAnalytics.model.StaffRecommendation;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lecture / écriture des fichiers "<Head_Coach>_staff_recommendations.csv".
 */
@Service
@Slf4j
public class RecommendationFileService {

    static final String SUFFIX = "_staff_recommendations.csv";

    static final String[] HEADER = {
            "position_key", "coach_id", "candidate_name", "current_role", "current_side",
            "target_position", "target_side", "degree", "years_together", "coach_value", "connection_score"
    };

    public Path write(StaffRecommendation recommendation, Path directory) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(fileNameFor(recommendation.getHeadCoachName()));
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter csv = new CSVWriter(writer)) {
            csv.writeNext(HEADER, false);
            for (CandidateRecord c : recommendation.allCandidates()) {
                csv.writeNext(new String[]{
                        c.getPositionKey(),
                        String.valueOf(c.getCoachId()),
                        c.getCandidateName(),
                        c.getCurrentRole(),
                        c.getCurrentSide(),
                        c.getTargetPosition(),
                        c.getTargetSide(),
                        String.valueOf(c.getDegree()),
                        String.valueOf(c.getYearsTogether()),
                        c.getCoachValue() == null ? "NA" : format(c.getCoachValue()),
                        format(c.getConnectionScore())
                }, false);
            }
        }
        log.info("💾 Recommandations de {} sauvegardées dans {}", recommendation.getHeadCoachName(), file);
        return file;
    }

    /**
     * Relit un fichier de recommandations. Le premier candidat de chaque poste (meilleur score) est marqué retenu.
     */
    public List<CandidateRecord> read(Path file) throws IOException {
        List<RecommendationRow> rows;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            rows = new CsvToBeanBuilder<RecommendationRow>(reader)
                    .withType(RecommendationRow.class)
                    .withIgnoreLeadingWhiteSpace(true)
                    .withIgnoreEmptyLine(true)
                    .build().parse();
        }

        List<CandidateRecord> records = new ArrayList<>(rows.size());
        List<String> seenPositions = new ArrayList<>();
        for (RecommendationRow row : rows) {
            if (row.getTargetPosition() == null || row.getConnectionScore() == null) {
                throw new IllegalArgumentException("Colonnes target_position / connection_score manquantes dans " + file);
            }
            String key = row.getTargetPosition() + "_" + row.getTargetSide();
            boolean first = !seenPositions.contains(key);
            if (first) seenPositions.add(key);

            records.add(CandidateRecord.builder()
                    .coachId(Long.parseLong(row.getCoachId().trim()))
                    .candidateName(row.getCandidateName())
                    .currentRole(row.getCurrentRole())
                    .currentSide(row.getCurrentSide())
                    .targetPosition(row.getTargetPosition())
                    .targetSide(row.getTargetSide())
                    .degree(parseInt(row.getDegree()))
                    .yearsTogether(parseInt(row.getYearsTogether()))
                    .coachValue(StaffDataImportService.parseNullableDouble(row.getCoachValue()))
                    .connectionScore(Double.parseDouble(row.getConnectionScore().trim()))
                    .assigned(first)
                    .build());
        }
        return records;
    }

    public static String fileNameFor(String headCoach) {
        return headCoach.trim().replaceAll("[^A-Za-z0-9.'-]+", "_") + SUFFIX;
    }

    /**
     * "staff_recommendations_Jim_Schwartz.csv" ou "Jim_Schwartz_staff_recommendations.csv" -> "Jim Schwartz".
     */
    public static String headCoachFromFileName(String fileName) {
        String name = Path.of(fileName).getFileName().toString();
        name = name.replaceAll("(?i)\\.csv$", "");
        name = name.replace("staff_recommendations_", "")
                .replace("_staff_recommendations", "")
                .replace("staff_recs_", "")
                .replace("_staff_recs", "");
        return name.replace('_', ' ').trim();
    }

    private static int parseInt(String raw) {
        if (raw == null || raw.isBlank()) return 0;
        return (int) Double.parseDouble(raw.trim());
    }

    // Pleine précision : un arrondi créerait de fausses égalités à la relecture
    private static String format(double value) {
        return Double.toString(value);
    }

    @Data
    public static class RecommendationRow {
        @CsvBindByName(column = "position_key") private String positionKey;
        @CsvBindByName(column = "coach_id") private String coachId;
        @CsvBindByName(column = "candidate_name") private String candidateName;
        @CsvBindByName(column = "current_role") private String currentRole;
        @CsvBindByName(column = "current_side") private String currentSide;
        @CsvBindByName(column = "target_position") private String targetPosition;
        @CsvBindByName(column = "target_side") private String targetSide;
        @CsvBindByName(column = "degree") private String degree;
        @CsvBindByName(column = "years_together") private String yearsTogether;
        @CsvBindByName(column = "coach_value") private String coachValue;
        @CsvBindByName(column = "connection_score") private String connectionScore;
    }
}

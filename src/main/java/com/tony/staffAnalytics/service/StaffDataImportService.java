package com.tony.staffAnalytics.service;

import com.opencsv.bean.CsvBindByName;
import com.opencsv.bean.CsvToBeanBuilder;
import com.tony.staffAnalytics.model.ClosenessEntry;
import com.tony.staffAnalytics.model.ClosenessTable;
import com.tony.staffAnalytics.model.CompositeValue;
import com.tony.staffAnalytics.model.RoleSide;
import com.tony.staffAnalytics.model.StaffRecord;
import com.tony.staffAnalytics.model.dto.CandidateComposite;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class StaffDataImportService {

    /**
     * Historique des staffs (une ligne par coach, rôle, équipe, saison).
     * Les lignes incomplètes sont ignorées avec un warning.
     */
    public List<StaffRecord> importStaffRecords(Path file) {
        List<StaffRecordRow> rows = readRows(file, StaffRecordRow.class);
        List<StaffRecord> records = new ArrayList<>(rows.size());
        int errorCount = 0;
        for (StaffRecordRow row : rows) {
            try {
                records.add(StaffRecord.builder()
                        .year(Integer.parseInt(required(row.getYear(), "year")))
                        .team(required(row.getTeam(), "team"))
                        .coachId(Long.parseLong(required(row.getCoachId(), "coach_id")))
                        .coachName(trimToNull(row.getCoach()))
                        .role(required(row.getRoleCategory(), "role_category"))
                        .sideOfBall(required(row.getSideOfBall(), "side_of_ball"))
                        .roleSubcategory(trimToNull(row.getRoleSubcategory()))
                        .positionGroup(trimToNull(row.getPositionGroup()))
                        .performanceValue(parseNullableDouble(row.getValue()))
                        .build());
            } catch (Exception e) {
                errorCount++;
                log.warn("Ligne de staff ignorée ({} / {}): {}", row.getCoach(), row.getYear(), e.getMessage());
            }
        }
        log.info("📥 {} lignes de staff importées depuis {} ({} erreurs).", records.size(), file, errorCount);
        return records;
    }

    public ClosenessTable importClosenessTable(Path file) {
        List<ClosenessRow> rows = readRows(file, ClosenessRow.class);
        List<ClosenessEntry> entries = new ArrayList<>(rows.size());
        for (ClosenessRow row : rows) {
            try {
                double closeness = Double.parseDouble(required(row.getCloseness(), "closeness"));
                if (closeness < 0.0 || closeness > 1.0) {
                    throw new IllegalArgumentException("closeness hors de [0,1] : " + closeness);
                }
                String hierarchy = trimToNull(row.getHierarchy());
                entries.add(new ClosenessEntry(
                        RoleSide.of(required(row.getRoleFrom(), "role_from"), required(row.getSideFrom(), "side_from")),
                        RoleSide.of(required(row.getRoleTo(), "role_to"), required(row.getSideTo(), "side_to")),
                        closeness,
                        hierarchy == null ? 0 : (int) Double.parseDouble(hierarchy)));
            } catch (Exception e) {
                log.warn("Ligne de proximité ignorée ({} -> {}): {}", row.getRoleFrom(), row.getRoleTo(), e.getMessage());
            }
        }
        log.info("📥 Table de proximité : {} entrées.", entries.size());
        return new ClosenessTable(entries);
    }

    /**
     * Composites de performance, une source par nom de composite (ordre d'apparition = priorité).
     */
    public List<PerformanceSource> importPerformanceSources(Path file) {
        Map<String, List<CompositeValue>> byComposite = new LinkedHashMap<>();
        for (CompositeRow row : readRows(file, CompositeRow.class)) {
            try {
                String composite = required(row.getComposite(), "composite");
                Double value = parseNullableDouble(row.getValue());
                if (value == null) continue;
                byComposite.computeIfAbsent(composite, k -> new ArrayList<>()).add(CompositeValue.builder()
                        .composite(composite)
                        .season(Integer.parseInt(required(row.getSeason(), "season")))
                        .team(required(row.getTeam(), "team"))
                        .role(trimToNull(row.getRole()))
                        .side(trimToNull(row.getSide()))
                        .subcategory(trimToNull(row.getSubcategory()))
                        .positionGroup(trimToNull(row.getPositionGroup()))
                        .value(value)
                        .build());
            } catch (Exception e) {
                log.warn("Composite ignoré ({} / {}): {}", row.getComposite(), row.getSeason(), e.getMessage());
            }
        }
        List<PerformanceSource> sources = new ArrayList<>();
        byComposite.forEach((name, values) -> sources.add(new CompositeTable(name, values)));
        log.info("📥 {} composites de performance chargés : {}", sources.size(), byComposite.keySet());
        return sources;
    }

    /** Valeur composite personnelle des candidats head coach (entrée du clustering). */
    public List<CandidateComposite> importCandidateComposites(Path file) {
        List<CandidateComposite> candidates = new ArrayList<>();
        for (CandidateRow row : readRows(file, CandidateRow.class)) {
            Double value = parseNullableDouble(row.getCompositeValue());
            String name = trimToNull(row.getName());
            if (name == null || value == null) {
                log.warn("Candidat ignoré (nom ou composite manquant) : {}", row.getName());
                continue;
            }
            candidates.add(new CandidateComposite(name, value));
        }
        return candidates;
    }

    // --- HELPERS ---

    private <T> List<T> readRows(Path file, Class<T> type) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("Fichier introuvable : " + file.toAbsolutePath());
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return new CsvToBeanBuilder<T>(reader)
                    .withType(type).withSeparator(',').withIgnoreLeadingWhiteSpace(true)
                    .withIgnoreEmptyLine(true).build().parse();
        } catch (IOException e) {
            throw new UncheckedIOException("Lecture impossible : " + file, e);
        }
    }

    static Double parseNullableDouble(String raw) {
        String v = trimToNull(raw);
        if (v == null || v.equalsIgnoreCase("NA") || v.equalsIgnoreCase("NaN")) return null;
        return Double.parseDouble(v);
    }

    private static String required(String raw, String column) {
        String v = trimToNull(raw);
        if (v == null || v.equalsIgnoreCase("NA")) {
            throw new IllegalArgumentException("colonne '" + column + "' vide");
        }
        return v;
    }

    private static String trimToNull(String raw) {
        if (raw == null) return null;
        String v = raw.trim();
        return v.isEmpty() ? null : v;
    }

    @Data
    public static class StaffRecordRow {
        @CsvBindByName(column = "year") private String year;
        @CsvBindByName(column = "team") private String team;
        @CsvBindByName(column = "coach_id") private String coachId;
        @CsvBindByName(column = "coach") private String coach;
        @CsvBindByName(column = "role_category") private String roleCategory;
        @CsvBindByName(column = "side_of_ball") private String sideOfBall;
        @CsvBindByName(column = "role_subcategory") private String roleSubcategory;
        @CsvBindByName(column = "position_group") private String positionGroup;
        @CsvBindByName(column = "value") private String value;
    }

    @Data
    public static class ClosenessRow {
        @CsvBindByName(column = "role_from") private String roleFrom;
        @CsvBindByName(column = "side_from") private String sideFrom;
        @CsvBindByName(column = "role_to") private String roleTo;
        @CsvBindByName(column = "side_to") private String sideTo;
        @CsvBindByName(column = "closeness") private String closeness;
        @CsvBindByName(column = "hierarchy") private String hierarchy;
    }

    @Data
    public static class CompositeRow {
        @CsvBindByName(column = "composite") private String composite;
        @CsvBindByName(column = "season") private String season;
        @CsvBindByName(column = "team") private String team;
        @CsvBindByName(column = "role") private String role;
        @CsvBindByName(column = "side") private String side;
        @CsvBindByName(column = "subcategory") private String subcategory;
        @CsvBindByName(column = "position_group") private String positionGroup;
        @CsvBindByName(column = "value") private String value;
    }

    @Data
    public static class CandidateRow {
        @CsvBindByName(column = "name") private String name;
        @CsvBindByName(column = "composite_value") private String compositeValue;
    }
}

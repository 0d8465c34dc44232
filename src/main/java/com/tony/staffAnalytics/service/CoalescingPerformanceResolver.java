package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.model.PerformanceKey;
import com.tony.staffAnalytics.model.StaffRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Combine plusieurs composites : la première source qui connaît la clé fournit la valeur.
 */
@Slf4j
public class CoalescingPerformanceResolver {

    private final List<PerformanceSource> sources;

    public CoalescingPerformanceResolver(List<PerformanceSource> sources) {
        this.sources = List.copyOf(sources);
    }

    public OptionalDouble resolve(PerformanceKey key) {
        for (PerformanceSource source : sources) {
            OptionalDouble value = source.lookup(key);
            if (value.isPresent()) return value;
        }
        return OptionalDouble.empty();
    }

    /**
     * Complète les lignes sans valeur. Une valeur déjà présente n'est jamais écrasée.
     */
    public List<StaffRecord> enrich(List<StaffRecord> records) {
        if (sources.isEmpty()) return records;
        int[] filled = {0};
        List<StaffRecord> enriched = records.stream()
                .map(r -> {
                    if (r.getPerformanceValue() != null) return r;
                    OptionalDouble v = resolve(PerformanceKey.of(r));
                    if (v.isEmpty()) return r;
                    filled[0]++;
                    return r.withPerformanceValue(v.getAsDouble());
                })
                .toList();
        log.info("📈 {} lignes complétées par {} composite(s) de performance.", filled[0], sources.size());
        return enriched;
    }
}

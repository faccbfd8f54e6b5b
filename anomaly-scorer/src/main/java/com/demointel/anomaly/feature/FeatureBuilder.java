package com.demointel.anomaly.feature;

import com.demointel.anomaly.model.RawRecord;
import com.demointel.anomaly.model.ScoredRecord;
import com.demointel.anomaly.util.Stats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cleans raw registration rows and derives the per-record features.
 *
 * Order of work:
 *  1. drop rows whose date cannot be parsed
 *  2. drop rows whose total population is not positive
 *  3. stable sort by date
 *  4. pop_change against the previous record of the same pincode
 *  5. shock_score as one global z-score of pop_change
 */
@Component
@Slf4j
public class FeatureBuilder {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd-MM-yyyy"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy")
    );

    public List<ScoredRecord> build(List<RawRecord> rawRecords) {
        List<ScoredRecord> records = new ArrayList<>(rawRecords.size());
        int badDates = 0;
        int nonPositive = 0;

        for (RawRecord raw : rawRecords) {
            LocalDate date = parseDate(raw.getDate());
            if (date == null) {
                badDates++;
                continue;
            }

            Double youth = parseCount(raw.getDemoAge5To17());
            Double adult = parseCount(raw.getDemoAge17Plus());
            double total = orZero(youth) + orZero(adult);
            if (total <= 0) {
                nonPositive++;
                continue;
            }

            records.add(ScoredRecord.builder()
                    .date(date)
                    .state(trimToNull(raw.getState()))
                    .district(trimToNull(raw.getDistrict()))
                    .pincode(trimToNull(raw.getPincode()))
                    .demoAge5To17(youth)
                    .demoAge17Plus(adult)
                    .totalPopulation(total)
                    .youthRatio(orZero(youth) / total)
                    .build());
        }

        log.info("Cleaned {} raw rows: {} kept, {} unparseable dates, {} non-positive totals",
                rawRecords.size(), records.size(), badDates, nonPositive);

        // List.sort is stable, so same-date rows keep their load order
        records.sort(Comparator.comparing(ScoredRecord::getDate));

        List<ScoredRecord> withChange = withPopChange(records);
        return withShockScore(withChange);
    }

    private List<ScoredRecord> withPopChange(List<ScoredRecord> sorted) {
        Map<String, Double> previousTotal = new HashMap<>();
        List<ScoredRecord> result = new ArrayList<>(sorted.size());

        for (ScoredRecord r : sorted) {
            // no pincode, no geography to diff against
            if (r.getPincode() == null) {
                result.add(r.toBuilder().popChange(0d).build());
                continue;
            }
            Double previous = previousTotal.put(r.getPincode(), r.getTotalPopulation());
            double change = previous == null ? 0d : r.getTotalPopulation() - previous;
            result.add(r.toBuilder().popChange(change).build());
        }
        return result;
    }

    private List<ScoredRecord> withShockScore(List<ScoredRecord> records) {
        double[] changes = records.stream().mapToDouble(ScoredRecord::getPopChange).toArray();
        double mean = Stats.mean(changes);
        double sigma = Stats.sampleStdDev(changes);
        if (sigma == 0d && !records.isEmpty()) {
            log.warn("pop_change has no spread across {} records; shock_score set to 0", records.size());
        }

        List<ScoredRecord> result = new ArrayList<>(records.size());
        for (ScoredRecord r : records) {
            result.add(r.toBuilder()
                    .shockScore(Stats.safeDivide(r.getPopChange() - mean, sigma))
                    .build());
        }
        return result;
    }

    // ── Coercion ─────────────────────────────────────────────────────────────

    static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) return null;
        String trimmed = value.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate parsed = parseDate(trimmed, format);
            if (parsed != null) return parsed;
        }
        return null;
    }

    private static LocalDate parseDate(String value, DateTimeFormatter format) {
        try {
            return LocalDate.parse(value, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Non-numeric, non-finite or negative counts are treated as missing. */
    static Double parseCount(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) && parsed >= 0 ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static double orZero(Double value) {
        return value == null ? 0d : value;
    }

    private static String trimToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }
}

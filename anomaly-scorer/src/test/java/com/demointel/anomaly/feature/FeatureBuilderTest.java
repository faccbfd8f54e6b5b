package com.demointel.anomaly.feature;

import com.demointel.anomaly.model.RawRecord;
import com.demointel.anomaly.model.ScoredRecord;
import com.demointel.anomaly.util.Stats;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.demointel.anomaly.TestRecords.raw;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureBuilderTest {

    private final FeatureBuilder builder = new FeatureBuilder();

    @Test
    void popChangeIsTakenWithinTheSamePincodeInDateOrder() {
        List<RawRecord> rows = List.of(
                raw("2025-03-02", "KA", "Mysuru", "570001", 200, 800),
                raw("2025-03-01", "KA", "Mysuru", "570002", 1000, 4000),
                raw("2025-03-05", "KA", "Mysuru", "570001", 300, 1000),
                raw("2025-03-03", "KA", "Mysuru", "570002", 800, 3200)
        );

        List<ScoredRecord> records = builder.build(rows);

        assertThat(records).extracting(ScoredRecord::getDate).containsExactly(
                LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 2),
                LocalDate.of(2025, 3, 3), LocalDate.of(2025, 3, 5));
        assertThat(records).extracting(ScoredRecord::getPopChange)
                .containsExactly(0d, 0d, -1000d, 300d);
    }

    @Test
    void recordsWithoutPincodeNeverDiffAgainstEachOther() {
        List<ScoredRecord> records = builder.build(List.of(
                raw("2025-03-01", "KA", "Mysuru", "", 200, 800),
                raw("2025-03-02", "KL", "Kochi", null, 1000, 4000),
                raw("2025-03-03", "KL", "Kochi", "  ", 10, 20)));

        assertThat(records).extracting(ScoredRecord::getPincode).containsOnlyNulls();
        assertThat(records).extracting(ScoredRecord::getPopChange).containsExactly(0d, 0d, 0d);
    }

    @Test
    void dropsUnparseableDatesAndNonPositiveTotals() {
        List<RawRecord> rows = List.of(
                raw("not-a-date", "KA", "Mysuru", "570001", 10, 10),
                raw("", "KA", "Mysuru", "570001", 10, 10),
                raw("2025-03-01", "KA", "Mysuru", "570001", 0, 0),
                raw("2025-03-01", "KA", "Mysuru", "570003", "n/a", ""),
                raw("2025-03-01", "KA", "Mysuru", "570002", 10, 30)
        );

        List<ScoredRecord> records = builder.build(rows);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getPincode()).isEqualTo("570002");
        assertThat(records.get(0).getYouthRatio()).isEqualTo(0.25);
    }

    @Test
    void nonNumericCountIsTreatedAsMissingInTheSum() {
        List<ScoredRecord> records = builder.build(List.of(
                raw("2025-03-01", "KA", "Mysuru", "570001", "abc", 50)));

        ScoredRecord r = records.get(0);
        assertThat(r.getDemoAge5To17()).isNull();
        assertThat(r.getTotalPopulation()).isEqualTo(50);
        assertThat(r.getYouthRatio()).isZero();
    }

    @Test
    void acceptsDayFirstDates() {
        List<ScoredRecord> records = builder.build(List.of(
                raw("02-03-2025", "KA", "Mysuru", "570001", 1, 1)));

        assertThat(records.get(0).getDate()).isEqualTo(LocalDate.of(2025, 3, 2));
    }

    @Test
    void shockScoreIsOneGlobalZScore() {
        List<ScoredRecord> records = builder.build(List.of(
                raw("2025-03-01", "KA", "Mysuru", "570001", 100, 900),
                raw("2025-03-02", "KA", "Mysuru", "570001", 100, 1100),
                raw("2025-03-01", "KA", "Udupi", "576101", 50, 450),
                raw("2025-03-02", "KA", "Udupi", "576101", 50, 250),
                raw("2025-03-03", "KA", "Udupi", "576101", 50, 350)
        ));

        double[] shocks = records.stream().mapToDouble(ScoredRecord::getShockScore).toArray();
        assertThat(Stats.mean(shocks)).isCloseTo(0d, within(1e-9));
        assertThat(Stats.sampleStdDev(shocks)).isCloseTo(1d, within(1e-9));
    }

    @Test
    void shockScoreIsZeroWhenPopChangeHasNoSpread() {
        List<ScoredRecord> records = builder.build(List.of(
                raw("2025-03-01", "KA", "Mysuru", "570001", 100, 900),
                raw("2025-03-01", "KA", "Udupi", "576101", 50, 450)
        ));

        assertThat(records).extracting(ScoredRecord::getShockScore).containsOnly(0d);
    }

    @Test
    void youthRatioStaysWithinUnitInterval() {
        List<ScoredRecord> records = builder.build(List.of(
                raw("2025-03-01", "KA", "Mysuru", "570001", 100, 0),
                raw("2025-03-01", "KA", "Mysuru", "570002", 0, 100),
                raw("2025-03-01", "KA", "Mysuru", "570003", -5, 100)
        ));

        assertThat(records).allSatisfy(r -> assertThat(r.getYouthRatio()).isBetween(0d, 1d));
    }

    @Test
    void emptyInputGivesEmptyTable() {
        assertThat(builder.build(List.of())).isEmpty();
    }
}

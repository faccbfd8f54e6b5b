package com.demointel.anomaly.rules;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.ScoredRecord;
import com.demointel.anomaly.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags records that are not yet SEVERE but show enough independent stress signals.
 *
 * A record is flagged when at least {@code vote-threshold} signals vote for it and it is
 * not SEVERE, so an early warning never coincides with SEVERE.
 */
@Component
@Slf4j
public class EarlyWarningDetector {

    private final List<WarningSignal> signals;
    private final int voteThreshold;

    public EarlyWarningDetector(AnomalyScorerProperties properties) {
        AnomalyScorerProperties.EarlyWarning config = properties.getEarlyWarning();
        this.voteThreshold = config.getVoteThreshold();
        this.signals = List.of(
                new WarningSignal("suspicious", r -> r.getSeverity() == Severity.SUSPICIOUS),
                new WarningSignal("persistent", r -> r.getPersistence() >= config.getPersistence()),
                new WarningSignal("shock", r -> Math.abs(r.getShockScore()) >= config.getShock()),
                new WarningSignal("peer-deviation", r -> Math.abs(r.getPeerDeviation()) >= config.getPeerDeviation())
        );
    }

    public List<ScoredRecord> detect(List<ScoredRecord> records) {
        List<ScoredRecord> result = new ArrayList<>(records.size());
        int flagged = 0;
        for (ScoredRecord r : records) {
            boolean warning = isEarlyWarning(r);
            if (warning) flagged++;
            result.add(r.toBuilder().earlyWarning(warning).build());
        }
        log.info("Early warning raised on {} of {} records", flagged, records.size());
        return result;
    }

    public boolean isEarlyWarning(ScoredRecord record) {
        return votes(record) >= voteThreshold && record.getSeverity() != Severity.SEVERE;
    }

    public int votes(ScoredRecord record) {
        int votes = 0;
        for (WarningSignal signal : signals) {
            if (signal.votes(record)) votes++;
        }
        return votes;
    }
}

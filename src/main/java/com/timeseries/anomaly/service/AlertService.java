package com.timeseries.anomaly.service;

import com.timeseries.anomaly.config.AlertConfig;
import com.timeseries.anomaly.config.MetricsConfig;
import com.timeseries.anomaly.model.AlertLevel;
import com.timeseries.anomaly.model.AlertRecord;
import com.timeseries.anomaly.model.AlertStatistics;
import com.timeseries.anomaly.model.AnomalyEvent;
import com.timeseries.anomaly.model.AnomalyKind;
import com.timeseries.anomaly.repository.AlertJournalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns anomaly events into leveled alerts.
 *
 * Each notify: level the deviation, build an {@link AlertRecord}, append it to the in-memory
 * history and the daily journal, and hand CRITICAL alerts to the {@link UrgentAlertSink}.
 * The in-memory history is authoritative for statistics; the journal is the durable mirror.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private static final DateTimeFormatter ID_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneId.systemDefault());

    private final AlertConfig config;
    private final AlertJournalRepository journalRepository;
    private final UrgentAlertSink urgentAlertSink;
    private final MetricsConfig metricsConfig;

    private final List<AlertRecord> history = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private long journalFailures;

    public AlertService(AlertConfig config,
                        AlertJournalRepository journalRepository,
                        UrgentAlertSink urgentAlertSink,
                        MetricsConfig metricsConfig) {
        this.config = config;
        this.journalRepository = journalRepository;
        this.urgentAlertSink = urgentAlertSink;
        this.metricsConfig = metricsConfig;
    }

    public AlertRecord notify(AnomalyEvent event) {
        AlertRecord record;
        synchronized (this) {
            AlertLevel level = AlertLevel.fromDeviation(
                    event.getDeviation(), event.getThresholds(), config.getDefaultDeviation());
            Instant detectedAt = Instant.now();

            record = AlertRecord.builder()
                    .alertId(nextAlertId(detectedAt))
                    .timestamp(event.getTimestamp())
                    .detectedAt(detectedAt)
                    .level(level)
                    .actualValue(event.getActualValue())
                    .predictedValue(event.getPredictedValue())
                    .lowerBound(event.getLowerBound())
                    .upperBound(event.getUpperBound())
                    .deviation(event.getDeviation())
                    .kind(event.getKind())
                    .message(buildMessage(event, level))
                    .build();

            history.add(record);
            writeToJournal(record);
        }

        metricsConfig.recordAlert(record.getLevel());
        logAlert(record);

        if (record.getLevel() == AlertLevel.CRITICAL) {
            deliverUrgent(record);
        }
        return record;
    }

    public synchronized AlertStatistics statistics() {
        Map<AlertLevel, Long> byLevel = new EnumMap<>(AlertLevel.class);
        Map<AnomalyKind, Long> byKind = new EnumMap<>(AnomalyKind.class);
        for (AlertRecord record : history) {
            byLevel.merge(record.getLevel(), 1L, Long::sum);
            byKind.merge(record.getKind(), 1L, Long::sum);
        }

        int recentCount = Math.max(0, config.getRecentCount());
        List<AlertRecord> recent = List.copyOf(
                history.subList(Math.max(0, history.size() - recentCount), history.size()));

        return AlertStatistics.builder()
                .total(history.size())
                .byLevel(byLevel)
                .byKind(byKind)
                .recent(recent)
                .build();
    }

    public synchronized List<AlertRecord> getHistory() {
        return List.copyOf(history);
    }

    public synchronized long getJournalFailures() {
        return journalFailures;
    }

    /**
     * Forget the in-memory history. The journal is left untouched.
     */
    public synchronized void clearHistory() {
        history.clear();
        log.info("Alert history cleared");
    }

    public void flushJournal() {
        journalRepository.flush();
    }

    String buildMessage(AnomalyEvent event, AlertLevel level) {
        return String.format(
                "%s: Anomaly detected at %s. Actual: %.2f, Expected: %.2f (Range: %.2f - %.2f), Deviation: %.2f",
                level.messagePrefix(),
                event.getTimestamp(),
                event.getActualValue(),
                event.getPredictedValue(),
                event.getLowerBound(),
                event.getUpperBound(),
                event.getDeviation());
    }

    private String nextAlertId(Instant detectedAt) {
        return String.format("ALERT_%s_%04d", ID_STAMP.format(detectedAt), sequence.incrementAndGet());
    }

    private void writeToJournal(AlertRecord record) {
        try {
            journalRepository.append(record);
            metricsConfig.recordJournalWrite("success");
        } catch (Exception e) {
            journalFailures++;
            metricsConfig.recordJournalWrite("error");
            log.error("Failed to journal alert {}: {}", record.getAlertId(), e.getMessage(), e);
        }
    }

    private void deliverUrgent(AlertRecord record) {
        try {
            urgentAlertSink.deliver(record);
        } catch (Exception e) {
            log.error("Urgent delivery failed for alert {}: {}", record.getAlertId(), e.getMessage(), e);
        }
    }

    private void logAlert(AlertRecord record) {
        switch (record.getLevel()) {
            case CRITICAL:
                log.error("{} [{}]", record.getMessage(), record.getAlertId());
                break;
            case WARNING:
                log.warn("{} [{}]", record.getMessage(), record.getAlertId());
                break;
            default:
                log.info("{} [{}]", record.getMessage(), record.getAlertId());
                break;
        }
    }
}

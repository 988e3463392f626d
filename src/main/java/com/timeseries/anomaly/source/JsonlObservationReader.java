package com.timeseries.anomaly.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timeseries.anomaly.config.PipelineConfig;
import com.timeseries.anomaly.model.Observation;
import com.timeseries.anomaly.service.PipelineConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a JSONL file into a {@link ReplayableObservationSource}.
 * <p>
 * The timestamp comes from {@code timestamp}, or from {@code date} + {@code time} when those
 * are split. The value comes from the configured field, falling back to {@code value}.
 * Lines without a numeric value are skipped; unparseable JSON fails the whole load.
 */
@Component
public class JsonlObservationReader {

    private static final Logger log = LoggerFactory.getLogger(JsonlObservationReader.class);

    // "2024-01-01 13:00", "2024-01-01 13:00:00", "2024-01-01T13:00:00.250", "2024-01-01T13:00:00Z"
    // Strings without an offset are local to the configured zone
    private static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd")
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .appendPattern("HH:mm")
            .optionalStart()
            .appendPattern(":ss")
            .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .optionalEnd()
            .optionalStart().appendOffsetId().optionalEnd()
            .toFormatter();

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String valueField;
    private final ZoneId zone;

    public JsonlObservationReader(PipelineConfig config) {
        this.valueField = config.getValueField();
        try {
            this.zone = ZoneId.of(config.getZone());
        } catch (DateTimeException e) {
            throw new PipelineConfigurationException("Invalid pipeline.zone: " + config.getZone(), e);
        }
    }

    public ReplayableObservationSource read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PipelineConfigurationException("Observation source not found: " + path.toAbsolutePath());
        }

        List<Observation> observations = new ArrayList<>();
        int lineNumber = 0;
        int skipped = 0;

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) continue;

                JsonNode record = objectMapper.readTree(line);
                Observation observation = toObservation(record, lineNumber);
                if (observation == null) {
                    skipped++;
                    continue;
                }
                observations.add(observation);
            }
        } catch (JsonProcessingException e) {
            throw new PipelineConfigurationException(
                    "Malformed JSON on line " + lineNumber + " of " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PipelineConfigurationException("Failed to read observation source " + path, e);
        }

        if (observations.isEmpty() && skipped > 0) {
            throw new PipelineConfigurationException(String.format(
                    "No usable observations in %s: all %d records were skipped (check pipeline.value-field and timestamp format)",
                    path, skipped));
        }

        log.info("Loaded {} observations from {} ({} skipped)", observations.size(), path, skipped);
        return new ReplayableObservationSource(observations);
    }

    Observation toObservation(JsonNode record, int lineNumber) {
        String rawTimestamp = timestampText(record);
        JsonNode valueNode = record.hasNonNull(valueField) ? record.get(valueField) : record.get("value");

        if (rawTimestamp == null || valueNode == null || !valueNode.isNumber()) {
            log.warn("Skipping line {}: missing timestamp or numeric '{}' field", lineNumber, valueField);
            return null;
        }

        try {
            return Observation.of(parseTimestamp(rawTimestamp.trim()), valueNode.asDouble());
        } catch (DateTimeParseException e) {
            log.warn("Skipping line {}: unparseable timestamp '{}'", lineNumber, rawTimestamp);
            return null;
        }
    }

    private Instant parseTimestamp(String text) {
        TemporalAccessor parsed = TIMESTAMP.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toInstant();
        }
        return ((LocalDateTime) parsed).atZone(zone).toInstant();
    }

    private static String timestampText(JsonNode record) {
        if (record.hasNonNull("timestamp")) {
            return record.get("timestamp").asText();
        }
        if (record.hasNonNull("date") && record.hasNonNull("time")) {
            return record.get("date").asText() + " " + record.get("time").asText();
        }
        return null;
    }
}

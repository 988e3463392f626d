package com.timeseries.anomaly.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.timeseries.anomaly.config.AlertConfig;
import com.timeseries.anomaly.model.AlertRecord;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only JSONL journal of alerts, one file per calendar day of detection
 * ({@code alerts_yyyyMMdd.jsonl}). Each line is flushed as it is written.
 */
@Repository
public class AlertJournalRepository {

    private static final Logger log = LoggerFactory.getLogger(AlertJournalRepository.class);

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Path journalDir;
    private final ZoneId zone;
    private final ObjectMapper objectMapper;

    private BufferedWriter writer;
    private LocalDate writerDay;

    public AlertJournalRepository(AlertConfig config) {
        this.journalDir = Paths.get(config.getJournalDir());
        this.zone = ZoneId.systemDefault();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * @throws UncheckedIOException if the line could not be written
     */
    public synchronized void append(AlertRecord record) {
        LocalDate day = record.getDetectedAt().atZone(zone).toLocalDate();
        try {
            BufferedWriter out = writerFor(day);
            out.write(objectMapper.writeValueAsString(record));
            out.newLine();
            out.flush();
        } catch (IOException e) {
            closeWriter();
            throw new UncheckedIOException("Failed to append alert " + record.getAlertId() + " to journal", e);
        }
    }

    /**
     * Read back every alert journaled on {@code day}, in write order.
     */
    public synchronized List<AlertRecord> replay(LocalDate day) {
        Path file = fileFor(day);
        List<AlertRecord> records = new ArrayList<>();
        if (!Files.isRegularFile(file)) {
            return records;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    records.add(objectMapper.readValue(line, AlertRecord.class));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to replay journal " + file, e);
        }
        return records;
    }

    public Path fileFor(LocalDate day) {
        return journalDir.resolve("alerts_" + DAY.format(day) + ".jsonl");
    }

    public synchronized void flush() {
        if (writer == null) return;
        try {
            writer.flush();
        } catch (IOException e) {
            log.error("Failed to flush alert journal for {}", writerDay, e);
        }
    }

    @PreDestroy
    public synchronized void close() {
        flush();
        closeWriter();
    }

    private BufferedWriter writerFor(LocalDate day) throws IOException {
        if (writer != null && day.equals(writerDay)) {
            return writer;
        }
        closeWriter();
        Files.createDirectories(journalDir);
        writer = Files.newBufferedWriter(fileFor(day), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        writerDay = day;
        log.info("Alert journal opened: {}", fileFor(day));
        return writer;
    }

    private void closeWriter() {
        if (writer == null) return;
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("Failed to close alert journal for {}: {}", writerDay, e.getMessage());
        } finally {
            writer = null;
            writerDay = null;
        }
    }
}

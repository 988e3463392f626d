package com.timeseries.anomaly.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.timeseries.anomaly.config.ModelStoreConfig;
import com.timeseries.anomaly.model.ModelSnapshot;
import com.timeseries.anomaly.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * File-backed store of model snapshots and the training data they were fitted on.
 * <p>
 * Blobs are GZIP-compressed JSON. Names embed a UTC timestamp
 * ({@code model_yyyyMMdd_HHmmss_SSS.bin}) so lexicographic order is save order; each snapshot
 * has a {@code training_data_...} sibling with the same stamp. Only the newest
 * {@code model-store.retention} of each are kept.
 */
@Repository
public class ModelSnapshotRepository {

    private static final Logger log = LoggerFactory.getLogger(ModelSnapshotRepository.class);

    static final String MODEL_PREFIX = "model_";
    static final String TRAINING_DATA_PREFIX = "training_data_";
    static final String EXTENSION = ".bin";

    private static final DateTimeFormatter NAME_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private static final TypeReference<List<Observation>> OBSERVATION_LIST = new TypeReference<>() {};

    private final Path storageDir;
    private final int retention;
    private final ObjectMapper objectMapper;

    public ModelSnapshotRepository(ModelStoreConfig config) {
        this.storageDir = Paths.get(config.getDir());
        this.retention = config.getRetention();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Name for a snapshot trained at {@code trainedAt}. A numeric suffix keeps names unique
     * (and still ordered) when two snapshots share a millisecond.
     */
    public synchronized String nameFor(Instant trainedAt) {
        String base = MODEL_PREFIX + NAME_STAMP.format(trainedAt);
        String name = base + EXTENSION;
        int suffix = 1;
        while (Files.exists(storageDir.resolve(name))) {
            name = String.format("%s_%03d%s", base, suffix++, EXTENSION);
        }
        return name;
    }

    public synchronized void save(ModelSnapshot snapshot, String name) {
        requireModelName(name);
        writeBlob(storageDir.resolve(name), snapshot);
        log.info("Saved model snapshot {} (phase={}, bufferSizeAtTrain={})",
                name, snapshot.getPhase(), snapshot.getBufferSizeAtTrain());
        cleanup(MODEL_PREFIX);
    }

    public synchronized ModelSnapshot load(String name) {
        requireModelName(name);
        return readBlob(storageDir.resolve(name), ModelSnapshot.class);
    }

    /**
     * Save the training buffer next to the snapshot called {@code modelName}.
     */
    public synchronized void saveTrainingData(List<Observation> trainingData, String modelName) {
        requireModelName(modelName);
        Map<String, Object> blob = new LinkedHashMap<>();
        blob.put("savedAt", Instant.now());
        blob.put("count", trainingData.size());
        blob.put("observations", trainingData);

        String name = trainingDataNameFor(modelName);
        writeBlob(storageDir.resolve(name), blob);
        log.info("Saved training data {} ({} observations)", name, trainingData.size());
        cleanup(TRAINING_DATA_PREFIX);
    }

    public synchronized List<Observation> loadTrainingData(String modelName) {
        requireModelName(modelName);
        JsonNode blob = readBlob(storageDir.resolve(trainingDataNameFor(modelName)), JsonNode.class);
        JsonNode observations = blob.get("observations");
        if (observations == null || !observations.isArray()) {
            throw new ModelStoreException("Training data for " + modelName + " has no observations array");
        }
        return objectMapper.convertValue(observations, OBSERVATION_LIST);
    }

    /**
     * @return the newest snapshot name, if any
     */
    public synchronized Optional<String> latest() {
        List<String> names = list();
        return names.isEmpty() ? Optional.empty() : Optional.of(names.get(0));
    }

    /**
     * @return snapshot names, newest first
     */
    public synchronized List<String> list() {
        return listNames(MODEL_PREFIX);
    }

    public synchronized Map<String, Object> info() {
        List<String> models = listNames(MODEL_PREFIX);
        List<String> trainingData = listNames(TRAINING_DATA_PREFIX);

        long totalBytes = 0;
        for (String name : concat(models, trainingData)) {
            try {
                totalBytes += Files.size(storageDir.resolve(name));
            } catch (IOException e) {
                log.warn("Could not size {}: {}", name, e.getMessage());
            }
        }

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("storagePath", storageDir.toAbsolutePath().toString());
        info.put("modelCount", models.size());
        info.put("trainingDataCount", trainingData.size());
        info.put("totalSizeBytes", totalBytes);
        info.put("latestModel", models.isEmpty() ? null : models.get(0));
        info.put("retention", retention);
        return info;
    }

    static String trainingDataNameFor(String modelName) {
        return TRAINING_DATA_PREFIX + modelName.substring(MODEL_PREFIX.length());
    }

    private void writeBlob(Path target, Object value) {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(storageDir);
            try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(tmp))) {
                objectMapper.writeValue(out, value);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new ModelStoreException("Failed to write " + target, e);
        }
    }

    private <T> T readBlob(Path source, Class<T> type) {
        if (!Files.isRegularFile(source)) {
            throw new ModelStoreException("Blob not found: " + source);
        }
        try (InputStream in = new GZIPInputStream(Files.newInputStream(source))) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new ModelStoreException("Failed to read " + source, e);
        }
    }

    private List<String> listNames(String prefix) {
        if (!Files.isDirectory(storageDir)) {
            return new ArrayList<>();
        }
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(storageDir, prefix + "*" + EXTENSION)) {
            for (Path path : stream) {
                names.add(path.getFileName().toString());
            }
        } catch (IOException e) {
            throw new ModelStoreException("Failed to list " + storageDir, e);
        }
        names.sort(Comparator.reverseOrder());
        return names;
    }

    private void cleanup(String prefix) {
        List<String> names = listNames(prefix);
        if (names.size() <= retention) {
            return;
        }
        for (String name : names.subList(retention, names.size())) {
            try {
                Files.deleteIfExists(storageDir.resolve(name));
                log.info("Deleted old blob: {}", name);
            } catch (IOException e) {
                log.warn("Failed to delete old blob {}: {}", name, e.getMessage());
            }
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to remove temp file {}: {}", path, e.getMessage());
        }
    }

    private static void requireModelName(String name) {
        if (name == null || !name.startsWith(MODEL_PREFIX) || !name.endsWith(EXTENSION)
                || name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new ModelStoreException("Invalid snapshot name: " + name);
        }
    }

    private static List<String> concat(List<String> a, List<String> b) {
        List<String> all = new ArrayList<>(a);
        all.addAll(b);
        return all;
    }
}

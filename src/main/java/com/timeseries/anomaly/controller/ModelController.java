package com.timeseries.anomaly.controller;

import com.timeseries.anomaly.model.ModelSnapshot;
import com.timeseries.anomaly.repository.ModelSnapshotRepository;
import com.timeseries.anomaly.repository.ModelStoreException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Persisted forecasting model snapshots")
public class ModelController {

    private final ModelSnapshotRepository modelRepository;

    public ModelController(ModelSnapshotRepository modelRepository) {
        this.modelRepository = modelRepository;
    }

    @Operation(summary = "List persisted snapshots", description = "Snapshot names, newest first.")
    @GetMapping
    public ResponseEntity<?> listSnapshots() {
        try {
            return ResponseEntity.ok(modelRepository.list());
        } catch (ModelStoreException e) {
            return storeError("Failed to list snapshots", e);
        }
    }

    @Operation(summary = "Get latest snapshot metadata",
            description = "Phase, training time, buffer size and severity thresholds of the newest snapshot on disk.")
    @GetMapping("/latest")
    public ResponseEntity<?> getLatest() {
        Optional<String> latest;
        try {
            latest = modelRepository.latest();
        } catch (ModelStoreException e) {
            return storeError("Failed to list snapshots", e);
        }
        if (latest.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        try {
            ModelSnapshot snapshot = modelRepository.load(latest.get());
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("name", latest.get());
            metadata.put("phase", snapshot.getPhase());
            metadata.put("trainedAt", snapshot.getTrainedAt());
            metadata.put("bufferSizeAtTrain", snapshot.getBufferSizeAtTrain());
            metadata.put("thresholds", snapshot.getThresholds());
            return ResponseEntity.ok(metadata);
        } catch (ModelStoreException e) {
            return storeError("Failed to load " + latest.get(), e);
        }
    }

    @Operation(summary = "Get model store info",
            description = "Storage directory, snapshot and training data counts, total size and retention.")
    @GetMapping("/info")
    public ResponseEntity<?> getStoreInfo() {
        try {
            return ResponseEntity.ok(modelRepository.info());
        } catch (ModelStoreException e) {
            return storeError("Failed to read model store info", e);
        }
    }

    private ResponseEntity<Map<String, String>> storeError(String what, ModelStoreException e) {
        return ResponseEntity.internalServerError().body(Map.of("error", what + ": " + e.getMessage()));
    }
}

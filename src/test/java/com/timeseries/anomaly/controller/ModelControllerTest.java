package com.timeseries.anomaly.controller;

import com.timeseries.anomaly.model.ModelSnapshot;
import com.timeseries.anomaly.model.SeverityThresholds;
import com.timeseries.anomaly.repository.ModelSnapshotRepository;
import com.timeseries.anomaly.repository.ModelStoreException;
import com.timeseries.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ModelController.class)
class ModelControllerTest {

    private static final String NAME = "model_20240101_000000_000.bin";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ModelSnapshotRepository modelRepository;

    @Test
    void listSnapshots_newestFirst() throws Exception {
        when(modelRepository.list()).thenReturn(List.of("model_20240102_000000_000.bin", NAME));

        mockMvc.perform(get("/api/v1/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("model_20240102_000000_000.bin"))
                .andExpect(jsonPath("$[1]").value(NAME));
    }

    @Test
    void getLatest_found() throws Exception {
        when(modelRepository.latest()).thenReturn(Optional.of(NAME));
        when(modelRepository.load(NAME)).thenReturn(ModelSnapshot.builder()
                .phase(2)
                .trainedAt(TestDataFactory.START)
                .bufferSizeAtTrain(168)
                .thresholds(SeverityThresholds.fromIntervalHalfWidth(2.0))
                .build());

        mockMvc.perform(get("/api/v1/models/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value(NAME))
                .andExpect(jsonPath("$.phase").value(2))
                .andExpect(jsonPath("$.bufferSizeAtTrain").value(168))
                .andExpect(jsonPath("$.thresholds.critical").value(4.0));
    }

    @Test
    void getLatest_notFound() throws Exception {
        when(modelRepository.latest()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/models/latest"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getLatest_unreadableSnapshot() throws Exception {
        when(modelRepository.latest()).thenReturn(Optional.of(NAME));
        when(modelRepository.load(NAME)).thenThrow(new ModelStoreException("corrupt"));

        mockMvc.perform(get("/api/v1/models/latest"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void listSnapshots_unreadableStore() throws Exception {
        when(modelRepository.list()).thenThrow(new ModelStoreException("permission denied"));

        mockMvc.perform(get("/api/v1/models"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void getStoreInfo_unreadableStore() throws Exception {
        when(modelRepository.info()).thenThrow(new ModelStoreException("permission denied"));

        mockMvc.perform(get("/api/v1/models/info"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void getStoreInfo() throws Exception {
        when(modelRepository.info()).thenReturn(Map.of("modelCount", 3, "retention", 5));

        mockMvc.perform(get("/api/v1/models/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.modelCount").value(3))
                .andExpect(jsonPath("$.retention").value(5));
    }
}

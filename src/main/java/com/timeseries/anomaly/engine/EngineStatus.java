package com.timeseries.anomaly.engine;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class EngineStatus {

    int phase;
    String phaseName;
    int bufferSize;
    int lastTrainedBufferSize;
    Instant trainedAt;
    long observations;
    long retrainings;
    long trainingFailures;
    long scoringFailures;
    long anomalies;
    long outOfOrderObservations;
}

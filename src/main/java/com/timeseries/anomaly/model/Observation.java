package com.timeseries.anomaly.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One timestamped scalar measurement, immutable once produced.
 */
@Value
@Builder
@Jacksonized
public class Observation {

    Instant timestamp;
    double value;

    public static Observation of(Instant timestamp, double value) {
        return new Observation(timestamp, value);
    }
}

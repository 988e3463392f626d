package com.timeseries.anomaly.engine;

import com.timeseries.anomaly.model.AnomalyEvent;
import com.timeseries.anomaly.model.Observation;

import java.util.Optional;

/**
 * What processing one observation produced: at most one model update and at most one anomaly.
 */
public final class ObservationOutcome {

    private final Observation observation;
    private final ModelUpdatedEvent modelUpdate;
    private final AnomalyEvent anomaly;

    public ObservationOutcome(Observation observation, ModelUpdatedEvent modelUpdate, AnomalyEvent anomaly) {
        this.observation = observation;
        this.modelUpdate = modelUpdate;
        this.anomaly = anomaly;
    }

    public Observation observation() {
        return observation;
    }

    public Optional<ModelUpdatedEvent> modelUpdate() {
        return Optional.ofNullable(modelUpdate);
    }

    public Optional<AnomalyEvent> anomaly() {
        return Optional.ofNullable(anomaly);
    }
}

package com.timeseries.anomaly.engine;

import com.timeseries.anomaly.model.ModelSnapshot;
import com.timeseries.anomaly.model.Observation;
import lombok.Value;

import java.util.List;

/**
 * Emitted once per successful retraining: the new live snapshot and the exact buffer it was fitted on.
 */
@Value
public class ModelUpdatedEvent {

    ModelSnapshot snapshot;
    List<Observation> trainingData;
}

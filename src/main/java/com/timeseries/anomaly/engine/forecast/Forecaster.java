package com.timeseries.anomaly.engine.forecast;

import com.timeseries.anomaly.model.Observation;

import java.util.List;

/**
 * Trainable forecasting capability. Each call to {@link #fit} yields a new, immutable model;
 * implementations keep no state between calls.
 */
public interface Forecaster {

    /**
     * Fit a model on the given history, in the order given.
     *
     * @throws ForecastException if no model can be fitted (e.g. a degenerate history)
     */
    TrainedModel fit(List<Observation> history);
}

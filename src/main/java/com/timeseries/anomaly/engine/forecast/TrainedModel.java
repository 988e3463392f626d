package com.timeseries.anomaly.engine.forecast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = HarmonicRegressionModel.class, name = "harmonic-regression")
})
public interface TrainedModel {

    /**
     * Point forecast and prediction interval for an arbitrary timestamp.
     *
     * @throws ForecastException if the model cannot produce a finite forecast
     */
    Forecast predict(Instant timestamp);
}

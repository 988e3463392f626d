package com.timeseries.anomaly.engine.forecast;

import lombok.Value;

@Value
public class Forecast {

    double point;
    double lower;
    double upper;

    public double halfWidth() {
        return (upper - lower) / 2.0;
    }
}

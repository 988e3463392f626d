package com.timeseries.anomaly.model;

public enum AnomalyKind {
    ABOVE_UPPER,
    BELOW_LOWER
}

package com.timeseries.anomaly.model;

public enum AlertLevel {
    INFO("[INFO]"),
    WARNING("[WARNING]"),
    CRITICAL("[CRITICAL] ANOMALY");

    private final String messagePrefix;

    AlertLevel(String messagePrefix) {
        this.messagePrefix = messagePrefix;
    }

    public String messagePrefix() {
        return messagePrefix;
    }

    /**
     * Level a deviation. With thresholds: critical / warning cut-offs apply as given.
     * Without: {@code defaultDeviation} is the CRITICAL cut-off and half of it the WARNING cut-off.
     */
    public static AlertLevel fromDeviation(double deviation, SeverityThresholds thresholds,
                                           double defaultDeviation) {
        if (thresholds != null) {
            if (deviation >= thresholds.getCritical()) return CRITICAL;
            if (deviation >= thresholds.getWarning()) return WARNING;
            return INFO;
        }
        if (deviation >= defaultDeviation) return CRITICAL;
        if (deviation >= defaultDeviation * 0.5) return WARNING;
        return INFO;
    }
}

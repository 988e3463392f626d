package com.timeseries.anomaly.service;

import com.timeseries.anomaly.model.AlertRecord;

/**
 * Side channel for CRITICAL alerts. Implementations must not block the caller and must
 * report (log / count) delivery failures instead of throwing them.
 */
public interface UrgentAlertSink {

    void deliver(AlertRecord alert);
}

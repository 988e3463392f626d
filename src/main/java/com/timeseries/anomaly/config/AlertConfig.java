package com.timeseries.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "alert")
public class AlertConfig {

    // CRITICAL cut-off when an anomaly carries no thresholds; WARNING is half of it
    private double defaultDeviation = 5.0;

    // Directory of the daily alerts_yyyyMMdd.jsonl journals
    private String journalDir = "logs";

    // How many records the statistics view reports as "recent"
    private int recentCount = 5;

    // Attach the model's interval-derived thresholds to anomaly events
    private boolean useDerivedThresholds = true;
}

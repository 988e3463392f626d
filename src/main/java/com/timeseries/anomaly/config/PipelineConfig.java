package com.timeseries.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineConfig {

    // JSONL file of observations, one object per line
    private String sourcePath = "data/observations.jsonl";

    // Field holding the scalar value; "value" is tried when this one is absent
    private String valueField = "temperature";

    // Zone used to interpret the local timestamps in the source file
    private String zone = "UTC";

    // Playback multiplier. 0 = no delay between observations.
    private double speed = 0.0;

    // Delay between observations at speed 1.0
    private Duration baseInterval = Duration.ofSeconds(1);

    // Confidence level of the forecast prediction interval
    private double confidenceLevel = 0.95;

    // Retraining schedule, counted in observations: ~1 day, ~1 week, ~1 month of hourly data
    private int shortThreshold = 24;
    private int mediumThreshold = 168;
    private int recurringThreshold = 720;

    private boolean autoStart = true;

    // Reload the latest snapshot + training data and continue from there
    private boolean resumeFromSnapshot = true;

    // Refuse to start when no snapshot can be loaded
    private boolean requirePretrainedModel = false;

    private int statusIntervalSeconds = 10;
}

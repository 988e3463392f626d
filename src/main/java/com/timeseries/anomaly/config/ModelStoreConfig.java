package com.timeseries.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "model-store")
public class ModelStoreConfig {

    private String dir = "models";

    // Number of most recent snapshots (and training data blobs) kept on disk
    private int retention = 5;
}

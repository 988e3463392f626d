package com.timeseries.anomaly.config;

import com.timeseries.anomaly.engine.forecast.Forecaster;
import com.timeseries.anomaly.engine.forecast.HarmonicRegressionForecaster;
import com.timeseries.anomaly.service.PipelineConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "forecast")
public class ForecastConfig {

    // Fourier order of the daily (24h) and weekly (168h) seasonal terms
    private int dailyOrder = 3;
    private int weeklyOrder = 3;

    // Lower bound for the residual standard deviation used to build intervals
    private double minSigma = 0.01;

    @Bean
    public Forecaster forecaster(PipelineConfig pipelineConfig) {
        try {
            return new HarmonicRegressionForecaster(dailyOrder, weeklyOrder, minSigma,
                    pipelineConfig.getConfidenceLevel());
        } catch (IllegalArgumentException e) {
            throw new PipelineConfigurationException("Invalid pipeline.confidence-level: " + e.getMessage(), e);
        }
    }
}

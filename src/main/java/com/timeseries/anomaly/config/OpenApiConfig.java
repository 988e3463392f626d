package com.timeseries.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI forecastAnomalyDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Forecast Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Read-only view of a streaming anomaly detection pipeline.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Replay timestamped observations from a JSONL source at a configurable speed\n" +
                                "2. Buffer every observation; retrain the forecasting model after 24, 168 and " +
                                "then every 720 further observations\n" +
                                "3. Flag observations outside the live model's prediction interval\n" +
                                "4. Level each anomaly **INFO** / **WARNING** / **CRITICAL** and journal it\n" +
                                "5. Persist every trained model snapshot, keeping the most recent few\n\n" +
                                "**Training phases:** `0` cold (no scoring), `1` short-horizon, " +
                                "`2` medium-horizon, `3+` steady-state")
                        .contact(new Contact().name("Anomaly Detection Team")));
    }
}

package com.timeseries.anomaly.runner;

import com.timeseries.anomaly.config.PipelineConfig;
import com.timeseries.anomaly.service.StreamingPipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Starts streaming once the context is up, unless {@code pipeline.auto-start=false}.
 * <p>
 * Configuration and startup failures propagate and terminate the process with the
 * exception's exit code.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.arguments="--pipeline.source-path=data/x.jsonl --pipeline.speed=100"
 */
@Component
@Order(1)
public class PipelineStartupRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineStartupRunner.class);

    private final PipelineConfig config;
    private final StreamingPipelineService pipelineService;

    public PipelineStartupRunner(PipelineConfig config, StreamingPipelineService pipelineService) {
        this.config = config;
        this.pipelineService = pipelineService;
    }

    @Override
    public void run(String... args) {
        if (!config.isAutoStart()) {
            log.info("pipeline.auto-start is false; not streaming");
            return;
        }
        log.info("=== Starting anomaly detection pipeline from {} ===", config.getSourcePath());
        pipelineService.start();
    }
}

package com.timeseries.anomaly.service;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Invalid run parameters. Fatal; raised before the pull loop starts.
 */
public class PipelineConfigurationException extends RuntimeException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 3;

    public PipelineConfigurationException(String message) {
        super(message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}

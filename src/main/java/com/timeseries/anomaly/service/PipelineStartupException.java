package com.timeseries.anomaly.service;

import org.springframework.boot.ExitCodeGenerator;

/**
 * The pipeline was told to start from a trained model but none could be loaded.
 */
public class PipelineStartupException extends RuntimeException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 2;

    public PipelineStartupException(String message) {
        super(message);
    }

    public PipelineStartupException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}

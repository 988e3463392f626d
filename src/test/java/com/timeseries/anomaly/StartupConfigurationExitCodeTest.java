package com.timeseries.anomaly;

import org.junit.jupiter.api.Test;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.WebApplicationType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Invalid run parameters must fail the boot with the configuration exit code.
 */
class StartupConfigurationExitCodeTest {

    private static int exitCodeOfFailedBoot(String... args) {
        Throwable failure = catchThrowable(() -> new SpringApplicationBuilder(AnomalyDetectionApplication.class)
                .web(WebApplicationType.NONE)
                .profiles("test")
                .run(args)
                .close());

        assertThat(failure).isNotNull();
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ExitCodeGenerator) {
                return ((ExitCodeGenerator) t).getExitCode();
            }
        }
        return 1;
    }

    @Test
    void nonPositiveRetrainingThreshold_exitsWithConfigurationCode() {
        assertThat(exitCodeOfFailedBoot("--pipeline.auto-start=false", "--pipeline.short-threshold=0"))
                .isEqualTo(3);
    }

    @Test
    void confidenceLevelOutOfRange_exitsWithConfigurationCode() {
        assertThat(exitCodeOfFailedBoot("--pipeline.auto-start=false", "--pipeline.confidence-level=1.5"))
                .isEqualTo(3);
    }

    @Test
    void missingSourceFileWithAutoStart_exitsWithConfigurationCode() {
        assertThat(exitCodeOfFailedBoot("--pipeline.auto-start=true",
                "--pipeline.source-path=target/does-not-exist.jsonl"))
                .isEqualTo(3);
    }
}

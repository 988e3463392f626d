package com.timeseries.anomaly.service;

import com.timeseries.anomaly.config.MetricsConfig;
import com.timeseries.anomaly.config.TwilioNotificationConfig;
import com.timeseries.anomaly.model.AlertLevel;
import com.timeseries.anomaly.model.AlertRecord;
import com.timeseries.anomaly.model.AnomalyKind;
import com.timeseries.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TwilioNotificationServiceTest {

    private SimpleMeterRegistry registry;
    private TwilioNotificationService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        TwilioNotificationConfig config = new TwilioNotificationConfig();
        config.setEnabled(false);
        service = new TwilioNotificationService(config, new MetricsConfig(registry));
        service.init();
    }

    @Test
    void buildMessageBody_carriesAlertDetails() {
        AlertRecord alert = TestDataFactory.createAlertRecord(
                "ALERT_20240601120000_0007", AlertLevel.CRITICAL, AnomalyKind.ABOVE_UPPER, 15.0);

        String body = service.buildMessageBody(alert);

        assertThat(body).startsWith("[CRITICAL ALERT]");
        assertThat(body).contains("ALERT_20240601120000_0007");
        assertThat(body).contains(alert.getTimestamp().toString());
    }

    @Test
    void deliver_whenDisabled_logsAndCountsWithoutSending() {
        AlertRecord alert = TestDataFactory.createAlertRecord(
                "ALERT_1", AlertLevel.CRITICAL, AnomalyKind.BELOW_LOWER, 9.0);

        service.deliver(alert);

        assertThat(registry.get("notification.sent.count")
                .tag("channel", "log")
                .tag("status", "success")
                .counter().count()).isEqualTo(1.0);
    }
}

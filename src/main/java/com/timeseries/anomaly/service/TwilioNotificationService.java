package com.timeseries.anomaly.service;

import com.timeseries.anomaly.config.MetricsConfig;
import com.timeseries.anomaly.config.TwilioNotificationConfig;
import com.timeseries.anomaly.model.AlertRecord;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Urgent channel for CRITICAL alerts: SMS / WhatsApp through Twilio when enabled,
 * otherwise a line on the dedicated {@code URGENT} logger.
 */
@Service
public class TwilioNotificationService implements UrgentAlertSink {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);
    private static final Logger urgentLog = LoggerFactory.getLogger("URGENT");

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio notification service is DISABLED. Urgent alerts go to the URGENT log only.");
        }
    }

    @Async
    @Override
    @Observed(name = "notification.send", contextualName = "send-urgent-alert")
    public void deliver(AlertRecord alert) {
        String body = buildMessageBody(alert);
        urgentLog.error("URGENT {} | {}", alert.getAlertId(), body.replace('\n', ' '));

        if (!config.isEnabled()) {
            metricsConfig.recordNotification("log", "success");
            return;
        }

        try {
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getToNumber());

            Message message = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    body
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Twilio notification sent for alert={}, sid={}", alert.getAlertId(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send Twilio notification for alert={}: {}", alert.getAlertId(), e.getMessage(), e);
        }
    }

    String buildMessageBody(AlertRecord alert) {
        return String.format(
                "[CRITICAL ALERT] Immediate attention required\n" +
                "Alert ID: %s\n" +
                "Observed at: %s\n" +
                "Actual: %.2f\n" +
                "Expected: %.2f (%.2f - %.2f)\n" +
                "Deviation: %.2f",
                alert.getAlertId(),
                alert.getTimestamp(),
                alert.getActualValue(),
                alert.getPredictedValue(),
                alert.getLowerBound(),
                alert.getUpperBound(),
                alert.getDeviation()
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}

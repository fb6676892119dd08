package com.ecp.governance.service;

import com.ecp.governance.config.MetricsConfig;
import com.ecp.governance.config.NotificationConfig;
import com.ecp.governance.model.Escalation;
import com.ecp.governance.model.Violation;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Alerts human reviewers about blocking violations over Twilio SMS or WhatsApp.
 * Best effort: failures are logged and counted, never thrown to the caller.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationConfig config;
    private final MetricsConfig metricsConfig;

    public NotificationService(NotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Escalation notifications initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Escalation notifications are DISABLED.");
        }
    }

    @Async
    @Observed(name = "notification.send", contextualName = "send-escalation-notification")
    public void notifyEscalation(Escalation escalation, Violation violation) {
        if (!config.isEnabled()) {
            return;
        }

        Future<Message> pending = null;
        try {
            String body = buildMessageBody(escalation, violation);
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getToNumber());

            pending = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    body
            ).createAsync();
            Message message = pending.get(config.getTimeoutMs(), TimeUnit.MILLISECONDS);

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Escalation notification sent for escalation={}, sid={}",
                    escalation.getEscalationId(), message.getSid());
        } catch (TimeoutException e) {
            pending.cancel(true);
            metricsConfig.recordNotification(config.getChannel(), "timeout");
            log.error("Escalation notification for escalation={} timed out after {} ms",
                    escalation.getEscalationId(), config.getTimeoutMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Interrupted while notifying escalation={}", escalation.getEscalationId());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send escalation notification for escalation={}: {}",
                    escalation.getEscalationId(), e.getMessage(), e);
        }
    }

    String buildMessageBody(Escalation escalation, Violation violation) {
        return String.format(
                "[GOVERNANCE ALERT] Human review required\n" +
                "Escalation: %s\n" +
                "Violation: %s (%s)\n" +
                "Agent: %s\n" +
                "Reason: %s",
                escalation.getEscalationId(),
                violation.getViolationType(),
                violation.getSeverity().getValue(),
                violation.getAgentId() != null ? violation.getAgentId() : "N/A",
                violation.getMessage()
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}

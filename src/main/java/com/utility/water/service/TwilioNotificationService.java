package com.utility.water.service;

import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import com.utility.water.config.MetricsConfig;
import com.utility.water.config.TwilioNotificationConfig;
import com.utility.water.model.ClassificationResult;
import com.utility.water.model.LeakStatus;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sends an SMS or WhatsApp alert when a reading is classified as Leak Detected.
 * Alerts for the same ongoing leak are throttled by {@code twilio.cooldown}.
 * Delivery failures are logged and counted; they never reach the caller.
 */
@Service
public class TwilioNotificationService {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final AtomicReference<Instant> lastAlertAt = new AtomicReference<>();

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig, Clock clock) {
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Leak alerts enabled over {} to {}, cooldown {}",
                    config.getChannel(), config.getToNumber(), config.getCooldown());
        } else {
            log.info("Leak alerts are DISABLED.");
        }
    }

    @Async
    @Observed(name = "notification.send", contextualName = "send-leak-alert")
    public void notifyIfLeakDetected(ClassificationResult result) {
        if (!config.isEnabled() || result.getLeakStatus() != LeakStatus.LEAK_DETECTED) {
            return;
        }
        if (!claimAlertSlot(clock.instant())) {
            metricsConfig.recordNotification(config.getChannel(), "suppressed");
            log.debug("Leak alert suppressed, last alert at {}", lastAlertAt.get());
            return;
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(address(config.getToNumber())),
                    new PhoneNumber(address(config.getFromNumber())),
                    buildMessageBody(result)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Leak alert sent: flow={}, probability={}, sid={}",
                    result.getLiveFlowRate(), result.getLeakProbability(), message.getSid());
        } catch (Exception e) {
            // Free the slot so the next reading retries
            lastAlertAt.set(null);
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send leak alert for flow={}: {}", result.getLiveFlowRate(), e.getMessage(), e);
        }
    }

    /**
     * True, and the slot taken, when no alert went out within the cooldown before {@code now}.
     */
    boolean claimAlertSlot(Instant now) {
        while (true) {
            Instant last = lastAlertAt.get();
            if (last != null && now.isBefore(last.plus(config.getCooldown()))) {
                return false;
            }
            if (lastAlertAt.compareAndSet(last, now)) {
                return true;
            }
        }
    }

    String buildMessageBody(ClassificationResult result) {
        return String.format(
                "[LEAK ALERT] %s\n" +
                "Live flow: %.2f (expected %.2f)\n" +
                "Leak probability: %.2f%%\n" +
                "Action: check for running fixtures or burst pipes",
                result.getLeakStatus().getLabel(),
                result.getLiveFlowRate(),
                result.getExpectedUsage(),
                result.getLeakProbability()
        );
    }

    private String address(String number) {
        return "whatsapp".equalsIgnoreCase(config.getChannel()) ? "whatsapp:" + number : number;
    }
}

package com.utility.water.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private boolean enabled = false;

    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String toNumber;

    // "sms" or "whatsapp"
    private String channel = "sms";

    // An ongoing leak is classified on every reading; alert at most once per window
    private Duration cooldown = Duration.ofMinutes(30);
}

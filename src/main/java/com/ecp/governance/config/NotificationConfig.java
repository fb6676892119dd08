package com.ecp.governance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "notification")
public class NotificationConfig {

    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String toNumber;
    private boolean enabled = false;
    private String channel = "sms";  // "sms" or "whatsapp"
    private long timeoutMs = 5000;
}

package com.ai.salon.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Outbound webhook targets and the outbox dispatcher's retry policy.
 */
@Data
@ConfigurationProperties(prefix = "notification")
public class NotificationProperties {

    /**
     * Human channel notified when a help request is created.
     */
    private String supervisorWebhookUrl;

    /**
     * Conversational runtime notified when a help request is resolved.
     */
    private String agentCallbackUrl;

    private Duration timeout = Duration.ofSeconds(10);

    /**
     * Delivery attempts per notification, the first one included.
     */
    private int maxAttempts = 3;

    /**
     * Backoff before the first retry; doubles on every further attempt.
     */
    private Duration initialBackoff = Duration.ofSeconds(30);

    private Duration maxBackoff = Duration.ofMinutes(15);

    /**
     * Delay between two dispatcher passes over the outbox.
     */
    private Duration pollInterval = Duration.ofSeconds(15);

    private int batchSize = 50;
}

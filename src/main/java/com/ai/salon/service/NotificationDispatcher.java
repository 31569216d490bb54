package com.ai.salon.service;

import com.ai.salon.config.NotificationProperties;
import com.ai.salon.entity.NotificationOutbox;
import com.ai.salon.repository.NotificationOutboxRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Drains the notification outbox. Delivery failures are retried with exponential backoff
 * and never touch the help request that produced the notification.
 */
@Service
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private static final List<NotificationOutbox.Status> READY =
            List.of(NotificationOutbox.Status.PENDING, NotificationOutbox.Status.RETRY_SCHEDULED);

    private final NotificationOutboxRepository repository;
    private final WebhookClient webhookClient;
    private final NotificationProperties properties;

    public NotificationDispatcher(NotificationOutboxRepository repository,
                                  WebhookClient webhookClient,
                                  NotificationProperties properties) {
        this.repository = repository;
        this.webhookClient = webhookClient;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${notification.poll-interval:PT15S}")
    public void dispatchPending() {
        List<NotificationOutbox> ready = repository.findByStatusInAndNextRetryAtLessThanEqualOrderByCreatedAtAsc(
                READY, Instant.now(), PageRequest.of(0, properties.getBatchSize()));
        if (ready.isEmpty()) {
            return;
        }
        log.debug("Dispatching {} notifications", ready.size());
        for (NotificationOutbox notification : ready) {
            dispatch(notification);
        }
    }

    void dispatch(NotificationOutbox notification) {
        String url = urlFor(notification.getChannel());
        if (StringUtils.isBlank(url)) {
            log.warn("{} webhook URL not configured; skipping notification for {}",
                    notification.getChannel(), notification.getAggregateId());
            notification.setStatus(NotificationOutbox.Status.SKIPPED);
            repository.save(notification);
            return;
        }

        try {
            webhookClient.post(url, notification.getPayload());
            notification.setStatus(NotificationOutbox.Status.SENT);
            notification.setSentAt(Instant.now());
            notification.setLastError(null);
            log.info("{} notified for {}", notification.getChannel(), notification.getAggregateId());
        } catch (RuntimeException e) {
            int attempts = notification.getRetryCount() + 1;
            notification.setRetryCount(attempts);
            notification.setLastError(StringUtils.abbreviate(e.getMessage(), 1000));
            if (attempts >= notification.getMaxRetries()) {
                notification.setStatus(NotificationOutbox.Status.FAILED);
                log.error("Giving up on {} notification for {} after {} attempts",
                        notification.getChannel(), notification.getAggregateId(), attempts, e);
            } else {
                Duration delay = backoff(attempts);
                notification.setStatus(NotificationOutbox.Status.RETRY_SCHEDULED);
                notification.setNextRetryAt(Instant.now().plus(delay));
                log.warn("{} notification for {} failed (attempt {}), retrying in {}s: {}",
                        notification.getChannel(), notification.getAggregateId(), attempts, delay.toSeconds(), e.getMessage());
            }
        }
        repository.save(notification);
    }

    /**
     * initial * 2^(attempts - 1), capped at the configured maximum.
     */
    Duration backoff(int attempts) {
        Duration delay = properties.getInitialBackoff();
        for (int i = 1; i < attempts; i++) {
            delay = delay.multipliedBy(2);
            if (delay.compareTo(properties.getMaxBackoff()) >= 0) {
                return properties.getMaxBackoff();
            }
        }
        return delay.compareTo(properties.getMaxBackoff()) > 0 ? properties.getMaxBackoff() : delay;
    }

    private String urlFor(NotificationOutbox.Channel channel) {
        if (channel == NotificationOutbox.Channel.SUPERVISOR) {
            return properties.getSupervisorWebhookUrl();
        }
        return properties.getAgentCallbackUrl();
    }
}

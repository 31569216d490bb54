package com.ai.salon.service;

import com.ai.salon.config.NotificationProperties;
import com.ai.salon.entity.NotificationOutbox;
import com.ai.salon.repository.NotificationOutboxRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Records notification intents. Callers enqueue inside the transaction that made the
 * state change, so the intent exists exactly when the change committed.
 */
@Service
public class NotificationOutboxService {

    private static final Logger log = LoggerFactory.getLogger(NotificationOutboxService.class);

    private final NotificationOutboxRepository repository;
    private final NotificationProperties properties;
    private final ObjectMapper mapper;

    public NotificationOutboxService(NotificationOutboxRepository repository,
                                     NotificationProperties properties,
                                     ObjectMapper mapper) {
        this.repository = repository;
        this.properties = properties;
        this.mapper = mapper;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public NotificationOutbox enqueue(NotificationOutbox.Channel channel, String aggregateId, Object event) {
        String payload;
        try {
            payload = mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + event.getClass().getSimpleName(), e);
        }
        NotificationOutbox saved = repository.save(NotificationOutbox.builder()
                .channel(channel)
                .aggregateId(aggregateId)
                .payload(payload)
                .status(NotificationOutbox.Status.PENDING)
                .maxRetries(properties.getMaxAttempts())
                .nextRetryAt(Instant.now())
                .build());
        log.debug("Queued {} notification for {}", channel, aggregateId);
        return saved;
    }
}

package com.ai.salon.service;

import com.ai.salon.dto.HelpRequestCreatedEvent;
import com.ai.salon.dto.HelpRequestResolvedEvent;
import com.ai.salon.entity.HelpRequest;
import com.ai.salon.entity.HelpRequestStatus;
import com.ai.salon.entity.NotificationOutbox;
import com.ai.salon.exception.CorruptRecordException;
import com.ai.salon.exception.DependencyUnavailableException;
import com.ai.salon.exception.HelpRequestConflictException;
import com.ai.salon.exception.HelpRequestNotFoundException;
import com.ai.salon.repository.HelpRequestRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Help request persistence. Every state change writes its notification intent in the
 * same transaction.
 */
@Service
public class HelpRequestService {

    private static final Logger log = LoggerFactory.getLogger(HelpRequestService.class);

    public static final String RESOLVED_BY_SUPERVISOR = "supervisor";

    private final HelpRequestRepository repository;
    private final NotificationOutboxService outbox;

    public HelpRequestService(HelpRequestRepository repository, NotificationOutboxService outbox) {
        this.repository = repository;
        this.outbox = outbox;
    }

    @Transactional
    public HelpRequest open(String question, String roomName, String customerContext) {
        HelpRequest request;
        try {
            request = repository.saveAndFlush(HelpRequest.builder()
                    .id(UUID.randomUUID().toString())
                    .question(question)
                    .roomName(roomName)
                    .customerContext(customerContext)
                    .status(HelpRequestStatus.PENDING)
                    .build());
            outbox.enqueue(NotificationOutbox.Channel.SUPERVISOR, request.getId(),
                    new HelpRequestCreatedEvent(request.getId(), question, roomName, request.getCreatedAt().toString()));
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            throw new DependencyUnavailableException("Help request store unavailable", e);
        }
        log.info("Help request created: {} - {}", request.getId(), question);
        return request;
    }

    /**
     * Moves a request to RESOLVED. Only the first resolution wins; a second one, or one
     * that races the first, fails with a conflict.
     */
    @Transactional
    public HelpRequest markResolved(String requestId, String answer, String resolutionNotes) {
        HelpRequest request = load(requestId);
        if (request.isResolved()) {
            throw new HelpRequestConflictException("Help request already resolved: " + requestId);
        }

        Instant now = Instant.now();
        double responseTime = Math.max(0, Duration.between(request.getCreatedAt(), now).toMillis() / 1000.0);
        request.setAnswer(answer);
        request.setResolutionNotes(resolutionNotes);
        request.setStatus(HelpRequestStatus.RESOLVED);
        request.setResolvedBy(RESOLVED_BY_SUPERVISOR);
        request.setResolvedAt(now);
        request.setResponseTimeSeconds(responseTime);

        HelpRequest saved;
        try {
            saved = repository.saveAndFlush(request);
            outbox.enqueue(NotificationOutbox.Channel.AGENT_CALLBACK, saved.getId(),
                    new HelpRequestResolvedEvent(saved.getId(), saved.getRoomName(), saved.getQuestion(), answer));
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new HelpRequestConflictException("Help request resolved concurrently: " + requestId, e);
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            throw new DependencyUnavailableException("Help request store unavailable", e);
        }
        log.info("Help request {} resolved in {}s", requestId, String.format("%.1f", responseTime));
        return saved;
    }

    @Transactional(readOnly = true)
    public HelpRequest find(String requestId) {
        return load(requestId);
    }

    /**
     * Pending requests, newest first.
     */
    @Transactional(readOnly = true)
    public List<HelpRequest> pending() {
        return repository.findByStatusOrderByCreatedAtDesc(HelpRequestStatus.PENDING);
    }

    private HelpRequest load(String requestId) {
        HelpRequest request;
        try {
            request = repository.findById(requestId).orElseThrow(() -> new HelpRequestNotFoundException(requestId));
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            throw new DependencyUnavailableException("Help request store unavailable", e);
        } catch (DataAccessException e) {
            throw new CorruptRecordException("Help request " + requestId + " is unreadable", e);
        }
        if (StringUtils.isBlank(request.getQuestion()) || request.getStatus() == null || request.getCreatedAt() == null) {
            throw new CorruptRecordException("Help request " + requestId + " is missing required fields");
        }
        return request;
    }
}

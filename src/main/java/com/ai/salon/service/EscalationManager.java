package com.ai.salon.service;

import com.ai.salon.conversation.BookingSession;
import com.ai.salon.conversation.QueryRecord;
import com.ai.salon.dto.HelpRequestResolution;
import com.ai.salon.dto.HelpRequestView;
import com.ai.salon.dto.SupervisorResponse;
import com.ai.salon.entity.HelpRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Hands unresolved questions to a human and feeds the answers back into the knowledge base.
 * <p>
 * Callers must have run {@link KnowledgeResolver} first; {@link #create} does not look the
 * question up again.
 */
@Service
public class EscalationManager {

    private static final Logger log = LoggerFactory.getLogger(EscalationManager.class);

    private static final int CONTEXT_QUERIES = 3;

    private final HelpRequestService helpRequestService;
    private final KnowledgeBaseService knowledgeBaseService;
    private final ObjectMapper mapper;

    public EscalationManager(HelpRequestService helpRequestService,
                             KnowledgeBaseService knowledgeBaseService,
                             ObjectMapper mapper) {
        this.helpRequestService = helpRequestService;
        this.knowledgeBaseService = knowledgeBaseService;
        this.mapper = mapper;
    }

    /**
     * Opens a pending help request. The supervisor is notified through the outbox, so a
     * notification failure never loses the request.
     *
     * @param session the asking conversation, or null when the request comes from outside one
     * @return the new request id
     */
    public String create(String question, String roomName, BookingSession session) {
        HelpRequest request = helpRequestService.open(question, roomName, customerContext(roomName, session));
        return request.getId();
    }

    /**
     * Resolves a request and, when asked to, stores the answer as a learned knowledge item.
     * A knowledge-base failure after the resolution committed is logged and reported in the
     * result; the resolution stands.
     */
    public HelpRequestResolution resolve(String requestId, SupervisorResponse response) {
        HelpRequest resolved = helpRequestService.markResolved(requestId, response.answer(), response.resolutionNotes());

        boolean knowledgeBaseUpdated = false;
        if (response.shouldAddToKnowledgeBase()) {
            try {
                knowledgeBaseService.addToKnowledgeBase(resolved.getQuestion(), response.answer(), response.kbCategory());
                knowledgeBaseUpdated = true;
            } catch (RuntimeException e) {
                log.error("Failed to add resolution of {} to knowledge base", requestId, e);
            }
        }
        return new HelpRequestResolution(HelpRequestView.from(resolved), knowledgeBaseUpdated);
    }

    String customerContext(String roomName, BookingSession session) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("timestamp", Instant.now().toString());
        context.put("room_name", roomName);
        if (session != null) {
            Map<String, Object> progress = new LinkedHashMap<>();
            progress.put("customer_name", session.getCustomerName());
            progress.put("service", session.getService());
            progress.put("appointment_date", session.getAppointmentDate() == null ? null : session.getAppointmentDate().toString());
            progress.put("appointment_time", session.getAppointmentTime() == null ? null : session.getAppointmentTime().getLabel());
            progress.put("is_complete", session.isComplete());
            context.put("booking_progress", progress);
            context.put("conversation_state", session.getConversationState().name().toLowerCase(Locale.ENGLISH));

            List<Map<String, String>> queries = new ArrayList<>();
            for (QueryRecord q : session.recentQueries(CONTEXT_QUERIES)) {
                queries.add(Map.of("query", q.query(), "timestamp", q.timestamp().toString()));
            }
            context.put("previous_queries", queries);
        }
        try {
            return mapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize customer context for room {}", roomName, e);
            return "{}";
        }
    }
}

package com.ai.salon.service;

import com.ai.salon.component.BookingRules;
import com.ai.salon.component.BookingSessionRegistry;
import com.ai.salon.component.ResponsePhrases;
import com.ai.salon.conversation.BookingSession;
import com.ai.salon.conversation.ConversationState;
import com.ai.salon.conversation.Slot;
import com.ai.salon.dto.ActionResponse;
import com.ai.salon.dto.AvailabilityCheckPayload;
import com.ai.salon.dto.BookingContextUpdate;
import com.ai.salon.entity.Appointment;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * The actions a conversational runtime can invoke. Every action answers with a sentence
 * to speak; no exception ever reaches the caller.
 */
@Service
public class ReceptionistTools {

    private static final Logger log = LoggerFactory.getLogger(ReceptionistTools.class);

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("EEEE", Locale.ENGLISH);
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("hh:mm a", Locale.ENGLISH);

    private final BookingSessionRegistry sessions;
    private final BookingLifecycle bookingLifecycle;
    private final SlotLedger slotLedger;
    private final KnowledgeResolver knowledgeResolver;
    private final EscalationManager escalationManager;
    private final BookingRules rules;
    private final ResponsePhrases phrases;
    private final Executor ioExecutor;

    public ReceptionistTools(BookingSessionRegistry sessions,
                             BookingLifecycle bookingLifecycle,
                             SlotLedger slotLedger,
                             KnowledgeResolver knowledgeResolver,
                             EscalationManager escalationManager,
                             BookingRules rules,
                             ResponsePhrases phrases,
                             @Qualifier("ioExecutor") Executor ioExecutor) {
        this.sessions = sessions;
        this.bookingLifecycle = bookingLifecycle;
        this.slotLedger = slotLedger;
        this.knowledgeResolver = knowledgeResolver;
        this.escalationManager = escalationManager;
        this.rules = rules;
        this.phrases = phrases;
        this.ioExecutor = ioExecutor;
    }

    public ActionResponse currentDateTime(String sessionId) {
        BookingSession session = sessions.getOrCreate(sessionId);
        LocalDateTime now = rules.now();
        String humanReadable = now.format(DAY) + ", " + now.format(DATE) + " at " + now.format(TIME);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("day", now.format(DAY));
        result.put("date", now.format(DATE));
        result.put("time", now.format(TIME));
        result.put("human_readable", humanReadable);
        result.put("iso", now.toString());
        session.recordAction("get_current_date_and_time", result);
        return ActionResponse.of(ActionResponse.Type.DATE_TIME, phrases.currentDateTime(humanReadable), result);
    }

    public ActionResponse updateBookingContext(String sessionId, BookingContextUpdate update) {
        BookingSession session = sessions.getOrCreate(sessionId);
        try {
            BookingLifecycle.BookingUpdate result = bookingLifecycle.updateFields(session, update);
            List<String> updated = result.updated().stream().map(Enum::name).toList();
            session.recordAction("update_booking_context", updated);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("updated", updated);
            payload.put("missing", result.missing().stream().map(Enum::name).toList());
            payload.put("state", session.getConversationState().name());
            ActionResponse.Type type = result.accepted() ? ActionResponse.Type.CONTEXT_UPDATED : ActionResponse.Type.VALIDATION_ERROR;
            return ActionResponse.of(type, result.message(), payload);
        } catch (RuntimeException e) {
            log.error("[{}] Context update failed", sessionId, e);
            return ActionResponse.error(phrases.contextUpdateFailed());
        }
    }

    public ActionResponse bookingSummary(String sessionId) {
        BookingSession session = sessions.getOrCreate(sessionId);
        session.recordAction("get_booking_summary", null);
        BookingLifecycle.BookingSummary summary = bookingLifecycle.summarize(session);
        if (!summary.complete()) {
            Map<String, Object> payload = Map.of("missing", summary.missing().stream().map(Enum::name).toList());
            return ActionResponse.of(ActionResponse.Type.INCOMPLETE, summary.text(), payload);
        }
        return ActionResponse.of(ActionResponse.Type.SUMMARY, summary.text());
    }

    public CompletableFuture<ActionResponse> bookAppointment(String sessionId) {
        BookingSession session = sessions.getOrCreate(sessionId);
        return CompletableFuture.supplyAsync(() -> {
            BookingLifecycle.BookingOutcome outcome = bookingLifecycle.confirm(session);
            if (!outcome.confirmed()) {
                session.recordAction("book_appointment", outcome.errorKind());
                return ActionResponse.of(ActionResponse.Type.ERROR, outcome.message(),
                        Map.of("errorKind", outcome.errorKind().name()));
            }
            Appointment a = outcome.appointment();
            return ActionResponse.confirmed(outcome.message(), a.getConfirmationNumber(), a.getService(),
                    rules.formatDate(a.getAppointmentDate()), a.getAppointmentTime().getLabel(),
                    a.getPrice().toPlainString());
        }, ioExecutor).exceptionally(ex -> {
            log.error("[{}] Booking failed", sessionId, ex);
            session.incrementRetryCount();
            return ActionResponse.error(phrases.bookingFailed());
        });
    }

    public CompletableFuture<ActionResponse> checkAvailability(String sessionId, AvailabilityCheckPayload request) {
        BookingSession session = sessions.getOrCreate(sessionId);
        String time = StringUtils.trimToEmpty(request.time());
        session.recordAvailabilityCheck(request.date(), time);

        Optional<LocalDate> parsed = rules.parseDate(request.date());
        if (parsed.isEmpty()) {
            session.recordAction("check_availability", "invalid_date");
            return CompletableFuture.completedFuture(
                    ActionResponse.of(ActionResponse.Type.VALIDATION_ERROR, phrases.unreadableDate(request.date())));
        }
        LocalDate date = parsed.get();
        if (rules.isClosed(date)) {
            session.recordAction("check_availability", "closed");
            return CompletableFuture.completedFuture(
                    ActionResponse.of(ActionResponse.Type.CLOSED, phrases.closedOn(rules.closedDayName())));
        }

        String displayDate = rules.formatDate(date);
        return CompletableFuture.supplyAsync(() -> {
            if (time.isEmpty()) {
                List<Slot> available = slotLedger.available(date);
                session.recordAction("check_availability", labels(available));
                return ActionResponse.of(ActionResponse.Type.AVAILABLE_TIMES, phrases.availableTimes(displayDate, available),
                        Map.of("available", labels(available)));
            }
            SlotLedger.SlotCheckResult check = slotLedger.check(date, time);
            switch (check.outcome()) {
                case AVAILABLE:
                    session.recordAction("check_availability", "available");
                    return ActionResponse.of(ActionResponse.Type.SLOT_AVAILABLE,
                            phrases.slotAvailable(check.slot().getLabel(), displayDate));
                case FULL:
                    Map<String, Object> full = new LinkedHashMap<>();
                    full.put("booked", check.slot().getLabel());
                    full.put("alternatives", labels(check.alternatives()));
                    session.recordAction("check_availability", full);
                    return ActionResponse.of(ActionResponse.Type.SLOT_FULL,
                            phrases.slotFull(check.slot().getLabel(), displayDate, check.alternatives()), full);
                default:
                    session.recordAction("check_availability", "outside_hours");
                    return ActionResponse.of(ActionResponse.Type.OUTSIDE_HOURS,
                            phrases.outsideBusinessHoursOn(time, displayDate, check.alternatives()),
                            Map.of("available", labels(check.alternatives())));
            }
        }, ioExecutor).exceptionally(ex -> {
            log.error("[{}] Availability check failed", sessionId, ex);
            return ActionResponse.error(phrases.availabilityFailed());
        });
    }

    /**
     * FAQ, then knowledge base, then a human. The session handle doubles as the room name
     * the supervisor's answer is routed back to.
     */
    public CompletableFuture<ActionResponse> requestHelp(String sessionId, String question) {
        BookingSession session = sessions.getOrCreate(sessionId);
        String q = StringUtils.trimToEmpty(question);
        session.addQuery(q);
        session.recordAction("request_help", null);
        if (session.getConversationState() == ConversationState.GREETING) {
            session.setConversationState(ConversationState.INQUIRY);
        }
        log.info("[{}] Help requested: {}", sessionId, q);

        return knowledgeResolver.resolve(q).thenApplyAsync(answer -> {
            if (answer.isResolved()) {
                session.recordAction("request_help",
                        answer.tier() == KnowledgeResolver.Tier.FAQ ? "faq_found" : "kb_found");
                return ActionResponse.of(ActionResponse.Type.ANSWERED, answer.answer(),
                        Map.of("tier", answer.tier().name()));
            }
            String requestId = escalationManager.create(q, sessionId, session);
            session.recordAction("request_help", "help_requested:" + requestId);
            return ActionResponse.of(ActionResponse.Type.ESCALATED, phrases.escalated(), Map.of("requestId", requestId));
        }, ioExecutor).exceptionally(ex -> {
            log.error("[{}] Failed in request_help", sessionId, ex);
            return ActionResponse.error(phrases.helpFailed());
        });
    }

    public boolean endSession(String sessionId) {
        return sessions.end(sessionId);
    }

    private static List<String> labels(List<Slot> slots) {
        return slots.stream().map(Slot::getLabel).toList();
    }
}

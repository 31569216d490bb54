package com.ai.salon.service;

import com.ai.salon.component.BookingRules;
import com.ai.salon.component.ResponsePhrases;
import com.ai.salon.conversation.BookingField;
import com.ai.salon.conversation.BookingSession;
import com.ai.salon.conversation.ConversationState;
import com.ai.salon.conversation.FieldUpdateResult;
import com.ai.salon.dto.BookingContextUpdate;
import com.ai.salon.entity.Appointment;
import com.ai.salon.exception.ErrorKind;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Booking state machine: collect fields, summarize, confirm, persist, reset.
 * <p>
 * {@link #confirm(BookingSession)} only succeeds after {@link #summarize(BookingSession)} has
 * read a complete booking back to the caller.
 */
@Service
public class BookingLifecycle {

    private static final Logger log = LoggerFactory.getLogger(BookingLifecycle.class);

    private final SlotLedger slotLedger;
    private final BookingRules rules;
    private final ResponsePhrases phrases;
    private final ConfirmationNumberGenerator confirmationNumbers;

    public BookingLifecycle(SlotLedger slotLedger,
                            BookingRules rules,
                            ResponsePhrases phrases,
                            ConfirmationNumberGenerator confirmationNumbers) {
        this.slotLedger = slotLedger;
        this.rules = rules;
        this.phrases = phrases;
        this.confirmationNumbers = confirmationNumbers;
    }

    public FieldUpdateResult updateField(BookingSession session, BookingField field, String value) {
        FieldUpdateResult result = field.assign(session, value, rules);
        if (result.accepted()) {
            log.debug("[{}] {} set, state={}", session.getSessionId(), field, session.getConversationState());
        } else {
            log.info("[{}] {} rejected: {}", session.getSessionId(), field, value);
        }
        return result;
    }

    /**
     * Applies every non-blank value of {@code update} in collection order and stops at the
     * first rejection. Values accepted before the rejection stay on the session.
     */
    public BookingUpdate updateFields(BookingSession session, BookingContextUpdate update) {
        Map<BookingField, String> values = new LinkedHashMap<>();
        values.put(BookingField.CUSTOMER_NAME, update.customerName());
        values.put(BookingField.PHONE_NUMBER, update.phoneNumber());
        values.put(BookingField.SERVICE, update.service());
        values.put(BookingField.APPOINTMENT_DATE, update.appointmentDate());
        values.put(BookingField.APPOINTMENT_TIME, update.appointmentTime());

        List<BookingField> updated = new ArrayList<>();
        for (Map.Entry<BookingField, String> entry : values.entrySet()) {
            if (StringUtils.isBlank(entry.getValue())) {
                continue;
            }
            FieldUpdateResult result = updateField(session, entry.getKey(), entry.getValue());
            if (!result.accepted()) {
                return BookingUpdate.rejected(updated, session.missingFields(), result.message());
            }
            updated.add(entry.getKey());
        }

        if (updated.isEmpty()) {
            return BookingUpdate.rejected(updated, session.missingFields(), phrases.nothingToUpdate());
        }
        List<BookingField> missing = session.missingFields();
        String message = missing.isEmpty()
                ? phrases.allDetailsCollected(names(updated))
                : phrases.fieldsUpdated(names(updated), names(missing));
        return new BookingUpdate(true, updated, missing, message);
    }

    /**
     * Reads the booking back. Only a complete booking arms confirmation.
     */
    public BookingSummary summarize(BookingSession session) {
        if (!session.isComplete()) {
            List<BookingField> missing = session.missingFields();
            return BookingSummary.incomplete(missing, phrases.bookingIncomplete(names(missing)));
        }
        session.markWaitingForConfirmation();
        String text = phrases.bookingSummary(
                session.getCustomerName(),
                session.getPhoneNumber(),
                session.getService(),
                session.getPrice(),
                rules.formatDate(session.getAppointmentDate()),
                session.getAppointmentTime().getLabel());
        return BookingSummary.complete(text);
    }

    public BookingOutcome confirm(BookingSession session) {
        if (!session.isComplete()) {
            return BookingOutcome.rejected(ErrorKind.VALIDATION_ERROR, phrases.cannotBookIncomplete());
        }
        if (!session.isWaitingForConfirmation()) {
            return BookingOutcome.rejected(ErrorKind.VALIDATION_ERROR, phrases.summarizeFirst());
        }

        String date = rules.formatDate(session.getAppointmentDate());
        String time = session.getAppointmentTime().getLabel();
        try {
            SlotLedger.SlotCheckResult check = slotLedger.check(session.getAppointmentDate(), session.getAppointmentTime());
            if (!check.isAvailable()) {
                return BookingOutcome.rejected(ErrorKind.CAPACITY_ERROR,
                        phrases.slotTakenBeforeConfirm(time, date, check.alternatives()));
            }

            Appointment appointment = Appointment.builder()
                    .confirmationNumber(confirmationNumbers.next())
                    .customerName(session.getCustomerName())
                    .phoneNumber(session.getPhoneNumber())
                    .service(session.getService())
                    .price(session.getPrice())
                    .appointmentDate(session.getAppointmentDate())
                    .appointmentTime(session.getAppointmentTime())
                    .build();
            SlotLedger.ReservationResult reservation = slotLedger.reserveIfAvailable(appointment);
            if (!reservation.reserved()) {
                return BookingOutcome.rejected(ErrorKind.CAPACITY_ERROR,
                        phrases.slotTakenBeforeConfirm(time, date, reservation.alternatives()));
            }

            Appointment saved = reservation.appointment();
            session.markConfirmed();
            session.setConversationState(ConversationState.COMPLETED);
            session.recordAction("book_appointment", saved.getConfirmationNumber());
            String message = phrases.bookingConfirmed(saved.getService(), date, time, saved.getConfirmationNumber());
            session.resetBooking();
            return BookingOutcome.confirmed(saved, message);
        } catch (RuntimeException e) {
            log.error("[{}] Booking failed", session.getSessionId(), e);
            session.incrementRetryCount();
            return BookingOutcome.rejected(ErrorKind.DEPENDENCY_UNAVAILABLE, phrases.bookingFailed());
        }
    }

    private static List<String> names(List<BookingField> fields) {
        return fields.stream().map(BookingField::getDisplayName).toList();
    }

    public record BookingUpdate(boolean accepted, List<BookingField> updated, List<BookingField> missing, String message) {

        static BookingUpdate rejected(List<BookingField> updated, List<BookingField> missing, String message) {
            return new BookingUpdate(false, List.copyOf(updated), missing, message);
        }
    }

    public record BookingSummary(boolean complete, String text, List<BookingField> missing) {

        static BookingSummary complete(String text) {
            return new BookingSummary(true, text, List.of());
        }

        static BookingSummary incomplete(List<BookingField> missing, String text) {
            return new BookingSummary(false, text, missing);
        }
    }

    public record BookingOutcome(boolean confirmed, Appointment appointment, ErrorKind errorKind, String message) {

        static BookingOutcome confirmed(Appointment appointment, String message) {
            return new BookingOutcome(true, appointment, null, message);
        }

        static BookingOutcome rejected(ErrorKind kind, String message) {
            return new BookingOutcome(false, null, kind, message);
        }
    }
}

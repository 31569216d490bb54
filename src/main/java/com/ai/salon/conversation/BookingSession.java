package com.ai.salon.conversation;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Per-conversation booking state. Single writer: only the owning conversation's
 * turn processing touches it, so there is no locking here.
 */
public class BookingSession {

    static final int MAX_PREVIOUS_QUERIES = 10;

    private final String sessionId;

    private String customerName;
    private String phoneNumber;
    private String service;
    private BigDecimal price;
    private LocalDate appointmentDate;
    private Slot appointmentTime;
    private boolean confirmed;

    private ConversationState conversationState = ConversationState.GREETING;
    private boolean waitingForConfirmation;

    private final Deque<QueryRecord> previousQueries = new ArrayDeque<>();
    private final List<AvailabilityCheck> availabilityChecks = new ArrayList<>();
    private final List<String> validationErrors = new ArrayList<>();
    private int retryCount;

    private String lastAction;
    private Object lastActionResult;

    public BookingSession(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getCustomerName() {
        return customerName;
    }

    public void setCustomerName(String customerName) {
        this.customerName = customerName;
        fieldChanged();
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public void setPhoneNumber(String phoneNumber) {
        this.phoneNumber = phoneNumber;
        fieldChanged();
    }

    public String getService() {
        return service;
    }

    public BigDecimal getPrice() {
        return price;
    }

    /**
     * Service and price always change together; the price is never caller supplied.
     */
    public void setService(String service, BigDecimal price) {
        this.service = service;
        this.price = price;
        fieldChanged();
    }

    public LocalDate getAppointmentDate() {
        return appointmentDate;
    }

    public void setAppointmentDate(LocalDate appointmentDate) {
        this.appointmentDate = appointmentDate;
        fieldChanged();
    }

    public Slot getAppointmentTime() {
        return appointmentTime;
    }

    public void setAppointmentTime(Slot appointmentTime) {
        this.appointmentTime = appointmentTime;
        fieldChanged();
    }

    public boolean isConfirmed() {
        return confirmed;
    }

    public boolean isComplete() {
        return missingFields().isEmpty();
    }

    public List<BookingField> missingFields() {
        List<BookingField> missing = new ArrayList<>();
        for (BookingField field : BookingField.values()) {
            if (!field.isFilled(this)) {
                missing.add(field);
            }
        }
        return missing;
    }

    public ConversationState getConversationState() {
        return conversationState;
    }

    public void setConversationState(ConversationState conversationState) {
        this.conversationState = conversationState;
    }

    public boolean isWaitingForConfirmation() {
        return waitingForConfirmation;
    }

    /**
     * Set once the caller has been read a summary of a complete booking.
     */
    public void markWaitingForConfirmation() {
        if (!isComplete()) {
            throw new IllegalStateException("Booking is incomplete: " + missingFields());
        }
        this.waitingForConfirmation = true;
    }

    public void markConfirmed() {
        if (!isComplete() || !waitingForConfirmation) {
            throw new IllegalStateException("Booking has not been summarized for confirmation");
        }
        this.confirmed = true;
    }

    /**
     * Clears the booking in progress so another one can start in the same conversation.
     * The query log and availability audit survive.
     */
    public void resetBooking() {
        customerName = null;
        phoneNumber = null;
        service = null;
        price = null;
        appointmentDate = null;
        appointmentTime = null;
        confirmed = false;
        waitingForConfirmation = false;
        validationErrors.clear();
        retryCount = 0;
    }

    public void addQuery(String query) {
        previousQueries.addLast(new QueryRecord(query, Instant.now()));
        while (previousQueries.size() > MAX_PREVIOUS_QUERIES) {
            previousQueries.removeFirst();
        }
    }

    public List<QueryRecord> getPreviousQueries() {
        return List.copyOf(previousQueries);
    }

    public List<QueryRecord> recentQueries(int limit) {
        List<QueryRecord> all = getPreviousQueries();
        return all.subList(Math.max(0, all.size() - limit), all.size());
    }

    public void recordAvailabilityCheck(String date, String time) {
        availabilityChecks.add(new AvailabilityCheck(date, time, Instant.now()));
    }

    public List<AvailabilityCheck> getAvailabilityChecks() {
        return Collections.unmodifiableList(availabilityChecks);
    }

    public void addValidationError(String error) {
        validationErrors.add(error);
    }

    public List<String> getValidationErrors() {
        return Collections.unmodifiableList(validationErrors);
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void incrementRetryCount() {
        retryCount++;
    }

    public String getLastAction() {
        return lastAction;
    }

    public Object getLastActionResult() {
        return lastActionResult;
    }

    public void recordAction(String action, Object result) {
        this.lastAction = action;
        this.lastActionResult = result;
    }

    // A summary read back to the caller no longer matches once a field moves.
    private void fieldChanged() {
        waitingForConfirmation = false;
        if (conversationState == ConversationState.GREETING || conversationState == ConversationState.INQUIRY
                || conversationState == ConversationState.COMPLETED) {
            conversationState = ConversationState.BOOKING;
        }
        if (isComplete()) {
            conversationState = ConversationState.READY_FOR_CONFIRMATION;
        } else if (conversationState == ConversationState.READY_FOR_CONFIRMATION) {
            conversationState = ConversationState.BOOKING;
        }
    }
}

package com.ai.salon.conversation;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BookingSessionTest {

    private static BookingSession completeSession() {
        BookingSession session = new BookingSession("room-1");
        session.setCustomerName("Jane Doe");
        session.setPhoneNumber("5551234567");
        session.setService("Haircut", BigDecimal.valueOf(40));
        session.setAppointmentDate(LocalDate.of(2025, 3, 3));
        session.setAppointmentTime(Slot.TEN_AM);
        return session;
    }

    @Test
    void newSessionIsEmpty() {
        BookingSession session = new BookingSession("room-1");

        assertThat(session.getConversationState()).isEqualTo(ConversationState.GREETING);
        assertThat(session.isComplete()).isFalse();
        assertThat(session.missingFields()).containsExactly(BookingField.values());
    }

    @Test
    void fillingEveryFieldMakesItReadyForConfirmation() {
        BookingSession session = completeSession();

        assertThat(session.isComplete()).isTrue();
        assertThat(session.getConversationState()).isEqualTo(ConversationState.READY_FOR_CONFIRMATION);
    }

    @Test
    void cannotWaitForConfirmationWhileIncomplete() {
        BookingSession session = new BookingSession("room-1");
        session.setCustomerName("Jane Doe");

        assertThatThrownBy(session::markWaitingForConfirmation).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(session::markConfirmed).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void changingAFieldDisarmsConfirmation() {
        BookingSession session = completeSession();
        session.markWaitingForConfirmation();

        session.setAppointmentTime(Slot.TWO_PM);

        assertThat(session.isWaitingForConfirmation()).isFalse();
        assertThatThrownBy(session::markConfirmed).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void resetKeepsQueryLogAndAvailabilityAudit() {
        BookingSession session = completeSession();
        session.addQuery("do you take walk-ins?");
        session.recordAvailabilityCheck("March 3, 2025", "10:00 AM");
        session.addValidationError("Unknown service: perm");
        session.incrementRetryCount();
        session.markWaitingForConfirmation();
        session.markConfirmed();

        session.resetBooking();

        assertThat(session.getCustomerName()).isNull();
        assertThat(session.getPrice()).isNull();
        assertThat(session.getAppointmentTime()).isNull();
        assertThat(session.isConfirmed()).isFalse();
        assertThat(session.isWaitingForConfirmation()).isFalse();
        assertThat(session.getValidationErrors()).isEmpty();
        assertThat(session.getRetryCount()).isZero();
        assertThat(session.getPreviousQueries()).extracting(QueryRecord::query).containsExactly("do you take walk-ins?");
        assertThat(session.getAvailabilityChecks()).hasSize(1);
    }

    @Test
    void queryLogKeepsTheLatestTen() {
        BookingSession session = new BookingSession("room-1");
        for (int i = 1; i <= 12; i++) {
            session.addQuery("q" + i);
        }

        assertThat(session.getPreviousQueries()).hasSize(10);
        assertThat(session.getPreviousQueries().get(0).query()).isEqualTo("q3");
        assertThat(session.recentQueries(3)).extracting(QueryRecord::query).containsExactly("q10", "q11", "q12");
    }
}

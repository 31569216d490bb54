package com.ai.salon.service;

import com.ai.salon.component.BookingRules;
import com.ai.salon.component.ResponsePhrases;
import com.ai.salon.conversation.BookingSession;
import com.ai.salon.conversation.Slot;
import com.ai.salon.dto.BookingContextUpdate;
import com.ai.salon.entity.Appointment;
import com.ai.salon.repository.AppointmentRepository;
import com.ai.salon.repository.AppointmentSlotRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * A whole booking conversation against the real ledger and database.
 */
@DataJpaTest
@Import({SlotLedger.class, BookingLifecycle.class, BookingRules.class, ResponsePhrases.class,
        ConfirmationNumberGenerator.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class BookingScenarioTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 3, 3);

    @Autowired
    private BookingLifecycle lifecycle;

    @Autowired
    private SlotLedger ledger;

    @Autowired
    private AppointmentRepository appointmentRepository;

    @Autowired
    private AppointmentSlotRepository slotRepository;

    @AfterEach
    void cleanUp() {
        appointmentRepository.deleteAll();
        slotRepository.deleteAll();
    }

    @Test
    void janeDoeBooksAHaircut() {
        BookingSession session = new BookingSession("room-1");

        BookingLifecycle.BookingUpdate update = lifecycle.updateFields(session, new BookingContextUpdate(
                "Jane Doe", "555-123-4567", "Haircut", "March 3, 2025", "10:00 AM"));
        assertThat(update.accepted()).isTrue();
        assertThat(update.missing()).isEmpty();

        BookingLifecycle.BookingSummary summary = lifecycle.summarize(session);
        assertThat(summary.complete()).isTrue();
        assertThat(summary.text()).contains("Jane Doe", "5551234567", "Haircut", "10:00 AM");

        BookingLifecycle.BookingOutcome outcome = lifecycle.confirm(session);

        assertThat(outcome.confirmed()).isTrue();
        String confirmation = outcome.appointment().getConfirmationNumber();
        assertThat(confirmation).matches("SA\\d+");
        assertThat(outcome.message()).contains(confirmation);

        assertThat(ledger.bookingsOn(MONDAY)).singleElement().satisfies(stored -> {
            assertThat(stored.getConfirmationNumber()).isEqualTo(confirmation);
            assertThat(stored.getStatus()).isEqualTo(Appointment.Status.CONFIRMED);
            assertThat(stored.getCustomerName()).isEqualTo("Jane Doe");
            assertThat(stored.getPhoneNumber()).isEqualTo("5551234567");
            assertThat(stored.getService()).isEqualTo("Haircut");
            assertThat(stored.getPrice()).isEqualByComparingTo(BigDecimal.valueOf(40));
            assertThat(stored.getAppointmentTime()).isEqualTo(Slot.TEN_AM);
        });
        assertThat(ledger.count(MONDAY, Slot.TEN_AM)).isEqualTo(1);
    }
}

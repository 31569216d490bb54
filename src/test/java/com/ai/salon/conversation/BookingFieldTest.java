package com.ai.salon.conversation;

import com.ai.salon.component.BookingRules;
import com.ai.salon.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class BookingFieldTest {

    private BookingRules rules;
    private BookingSession session;

    @BeforeEach
    void setUp() {
        rules = TestFixtures.bookingRules();
        session = new BookingSession("room-1");
    }

    @Test
    void phoneIsNormalizedToDigits() {
        FieldUpdateResult result = BookingField.PHONE_NUMBER.assign(session, "(555) 123-4567", rules);

        assertThat(result.accepted()).isTrue();
        assertThat(session.getPhoneNumber()).isEqualTo("5551234567");
    }

    @Test
    void normalizedPhoneIsStable() {
        assertThat(rules.normalizePhone("5551234567")).contains("5551234567");
        assertThat(rules.normalizePhone("555-123-4567").flatMap(rules::normalizePhone)).contains("5551234567");
    }

    @Test
    void nonAsciiDigitsAreNotPhoneDigits() {
        assertThat(rules.normalizePhone("\uFF15\uFF15\uFF15\uFF11\uFF12\uFF13\uFF14\uFF15\uFF16\uFF17")).isEmpty();
        assertThat(rules.normalizePhone("\u0665\u0665\u0665\u0661\u0662\u0663\u0664\u0665\u0666\u0667")).isEmpty();
        assertThat(BookingField.PHONE_NUMBER.assign(session, "555 123 \uFF14\uFF15\uFF16\uFF17", rules).accepted()).isFalse();
        assertThat(rules.normalizePhone(null)).isEmpty();
    }

    @Test
    void shortPhoneIsRejectedAndLogged() {
        FieldUpdateResult result = BookingField.PHONE_NUMBER.assign(session, "555-1234", rules);

        assertThat(result.accepted()).isFalse();
        assertThat(result.message()).contains("10 digits");
        assertThat(session.getPhoneNumber()).isNull();
        assertThat(session.getValidationErrors()).hasSize(1);
    }

    @Test
    void serviceSetsCanonicalNameAndListPrice() {
        FieldUpdateResult result = BookingField.SERVICE.assign(session, "  HAIR coloring ", rules);

        assertThat(result.accepted()).isTrue();
        assertThat(session.getService()).isEqualTo("Hair Coloring");
        assertThat(session.getPrice()).isEqualByComparingTo(BigDecimal.valueOf(80));
    }

    @Test
    void unknownServiceListsTheMenu() {
        FieldUpdateResult result = BookingField.SERVICE.assign(session, "perm", rules);

        assertThat(result.accepted()).isFalse();
        assertThat(result.message()).contains("Haircut", "Blow Dry");
        assertThat(session.getService()).isNull();
    }

    @Test
    void dateAcceptsSeveralFormats() {
        assertThat(BookingField.APPOINTMENT_DATE.assign(session, "march 3, 2025", rules).accepted()).isTrue();
        assertThat(session.getAppointmentDate()).isEqualTo(LocalDate.of(2025, 3, 3));

        assertThat(BookingField.APPOINTMENT_DATE.assign(session, "2025-03-04", rules).accepted()).isTrue();
        assertThat(session.getAppointmentDate()).isEqualTo(LocalDate.of(2025, 3, 4));
    }

    @Test
    void closedDayIsRejected() {
        FieldUpdateResult result = BookingField.APPOINTMENT_DATE.assign(session, "March 6, 2025", rules);

        assertThat(result.accepted()).isFalse();
        assertThat(result.message()).contains("Thursday");
        assertThat(session.getAppointmentDate()).isNull();
    }

    @Test
    void unreadableDateIsRejected() {
        assertThat(BookingField.APPOINTMENT_DATE.assign(session, "next blue moon", rules).accepted()).isFalse();
    }

    @Test
    void timeOutsideTheSlotsIsRejected() {
        FieldUpdateResult result = BookingField.APPOINTMENT_TIME.assign(session, "6:00 PM", rules);

        assertThat(result.accepted()).isFalse();
        assertThat(result.message()).contains("outside our business hours");

        assertThat(BookingField.APPOINTMENT_TIME.assign(session, "1 pm", rules).accepted()).isTrue();
        assertThat(session.getAppointmentTime()).isEqualTo(Slot.ONE_PM);
    }

    @Test
    void blankNameIsRejected() {
        assertThat(BookingField.CUSTOMER_NAME.assign(session, "   ", rules).accepted()).isFalse();
        assertThat(BookingField.CUSTOMER_NAME.assign(session, null, rules).accepted()).isFalse();
        assertThat(BookingField.CUSTOMER_NAME.assign(session, " Jane   Doe ", rules).accepted()).isTrue();
        assertThat(session.getCustomerName()).isEqualTo("Jane Doe");
    }
}

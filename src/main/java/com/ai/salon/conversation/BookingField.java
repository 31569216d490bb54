package com.ai.salon.conversation;

import com.ai.salon.component.BookingRules;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;
import java.util.function.Function;

/**
 * The required booking fields, in the order they are collected. Each knows how to
 * validate and store its own value.
 */
public enum BookingField {

    CUSTOMER_NAME("name", BookingSession::getCustomerName) {
        @Override
        protected FieldUpdateResult apply(BookingSession session, String raw, BookingRules rules) {
            String name = StringUtils.normalizeSpace(raw);
            if (StringUtils.isBlank(name)) {
                return FieldUpdateResult.rejected(this, rules.phrases().missingName());
            }
            session.setCustomerName(name);
            return FieldUpdateResult.accepted(this);
        }
    },

    PHONE_NUMBER("phone number", BookingSession::getPhoneNumber) {
        @Override
        protected FieldUpdateResult apply(BookingSession session, String raw, BookingRules rules) {
            Optional<String> phone = rules.normalizePhone(raw);
            if (phone.isEmpty()) {
                session.addValidationError("Invalid phone number: " + raw + " (must be " + BookingRules.PHONE_DIGITS + " digits)");
                return FieldUpdateResult.rejected(this, rules.phrases().invalidPhone(raw));
            }
            session.setPhoneNumber(phone.get());
            return FieldUpdateResult.accepted(this);
        }
    },

    SERVICE("service", BookingSession::getService) {
        @Override
        protected FieldUpdateResult apply(BookingSession session, String raw, BookingRules rules) {
            Optional<BigDecimal> price = rules.priceFor(raw);
            if (price.isEmpty()) {
                session.addValidationError("Unknown service: " + raw);
                return FieldUpdateResult.rejected(this, rules.phrases().unknownService(raw, rules.serviceList()));
            }
            session.setService(rules.displayService(raw), price.get());
            return FieldUpdateResult.accepted(this);
        }
    },

    APPOINTMENT_DATE("date", BookingSession::getAppointmentDate) {
        @Override
        protected FieldUpdateResult apply(BookingSession session, String raw, BookingRules rules) {
            Optional<LocalDate> date = rules.parseDate(raw);
            if (date.isEmpty()) {
                session.addValidationError("Unreadable date: " + raw);
                return FieldUpdateResult.rejected(this, rules.phrases().unreadableDate(raw));
            }
            if (rules.isClosed(date.get())) {
                session.addValidationError("Closed on " + rules.closedDayName() + ": " + raw);
                return FieldUpdateResult.rejected(this, rules.phrases().closedOn(rules.closedDayName()));
            }
            session.setAppointmentDate(date.get());
            return FieldUpdateResult.accepted(this);
        }
    },

    APPOINTMENT_TIME("time", BookingSession::getAppointmentTime) {
        @Override
        protected FieldUpdateResult apply(BookingSession session, String raw, BookingRules rules) {
            Optional<LocalTime> time = Slot.parseTime(raw);
            if (time.isEmpty()) {
                session.addValidationError("Unreadable time: " + raw);
                return FieldUpdateResult.rejected(this, rules.phrases().unreadableTime(raw));
            }
            Optional<Slot> slot = Slot.fromTime(time.get());
            if (slot.isEmpty()) {
                session.addValidationError("Outside business hours: " + raw);
                return FieldUpdateResult.rejected(this, rules.phrases().outsideBusinessHours(raw));
            }
            session.setAppointmentTime(slot.get());
            return FieldUpdateResult.accepted(this);
        }
    };

    private final String displayName;
    private final Function<BookingSession, Object> accessor;

    BookingField(String displayName, Function<BookingSession, Object> accessor) {
        this.displayName = displayName;
        this.accessor = accessor;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isFilled(BookingSession session) {
        Object value = accessor.apply(session);
        if (value instanceof String) {
            return StringUtils.isNotBlank((String) value);
        }
        return value != null;
    }

    /**
     * Validates {@code raw} and stores the normalized value on the session. A rejected
     * value leaves the session field untouched.
     */
    public FieldUpdateResult assign(BookingSession session, String raw, BookingRules rules) {
        if (raw == null) {
            return FieldUpdateResult.rejected(this, rules.phrases().nothingToUpdate());
        }
        return apply(session, raw, rules);
    }

    protected abstract FieldUpdateResult apply(BookingSession session, String raw, BookingRules rules);
}

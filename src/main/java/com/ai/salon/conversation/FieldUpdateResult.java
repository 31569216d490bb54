package com.ai.salon.conversation;

/**
 * Outcome of assigning one booking field. A rejection carries the sentence to read back.
 */
public record FieldUpdateResult(BookingField field, boolean accepted, String message) {

    public static FieldUpdateResult accepted(BookingField field) {
        return new FieldUpdateResult(field, true, null);
    }

    public static FieldUpdateResult rejected(BookingField field, String message) {
        return new FieldUpdateResult(field, false, message);
    }
}

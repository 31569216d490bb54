package com.ai.salon.dto;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Result of one receptionist action: the sentence to speak plus structured data for the runtime.
 */
public final class ActionResponse {

    public enum Type {
        DATE_TIME,
        CONTEXT_UPDATED,
        VALIDATION_ERROR,
        SUMMARY,
        INCOMPLETE,
        CONFIRMED,
        SLOT_AVAILABLE,
        SLOT_FULL,
        OUTSIDE_HOURS,
        CLOSED,
        AVAILABLE_TIMES,
        ANSWERED,
        ESCALATED,
        ERROR
    }

    private final Type type;
    private final String message;
    private final Map<String, Object> payload;

    private ActionResponse(Type type, String message, Map<String, Object> payload) {
        this.type = type;
        this.message = message;
        this.payload = payload == null ? Collections.emptyMap() : new HashMap<>(payload);
    }

    public Type getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public String getString(String key) {
        Object v = payload.get(key);
        return v == null ? null : v.toString();
    }

    public static ActionResponse of(Type type, String message) {
        return new ActionResponse(type, message, null);
    }

    public static ActionResponse of(Type type, String message, Map<String, Object> payload) {
        return new ActionResponse(type, message, payload);
    }

    public static ActionResponse error(String message) {
        return new ActionResponse(Type.ERROR, message, null);
    }

    public static ActionResponse confirmed(String message, String confirmationNumber, String service,
                                           String date, String time, String price) {
        Map<String, Object> p = new HashMap<>();
        p.put("confirmationNumber", confirmationNumber);
        p.put("service", service);
        p.put("date", date);
        p.put("time", time);
        p.put("price", price);
        p.put("status", "confirmed");
        return new ActionResponse(Type.CONFIRMED, message, p);
    }
}

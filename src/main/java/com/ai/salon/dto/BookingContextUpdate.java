package com.ai.salon.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Booking details collected during one turn. Any subset may be present.
 */
public record BookingContextUpdate(
        @JsonProperty("customer_name") String customerName,
        @JsonProperty("phone_number") String phoneNumber,
        @JsonProperty("service") String service,
        @JsonProperty("appointment_date") String appointmentDate,
        @JsonProperty("appointment_time") String appointmentTime
) {
}

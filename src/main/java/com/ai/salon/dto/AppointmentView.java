package com.ai.salon.dto;

import com.ai.salon.entity.Appointment;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;

public record AppointmentView(
        @JsonProperty("confirmation_number") String confirmationNumber,
        @JsonProperty("customer_name") String customerName,
        @JsonProperty("phone_number") String phoneNumber,
        String service,
        BigDecimal price,
        @JsonProperty("appointment_date") LocalDate appointmentDate,
        @JsonProperty("appointment_time") String appointmentTime,
        String status,
        boolean cancelled,
        @JsonProperty("cancellation_reason") String cancellationReason,
        @JsonProperty("created_at") Instant createdAt
) {

    public static AppointmentView from(Appointment a) {
        return new AppointmentView(
                a.getConfirmationNumber(),
                a.getCustomerName(),
                a.getPhoneNumber(),
                a.getService(),
                a.getPrice(),
                a.getAppointmentDate(),
                a.getAppointmentTime().getLabel(),
                a.getStatus().name().toLowerCase(Locale.ENGLISH),
                a.isCancelled(),
                a.getCancellationReason(),
                a.getCreatedAt());
    }
}

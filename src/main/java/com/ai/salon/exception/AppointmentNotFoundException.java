package com.ai.salon.exception;

public class AppointmentNotFoundException extends ReceptionistException {

    public AppointmentNotFoundException(String confirmationNumber) {
        super(ErrorKind.NOT_FOUND, "Appointment not found: " + confirmationNumber);
    }
}

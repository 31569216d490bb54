package com.ai.salon.exception;

public class AppointmentConflictException extends ReceptionistException {

    public AppointmentConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}

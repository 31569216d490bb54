package com.ai.salon.exception;

public class InvalidRequestException extends ReceptionistException {

    public InvalidRequestException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}

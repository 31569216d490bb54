package com.ai.salon.exception;

public class HelpRequestNotFoundException extends ReceptionistException {

    public HelpRequestNotFoundException(String requestId) {
        super(ErrorKind.NOT_FOUND, "Help request not found: " + requestId);
    }
}

package com.ai.salon.exception;

/**
 * A second resolution of the same help request. The first one wins.
 */
public class HelpRequestConflictException extends ReceptionistException {

    public HelpRequestConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }

    public HelpRequestConflictException(String message, Throwable cause) {
        super(ErrorKind.CONFLICT, message, cause);
    }
}

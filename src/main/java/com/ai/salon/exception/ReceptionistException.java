package com.ai.salon.exception;

/**
 * Base for failures that surface past the conversational layer.
 */
public class ReceptionistException extends RuntimeException {

    private final ErrorKind kind;

    public ReceptionistException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ReceptionistException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}

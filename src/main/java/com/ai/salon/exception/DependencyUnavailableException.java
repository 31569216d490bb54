package com.ai.salon.exception;

/**
 * Store, vector index, embedding model or webhook unreachable.
 */
public class DependencyUnavailableException extends ReceptionistException {

    public DependencyUnavailableException(String message) {
        super(ErrorKind.DEPENDENCY_UNAVAILABLE, message);
    }

    public DependencyUnavailableException(String message, Throwable cause) {
        super(ErrorKind.DEPENDENCY_UNAVAILABLE, message, cause);
    }
}

package com.ai.salon.exception;

public class CorruptRecordException extends ReceptionistException {

    public CorruptRecordException(String message) {
        super(ErrorKind.CORRUPT_RECORD, message);
    }

    public CorruptRecordException(String message, Throwable cause) {
        super(ErrorKind.CORRUPT_RECORD, message, cause);
    }
}

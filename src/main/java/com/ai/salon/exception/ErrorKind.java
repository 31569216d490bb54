package com.ai.salon.exception;

public enum ErrorKind {
    VALIDATION_ERROR,
    CAPACITY_ERROR,
    NOT_FOUND,
    CORRUPT_RECORD,
    DEPENDENCY_UNAVAILABLE,
    CONFLICT
}

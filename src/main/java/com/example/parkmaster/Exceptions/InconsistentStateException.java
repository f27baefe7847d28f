package com.example.parkmaster.Exceptions;

/**
 * Thrown when a lot's space registry no longer matches its dimensions, or a
 * query references a space the registry does not contain. The operation that
 * detects it is aborted.
 */
public class InconsistentStateException extends RuntimeException {

    public InconsistentStateException(String message) {
        super(message);
    }
}

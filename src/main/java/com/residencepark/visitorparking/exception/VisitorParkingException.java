package com.residencepark.visitorparking.exception;

/**
 * Root of the error taxonomy surfaced by the visitor lifecycle and the assistant.
 *
 * Store-level exceptions never escape VisitorService; they are translated
 * into one of the subclasses so GlobalExceptionHandler can map each kind to
 * a single HTTP status.
 */
public abstract class VisitorParkingException extends RuntimeException {

    protected VisitorParkingException(String message) {
        super(message);
    }

    protected VisitorParkingException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.residencepark.visitorparking.exception;

/**
 * Malformed or missing required input.
 */
public class ValidationException extends VisitorParkingException {

    public ValidationException(String message) {
        super(message);
    }
}

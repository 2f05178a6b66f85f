package com.residencepark.visitorparking.exception;

/**
 * The record store or the generative model could not be reached.
 */
public class BackendUnavailableException extends VisitorParkingException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

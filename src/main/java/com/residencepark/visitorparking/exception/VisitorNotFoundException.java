package com.residencepark.visitorparking.exception;

/**
 * The visitor id does not resolve to an existing record, including ids that
 * are not well-formed.
 */
public class VisitorNotFoundException extends VisitorParkingException {

    private final String visitorId;

    public VisitorNotFoundException(String visitorId) {
        super("Visitor not found: " + visitorId);
        this.visitorId = visitorId;
    }

    public String getVisitorId() {
        return visitorId;
    }
}

package com.residencepark.visitorparking.entity;

import java.util.Locale;
import java.util.Optional;

/**
 * Occupancy status of a visitor record.
 *
 * Stored by enum name in the DB (EnumType.STRING) and always rendered in
 * lower case ("active" / "left") towards callers.
 */
public enum VisitorStatus {

    /** Visitor's car is currently parked */
    ACTIVE,

    /** Visitor has left the premises */
    LEFT;

    /** Lower-case wire form, e.g. "active". */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a status case-insensitively ("Active", "LEFT", " left ").
     *
     * @return empty if the text is null or not a known status
     */
    public static Optional<VisitorStatus> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (VisitorStatus status : values()) {
            if (status.name().equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}

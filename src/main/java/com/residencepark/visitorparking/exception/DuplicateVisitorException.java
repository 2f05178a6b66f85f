package com.residencepark.visitorparking.exception;

/**
 * Registration rejected because another record already holds the
 * identity number or license plate.
 */
public class DuplicateVisitorException extends VisitorParkingException {

    /** Which unique field collided. Identity number wins when both do. */
    public enum Field {
        IDENTITY_NUMBER("identity number"),
        LICENSE_PLATE("license plate");

        private final String label;

        Field(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Field field;

    public DuplicateVisitorException(Field field) {
        super("Visitor with this " + field.label() + " already exists");
        this.field = field;
    }

    public DuplicateVisitorException(Field field, Throwable cause) {
        super("Visitor with this " + field.label() + " already exists", cause);
        this.field = field;
    }

    public Field getField() {
        return field;
    }
}

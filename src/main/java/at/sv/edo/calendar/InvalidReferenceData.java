package at.sv.edo.calendar;

/**
 * A reference dataset could not be read or contains malformed rows.
 */
public class InvalidReferenceData extends RuntimeException {
    public InvalidReferenceData(String message) {
        super(message);
    }

    public InvalidReferenceData(String message, Throwable cause) {
        super(message, cause);
    }
}

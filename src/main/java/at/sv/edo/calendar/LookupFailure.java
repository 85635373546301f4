package at.sv.edo.calendar;

/**
 * Why a table backed value could not be resolved for a query. Failures are returned, not thrown, so that the other
 * fields of a result stay usable.
 */
public record LookupFailure(Kind kind, String reason) {

    public enum Kind {
        /**
         * The date lies before or after the span the lunar calendar table covers.
         */
        DATE_OUT_OF_RANGE,
        /**
         * The date lies within the covered span but has no row.
         */
        DATE_NOT_FOUND,
        /**
         * The instant lies outside the new moon coverage.
         */
        DATA_RANGE
    }

    @Override
    public String toString() {
        return kind + ": " + reason;
    }
}

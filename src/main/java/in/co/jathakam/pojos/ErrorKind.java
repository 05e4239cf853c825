package in.co.jathakam.pojos;

/**
 * Failure categories a chart request can end in.
 * The names double as the {@code errorCode} values of JSON error responses.
 */
public enum ErrorKind {
    INVALID_INPUT,          // Unparseable date/time, impossible calendar date, out-of-range coordinates
    LOCATION_UNRESOLVED,    // Place name not present in the location directory
    NUMERIC_DOMAIN_ERROR;   // Formula undefined for the input (e.g. latitude at a pole)

    /**
     * Convert string to enum.
     * Returns null if string doesn't match any enum value.
     */
    public static ErrorKind fromString(String value) {
        if (value == null) return null;
        try {
            return ErrorKind.valueOf(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}

package io.campbellsci.parser.util;

/** Raised when a compact Hour/Minute value is empty or longer than four characters. */
public class InvalidCompactTimeException extends TimeColumnValueException {
    private final String value;

    public InvalidCompactTimeException(final String value) {
        super("Invalid Hour/Minute value '" + value + "': expected 1 to 4 characters");
        this.value = value;
    }

    /**
     * @return The offending Hour/Minute value.
     */
    public String value() {
        return value;
    }
}

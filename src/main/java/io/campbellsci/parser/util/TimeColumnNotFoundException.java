package io.campbellsci.parser.util;

/** Raised when a column that a time operation depends on is absent from a row. */
public class TimeColumnNotFoundException extends TimeColumnValueException {
    public TimeColumnNotFoundException(String message) {
        super(message);
    }
}

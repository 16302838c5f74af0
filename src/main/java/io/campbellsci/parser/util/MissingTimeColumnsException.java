package io.campbellsci.parser.util;

/** Raised when a time conversion is requested without naming any time column. */
public class MissingTimeColumnsException extends TimeColumnValueException {
    public MissingTimeColumnsException() {
        super("At least one time column is required!");
    }
}

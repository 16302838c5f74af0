package io.campbellsci.parser.util;

/** Raised when the time columns of a row (or the arguments naming them) are unusable. */
public class TimeColumnValueException extends CrParserException {
    public TimeColumnValueException(String message) {
        super(message);
    }
}

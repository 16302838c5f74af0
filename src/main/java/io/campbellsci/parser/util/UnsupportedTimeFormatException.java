package io.campbellsci.parser.util;

/** Raised when a row supplies more time values than the device's time format library can describe. */
public class UnsupportedTimeFormatException extends CrParserException {
    public UnsupportedTimeFormatException(String message) {
        super(message);
    }
}

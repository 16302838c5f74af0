package io.campbellsci.parser.util;

/** The standard Exception class for errors raised while reading, converting or exporting datalogger data. */
public class CrParserException extends Exception {
    /**
     * Constructor.
     *
     * @param message The exception message.
     */
    public CrParserException(String message) {
        super(message);
    }

    /**
     * Constructor.
     *
     * @param message The exception message.
     * @param cause The inner exception.
     */
    public CrParserException(String message, Throwable cause) {
        super(message, cause);
    }
}

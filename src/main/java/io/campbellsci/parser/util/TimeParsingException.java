package io.campbellsci.parser.util;

/**
 * Raised when a combined time string does not match its combined format. Carries both so the caller can report the
 * offending input.
 */
public class TimeParsingException extends CrParserException {
    private final String timeValue;
    private final String timeFormat;

    /**
     * Constructor.
     *
     * @param timeValue The combined time string.
     * @param timeFormat The combined strftime-style format.
     * @param cause The underlying parse error, if any.
     */
    public TimeParsingException(final String timeValue, final String timeFormat, final Throwable cause) {
        super(String.format("Could not parse time string %s using the format %s", timeValue, timeFormat), cause);
        this.timeValue = timeValue;
        this.timeFormat = timeFormat;
    }

    public String timeValue() {
        return timeValue;
    }

    public String timeFormat() {
        return timeFormat;
    }
}

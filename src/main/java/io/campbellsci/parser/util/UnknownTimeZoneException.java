package io.campbellsci.parser.util;

/**
 * Raised when a time zone name is not a known IANA zone. This is a configuration error, so it is unchecked and raised
 * when the configuration is built rather than when data is parsed.
 */
public class UnknownTimeZoneException extends RuntimeException {
    private final String timeZone;

    public UnknownTimeZoneException(final String timeZone, final Throwable cause) {
        super(String.format("%s is not a valid time zone", timeZone), cause);
        this.timeZone = timeZone;
    }

    public String timeZone() {
        return timeZone;
    }
}

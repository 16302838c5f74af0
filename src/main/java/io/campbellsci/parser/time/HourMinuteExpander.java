package io.campbellsci.parser.time;

import io.campbellsci.parser.util.InvalidCompactTimeException;
import io.campbellsci.parser.util.UnsupportedTimeFormatException;

import java.util.List;

/**
 * The token expander of the CR10 family. The Hour/Minute sentinel is recognized in two spellings:
 * <ul>
 * <li>{@link #TOKEN} ({@code %H%M}): the value is padded to HHMM and the token is kept as the format.</li>
 * <li>{@link #LEGACY_TOKEN} ({@code Hour/Minute}): the value becomes HH:MM and the format becomes {@code %H:%M}.</li>
 * </ul>
 * All other tokens pass through unchanged.
 */
public final class HourMinuteExpander implements TokenExpander {
    public static final String TOKEN = "%H%M";
    public static final String LEGACY_TOKEN = "Hour/Minute";

    private final String deviceName;

    public HourMinuteExpander(final String deviceName) {
        this.deviceName = deviceName;
    }

    @Override
    public ParsedTimeInfo expand(final String token, final String value) throws InvalidCompactTimeException {
        if (TOKEN.equals(token)) {
            return new ParsedTimeInfo(TOKEN, HourMinute.toHhmm(value));
        }
        if (LEGACY_TOKEN.equals(token)) {
            return new ParsedTimeInfo("%H:%M", HourMinute.toHhColonMm(value));
        }
        return new ParsedTimeInfo(token, value);
    }

    @Override
    public void checkValueCount(final TimeFormatLibrary library, final List<String> timeValues)
            throws UnsupportedTimeFormatException {
        if (timeValues.size() > library.size()) {
            throw new UnsupportedTimeFormatException(String.format(
                    "%s only supports %d time values (%s), got %d time values",
                    deviceName, library.size(), library, timeValues.size()));
        }
    }
}

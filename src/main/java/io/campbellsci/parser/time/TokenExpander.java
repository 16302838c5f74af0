package io.campbellsci.parser.time;

import io.campbellsci.parser.util.CrParserException;
import io.campbellsci.parser.util.UnsupportedTimeFormatException;

import java.util.List;

/**
 * Device-specific rewriting of one (format token, raw value) pair before the pieces are joined for the generic parser.
 * Devices that write their time in plain strftime-compatible columns use {@link #PASS_THROUGH}.
 */
public interface TokenExpander {
    /** Leaves every token and value untouched. */
    TokenExpander PASS_THROUGH = ParsedTimeInfo::new;

    /**
     * @param token The format token from the time format library
     * @param value The raw time value paired with it
     * @return The (possibly rewritten) format token and value.
     * @throws CrParserException If the value cannot be rewritten
     */
    ParsedTimeInfo expand(String token, String value) throws CrParserException;

    /**
     * Reject rows that supply more time values than this device can describe. The default accepts any count, leaving
     * the library resolver to ignore the surplus.
     *
     * @param library The active time format library
     * @param timeValues The raw time values of the row
     * @throws UnsupportedTimeFormatException If the row has too many time values
     */
    default void checkValueCount(final TimeFormatLibrary library, final List<String> timeValues)
            throws UnsupportedTimeFormatException {}
}

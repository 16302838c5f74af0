package io.campbellsci.parser.time;

import io.campbellsci.parser.util.CrParserException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ordered strftime-style tokens that describe a device's time columns, one token per column. A token may be a
 * device-specific sentinel (such as {@link HourMinuteExpander#TOKEN}) that a {@link TokenExpander} rewrites.
 */
public final class TimeFormatLibrary {
    /** Joins the per-column formats and values. */
    public static final String SEPARATOR = ",";

    private final List<String> tokens;

    private TimeFormatLibrary(final List<String> tokens) {
        this.tokens = tokens;
    }

    public static TimeFormatLibrary of(final List<String> tokens) {
        return new TimeFormatLibrary(Collections.unmodifiableList(new ArrayList<>(tokens)));
    }

    public List<String> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    /**
     * Pair the library's tokens with {@code timeValues} positionally and join both sides with {@link #SEPARATOR}.
     * Pairing stops at the shorter of the two lists. Each pair goes through {@code expander} first.
     *
     * @param timeValues The raw time values of one row, in column order
     * @param expander The device's token expander
     * @return The combined format and value.
     * @throws CrParserException If the expander rejects the row or one of its values
     */
    public ParsedTimeInfo resolve(final List<String> timeValues, final TokenExpander expander)
            throws CrParserException {
        expander.checkValueCount(this, timeValues);
        final int pairs = Math.min(tokens.size(), timeValues.size());
        final List<String> formats = new ArrayList<>(pairs);
        final List<String> values = new ArrayList<>(pairs);
        for (int ii = 0; ii < pairs; ++ii) {
            final ParsedTimeInfo expanded = expander.expand(tokens.get(ii), timeValues.get(ii));
            formats.add(expanded.timeFormat());
            values.add(expanded.timeValue());
        }
        return new ParsedTimeInfo(String.join(SEPARATOR, formats), String.join(SEPARATOR, values));
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof TimeFormatLibrary && tokens.equals(((TimeFormatLibrary) o).tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return tokens.toString();
    }
}

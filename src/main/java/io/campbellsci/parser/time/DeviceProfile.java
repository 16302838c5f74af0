package io.campbellsci.parser.time;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The datalogger models whose time columns this library understands. Each carries the default time format library
 * for the model and the expander for its custom tokens.
 */
public enum DeviceProfile {
    /** No preset library; tokens are used as given. */
    GENERIC(Collections.emptyList(), TokenExpander.PASS_THROUGH),
    /** Two-digit year, day of year, compact Hour/Minute. */
    CR10(Arrays.asList("%y", "%j", HourMinuteExpander.TOKEN), new HourMinuteExpander("CR10")),
    /** Four-digit year, day of year, compact Hour/Minute. */
    CR10X(Arrays.asList("%Y", "%j", HourMinuteExpander.TOKEN), new HourMinuteExpander("CR10X")),
    /** A single ISO-like timestamp column. */
    CR1000(Collections.singletonList("%Y-%m-%d %H:%M:%S"), TokenExpander.PASS_THROUGH);

    private final List<String> defaultTimeFormatArgsLibrary;
    private final TokenExpander tokenExpander;

    DeviceProfile(final List<String> defaultTimeFormatArgsLibrary, final TokenExpander tokenExpander) {
        this.defaultTimeFormatArgsLibrary = Collections.unmodifiableList(defaultTimeFormatArgsLibrary);
        this.tokenExpander = tokenExpander;
    }

    public List<String> defaultTimeFormatArgsLibrary() {
        return defaultTimeFormatArgsLibrary;
    }

    public TokenExpander tokenExpander() {
        return tokenExpander;
    }
}

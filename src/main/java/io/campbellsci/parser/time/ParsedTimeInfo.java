package io.campbellsci.parser.time;

import java.util.Objects;

/**
 * The combined strftime-style format and the combined time string that the generic parser consumes. Both are the
 * per-column pieces joined by {@link TimeFormatLibrary#SEPARATOR}.
 */
public final class ParsedTimeInfo {
    private final String timeFormat;
    private final String timeValue;

    public ParsedTimeInfo(final String timeFormat, final String timeValue) {
        this.timeFormat = Objects.requireNonNull(timeFormat, "timeFormat");
        this.timeValue = Objects.requireNonNull(timeValue, "timeValue");
    }

    public String timeFormat() {
        return timeFormat;
    }

    public String timeValue() {
        return timeValue;
    }

    /**
     * @return true if both the format and the value are empty, which happens when a row has no time values or the
     *         library has no tokens.
     */
    public boolean isEmpty() {
        return timeFormat.isEmpty() && timeValue.isEmpty();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParsedTimeInfo)) {
            return false;
        }
        final ParsedTimeInfo other = (ParsedTimeInfo) o;
        return timeFormat.equals(other.timeFormat) && timeValue.equals(other.timeValue);
    }

    @Override
    public int hashCode() {
        return 31 * timeFormat.hashCode() + timeValue.hashCode();
    }

    @Override
    public String toString() {
        return "ParsedTimeInfo{timeFormat='" + timeFormat + "', timeValue='" + timeValue + "'}";
    }
}

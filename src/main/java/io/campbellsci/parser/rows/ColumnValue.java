package io.campbellsci.parser.rows;

import org.jetbrains.annotations.NotNull;

import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * A cell of a {@link Row}: either the raw text read from the datalogger file, or a zone-aware timestamp produced by
 * time conversion.
 */
public final class ColumnValue {
    /** The two flavors of column value. */
    public enum Kind {
        RAW, TIMESTAMP
    }

    private final String raw;
    private final ZonedDateTime timestamp;

    private ColumnValue(final String raw, final ZonedDateTime timestamp) {
        this.raw = raw;
        this.timestamp = timestamp;
    }

    public static ColumnValue raw(@NotNull final String raw) {
        return new ColumnValue(Objects.requireNonNull(raw, "raw"), null);
    }

    public static ColumnValue timestamp(@NotNull final ZonedDateTime timestamp) {
        return new ColumnValue(null, Objects.requireNonNull(timestamp, "timestamp"));
    }

    public Kind kind() {
        return raw != null ? Kind.RAW : Kind.TIMESTAMP;
    }

    public boolean isRaw() {
        return raw != null;
    }

    public boolean isTimestamp() {
        return timestamp != null;
    }

    /**
     * @return The raw text.
     * @throws IllegalStateException if this value holds a timestamp
     */
    public String asRaw() {
        if (raw == null) {
            throw new IllegalStateException("Value " + this + " is a timestamp, not raw text");
        }
        return raw;
    }

    /**
     * @return The timestamp.
     * @throws IllegalStateException if this value holds raw text
     */
    public ZonedDateTime asTimestamp() {
        if (timestamp == null) {
            throw new IllegalStateException("Value '" + raw + "' is raw text, not a timestamp");
        }
        return timestamp;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnValue)) {
            return false;
        }
        final ColumnValue other = (ColumnValue) o;
        return Objects.equals(raw, other.raw) && Objects.equals(timestamp, other.timestamp);
    }

    @Override
    public int hashCode() {
        return raw != null ? raw.hashCode() : timestamp.hashCode();
    }

    /**
     * @return The raw text, or the ISO-8601 form of the timestamp.
     */
    @Override
    public String toString() {
        return raw != null ? raw : timestamp.toString();
    }
}

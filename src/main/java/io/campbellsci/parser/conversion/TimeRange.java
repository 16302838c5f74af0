package io.campbellsci.parser.conversion;

import io.campbellsci.parser.rows.ColumnKey;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * An inclusive time window over a timestamp column. An unset start means the UNIX epoch; an unset end means the moment
 * the range is evaluated.
 */
public final class TimeRange {
    private final ColumnKey timeColumn;
    @Nullable
    private final ZonedDateTime from;
    @Nullable
    private final ZonedDateTime to;

    public TimeRange(final ColumnKey timeColumn, @Nullable final ZonedDateTime from,
            @Nullable final ZonedDateTime to) {
        this.timeColumn = timeColumn;
        this.from = from;
        this.to = to;
    }

    public static TimeRange of(final ColumnKey timeColumn) {
        return new TimeRange(timeColumn, null, null);
    }

    public ColumnKey timeColumn() {
        return timeColumn;
    }

    public Instant fromInstant() {
        return from == null ? Instant.EPOCH : from.toInstant();
    }

    public Instant toInstant() {
        return to == null ? Instant.now() : to.toInstant();
    }
}

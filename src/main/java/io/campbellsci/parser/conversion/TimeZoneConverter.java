package io.campbellsci.parser.conversion;

import io.campbellsci.parser.rows.ColumnKey;
import io.campbellsci.parser.rows.ColumnValue;
import io.campbellsci.parser.rows.DataSet;
import io.campbellsci.parser.rows.Row;
import io.campbellsci.parser.util.TimeColumnNotFoundException;
import io.campbellsci.parser.util.TimeColumnValueException;
import io.campbellsci.parser.util.UnknownTimeZoneException;

import java.time.DateTimeException;
import java.time.ZoneId;

/** Shifts an already-converted timestamp column to another zone, keeping the instant. */
public class TimeZoneConverter {
    /**
     * @param data The rows
     * @param timeColumn The column holding the timestamps
     * @param toTimeZone The IANA name of the target zone
     * @return New rows whose timestamps are expressed in {@code toTimeZone}.
     * @throws UnknownTimeZoneException If {@code toTimeZone} is not a known zone
     * @throws TimeColumnNotFoundException If a row lacks {@code timeColumn}
     * @throws TimeColumnValueException If a row's {@code timeColumn} does not hold a timestamp
     */
    public static DataSet convert(final DataSet data, final ColumnKey timeColumn, final String toTimeZone)
            throws TimeColumnValueException {
        final ZoneId zoneId;
        try {
            zoneId = ZoneId.of(toTimeZone);
        } catch (DateTimeException e) {
            throw new UnknownTimeZoneException(toTimeZone, e);
        }

        final DataSet converted = new DataSet();
        for (final Row row : data) {
            final ColumnValue value = row.find(timeColumn);
            if (value == null) {
                throw new TimeColumnNotFoundException(String.format("%s not found in column names!", timeColumn));
            }
            if (!value.isTimestamp()) {
                throw new TimeColumnValueException(
                        String.format("Column '%s' holds '%s', not a timestamp", timeColumn, value));
            }
            converted.add(row.copy()
                    .set(timeColumn, ColumnValue.timestamp(value.asTimestamp().withZoneSameInstant(zoneId))));
        }
        return converted;
    }

    private TimeZoneConverter() {}
}

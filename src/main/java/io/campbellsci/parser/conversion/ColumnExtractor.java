package io.campbellsci.parser.conversion;

import io.campbellsci.parser.rows.ColumnKey;
import io.campbellsci.parser.rows.ColumnValue;
import io.campbellsci.parser.rows.DataSet;
import io.campbellsci.parser.rows.Row;
import io.campbellsci.parser.util.TimeColumnNotFoundException;
import io.campbellsci.parser.util.TimeColumnValueException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Projects rows onto a subset of their columns, optionally keeping only the rows inside a time window. */
public class ColumnExtractor {
    /**
     * @param data The rows
     * @param columns The columns to keep; all columns if empty. Columns a row lacks are skipped.
     * @return New rows holding only {@code columns}, in each row's own column order.
     */
    public static DataSet extract(final DataSet data, final List<ColumnKey> columns) {
        final DataSet extracted = new DataSet();
        for (final Row row : data) {
            extracted.add(project(row, columns));
        }
        return extracted;
    }

    /**
     * @param data The rows
     * @param columns The columns to keep; all columns if empty
     * @param range Rows whose timestamp falls outside this window (bounds included) are dropped
     * @return The projected rows inside the window.
     * @throws TimeColumnNotFoundException If a row lacks the range's time column
     * @throws TimeColumnValueException If a row's time column does not hold a timestamp
     */
    public static DataSet extract(final DataSet data, final List<ColumnKey> columns, final TimeRange range)
            throws TimeColumnValueException {
        final Instant from = range.fromInstant();
        final Instant to = range.toInstant();
        final DataSet extracted = new DataSet();
        for (final Row row : data) {
            final ColumnValue value = row.find(range.timeColumn());
            if (value == null) {
                throw new TimeColumnNotFoundException(
                        String.format("Time column '%s' not found in column names!", range.timeColumn()));
            }
            if (!value.isTimestamp()) {
                throw new TimeColumnValueException(
                        String.format("Time column '%s' holds '%s', not a timestamp", range.timeColumn(), value));
            }
            final Instant instant = value.asTimestamp().toInstant();
            if (instant.isBefore(from) || instant.isAfter(to)) {
                continue;
            }
            extracted.add(project(row, columns));
        }
        return extracted;
    }

    private static Row project(final Row row, final List<ColumnKey> columns) {
        if (columns.isEmpty()) {
            return row.copy();
        }
        final Row projected = new Row();
        for (final Map.Entry<ColumnKey, ColumnValue> entry : row.entries()) {
            if (columns.contains(entry.getKey())) {
                projected.set(entry.getKey(), entry.getValue());
            }
        }
        return projected;
    }

    private ColumnExtractor() {}
}

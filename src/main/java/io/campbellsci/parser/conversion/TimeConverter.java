package io.campbellsci.parser.conversion;

import io.campbellsci.parser.ConversionSpecs;
import io.campbellsci.parser.CrSpecs;
import io.campbellsci.parser.rows.ColumnKey;
import io.campbellsci.parser.rows.ColumnValue;
import io.campbellsci.parser.rows.DataSet;
import io.campbellsci.parser.rows.Row;
import io.campbellsci.parser.time.TimeParser;
import io.campbellsci.parser.util.CrParserException;
import io.campbellsci.parser.util.MissingTimeColumnsException;
import io.campbellsci.parser.util.TimeColumnNotFoundException;
import io.campbellsci.parser.util.TimeColumnValueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Replaces the time columns of each row by a single timestamp column.
 *
 * <p>
 * For every row: the timestamp is stored at the position of {@link ConversionSpecs#replaceTimeColumn()} (or of the
 * first time column found in the row), under {@link ConversionSpecs#timeParsedColumn()} (or the key it replaces), and
 * every other time column is removed. Non-time columns keep their order and values. Input rows are never modified.
 */
public final class TimeConverter {
    private static final Logger LOG = LoggerFactory.getLogger(TimeConverter.class);

    private final TimeParser timeParser;

    public TimeConverter(final TimeParser timeParser) {
        this.timeParser = timeParser;
    }

    /**
     * @param specs The device configuration
     * @return A converter for the device described by {@code specs}.
     */
    public static TimeConverter of(final CrSpecs specs) {
        return new TimeConverter(TimeParser.of(specs));
    }

    public TimeParser timeParser() {
        return timeParser;
    }

    /**
     * Convert every row. The first failing row aborts the conversion; use {@link #convertRow} to handle failures row by
     * row.
     *
     * @param data The rows to convert
     * @param specs The conversion arguments
     * @return The converted rows, in input order.
     * @throws CrParserException If the arguments are invalid or a row cannot be converted
     */
    public DataSet convert(final DataSet data, final ConversionSpecs specs) throws CrParserException {
        checkTimeColumns(specs);
        final DataSet converted = new DataSet();
        for (final Row row : data) {
            converted.add(convertRow(row, specs));
        }
        LOG.debug("Converted time columns {} of {} rows", specs.timeColumns(), converted.size());
        return converted;
    }

    /**
     * Convert one row.
     *
     * @param row The row to convert. It is not modified.
     * @param specs The conversion arguments
     * @return A new row holding the timestamp in place of the time columns.
     * @throws MissingTimeColumnsException If no time column is given
     * @throws TimeColumnNotFoundException If the row lacks the replaced column, or the first time column
     * @throws CrParserException If the time values cannot be resolved or parsed
     */
    public Row convertRow(final Row row, final ConversionSpecs specs) throws CrParserException {
        checkTimeColumns(specs);
        final List<ColumnKey> timeColumns = specs.timeColumns();
        final ColumnKey insertionKey = findInsertionKey(row, specs);

        final List<String> timeValues = new ArrayList<>();
        for (final Map.Entry<ColumnKey, ColumnValue> entry : row.entries()) {
            if (!timeColumns.contains(entry.getKey())) {
                continue;
            }
            final ColumnValue value = entry.getValue();
            if (!value.isRaw()) {
                throw new TimeColumnValueException(
                        String.format("Time column '%s' already holds a timestamp", entry.getKey()));
            }
            timeValues.add(value.asRaw());
        }

        final ZonedDateTime timestamp =
                timeParser.parse(timeValues, specs.ignoreParsingError(), specs.toUtc());

        final ColumnKey outputKey = specs.timeParsedColumn() != null ? specs.timeParsedColumn() : insertionKey;
        final Row converted = row.copy()
                .rename(insertionKey, outputKey)
                .set(outputKey, ColumnValue.timestamp(timestamp));
        for (final ColumnKey timeColumn : timeColumns) {
            if (!timeColumn.equals(outputKey) && converted.containsKey(timeColumn)) {
                converted.remove(timeColumn);
            }
        }
        return converted;
    }

    private static ColumnKey findInsertionKey(final Row row, final ConversionSpecs specs)
            throws TimeColumnNotFoundException {
        final ColumnKey replaceTimeColumn = specs.replaceTimeColumn();
        if (replaceTimeColumn != null) {
            if (!row.containsKey(replaceTimeColumn)) {
                throw new TimeColumnNotFoundException(
                        String.format("%s not found in column names!", replaceTimeColumn));
            }
            return replaceTimeColumn;
        }
        final ColumnKey firstTimeColumn = specs.timeColumns().get(0);
        if (!row.containsKey(firstTimeColumn)) {
            throw new TimeColumnNotFoundException(
                    String.format("First time column '%s' not found in column names!", firstTimeColumn));
        }
        return firstTimeColumn;
    }

    private static void checkTimeColumns(final ConversionSpecs specs) throws MissingTimeColumnsException {
        if (specs.timeColumns().isEmpty()) {
            throw new MissingTimeColumnsException();
        }
    }
}

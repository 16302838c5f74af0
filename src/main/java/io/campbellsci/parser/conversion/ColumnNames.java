package io.campbellsci.parser.conversion;

import io.campbellsci.parser.rows.ColumnKey;
import io.campbellsci.parser.rows.ColumnValue;
import io.campbellsci.parser.rows.DataSet;
import io.campbellsci.parser.rows.Row;

import java.util.ArrayList;
import java.util.List;

/** Re-keys rows positionally, e.g. to give names to the columns of index-keyed mixed-array data. */
public class ColumnNames {
    /** The re-keyed rows, plus the rows whose length did not match the new names. */
    public static final class Result {
        private final DataSet updated;
        private final DataSet mismatched;

        Result(final DataSet updated, final DataSet mismatched) {
            this.updated = updated;
            this.mismatched = mismatched;
        }

        public DataSet updated() {
            return updated;
        }

        /**
         * @return The input rows (unchanged) whose column count differed from the number of names.
         */
        public DataSet mismatched() {
            return mismatched;
        }
    }

    /**
     * @param data The rows
     * @param columnNames The new keys, by position
     * @param matchRowLengths If true, rows with a different number of columns are left out of
     *        {@link Result#updated()}. If false they are re-keyed up to the shorter of the two lengths.
     * @return The result.
     */
    public static Result update(final DataSet data, final List<ColumnKey> columnNames,
            final boolean matchRowLengths) {
        final DataSet updated = new DataSet();
        final DataSet mismatched = new DataSet();
        for (final Row row : data) {
            final boolean matches = row.size() == columnNames.size();
            if (!matches) {
                mismatched.add(row);
                if (matchRowLengths) {
                    continue;
                }
            }
            final List<ColumnValue> values = row.values();
            final int size = Math.min(values.size(), columnNames.size());
            final Row renamed = new Row();
            for (int ii = 0; ii < size; ++ii) {
                renamed.set(columnNames.get(ii), values.get(ii));
            }
            updated.add(renamed);
        }
        return new Result(updated, mismatched);
    }

    /**
     * Convenience overload for textual names.
     *
     * @param data The rows
     * @param columnNames The new names, by position
     * @param matchRowLengths See {@link #update(DataSet, List, boolean)}
     * @return The result.
     */
    public static Result updateNames(final DataSet data, final List<String> columnNames,
            final boolean matchRowLengths) {
        final List<ColumnKey> keys = new ArrayList<>(columnNames.size());
        for (final String name : columnNames) {
            keys.add(ColumnKey.name(name));
        }
        return update(data, keys, matchRowLengths);
    }

    private ColumnNames() {}
}

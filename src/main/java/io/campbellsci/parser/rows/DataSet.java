package io.campbellsci.parser.rows;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/** An ordered sequence of {@link Row}s, as read from a single datalogger file or produced by a transformation. */
public final class DataSet implements Iterable<Row> {
    private final List<Row> rows;

    public DataSet() {
        this.rows = new ArrayList<>();
    }

    public DataSet(final Collection<Row> rows) {
        this.rows = new ArrayList<>(rows);
    }

    public static DataSet of(final Row... rows) {
        final DataSet result = new DataSet();
        for (final Row row : rows) {
            result.add(row);
        }
        return result;
    }

    public DataSet add(final Row row) {
        rows.add(row);
        return this;
    }

    public Row get(final int index) {
        return rows.get(index);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * @return A read-only view of the rows.
     */
    public List<Row> rows() {
        return Collections.unmodifiableList(rows);
    }

    @Override
    public Iterator<Row> iterator() {
        return rows().iterator();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof DataSet && rows.equals(((DataSet) o).rows);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        return rows.toString();
    }
}

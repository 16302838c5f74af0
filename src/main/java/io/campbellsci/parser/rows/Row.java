package io.campbellsci.parser.rows;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * One record of datalogger output: an insertion-ordered mapping from {@link ColumnKey} to {@link ColumnValue}. Keys
 * are unique; setting an existing key keeps its position, setting a new key appends it.
 */
public final class Row {
    private final LinkedHashMap<ColumnKey, ColumnValue> cells;

    public Row() {
        this.cells = new LinkedHashMap<>();
    }

    private Row(final LinkedHashMap<ColumnKey, ColumnValue> cells) {
        this.cells = cells;
    }

    /**
     * Build a row whose keys are the indices {@code 0..values.size()-1}.
     *
     * @param values The raw cell values, in column order
     * @return The row
     */
    public static Row ofIndexed(final List<String> values) {
        final Row row = new Row();
        for (int ii = 0; ii < values.size(); ++ii) {
            row.set(ColumnKey.index(ii), ColumnValue.raw(values.get(ii)));
        }
        return row;
    }

    /**
     * Build a row by pairing {@code names} with {@code values} positionally. When the lists differ in length, the
     * extra elements of the longer one are ignored.
     *
     * @param names The column headers
     * @param values The raw cell values
     * @return The row
     */
    public static Row ofNamed(final List<String> names, final List<String> values) {
        final Row row = new Row();
        final int size = Math.min(names.size(), values.size());
        for (int ii = 0; ii < size; ++ii) {
            row.set(ColumnKey.name(names.get(ii)), ColumnValue.raw(values.get(ii)));
        }
        return row;
    }

    /**
     * @return An independent copy of this row.
     */
    public Row copy() {
        return new Row(new LinkedHashMap<>(cells));
    }

    /**
     * @param key The column
     * @return The value stored under {@code key}.
     * @throws NoSuchElementException if the row has no such column
     */
    public ColumnValue get(final ColumnKey key) {
        final ColumnValue value = cells.get(key);
        if (value == null) {
            throw new NoSuchElementException(String.format("Column '%s' not found in row", key));
        }
        return value;
    }

    /**
     * @param key The column
     * @return The value stored under {@code key}, or null if the row has no such column.
     */
    @Nullable
    public ColumnValue find(final ColumnKey key) {
        return cells.get(key);
    }

    public boolean containsKey(final ColumnKey key) {
        return cells.containsKey(key);
    }

    /**
     * Store {@code value} under {@code key}. An existing key keeps its position; a new key is appended.
     *
     * @param key The column
     * @param value The value
     * @return self
     */
    public Row set(@NotNull final ColumnKey key, @NotNull final ColumnValue value) {
        cells.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        return this;
    }

    /**
     * Replace {@code oldKey} by {@code newKey} at the same position, keeping its value. If {@code newKey} is already
     * present elsewhere in the row, that other entry is dropped.
     *
     * @param oldKey The column to rename
     * @param newKey The new column key
     * @return self
     * @throws NoSuchElementException if the row has no column {@code oldKey}
     */
    public Row rename(final ColumnKey oldKey, final ColumnKey newKey) {
        if (!cells.containsKey(oldKey)) {
            throw new NoSuchElementException(String.format("Column '%s' not found in row", oldKey));
        }
        if (oldKey.equals(newKey)) {
            return this;
        }
        final LinkedHashMap<ColumnKey, ColumnValue> renamed = new LinkedHashMap<>();
        for (final Map.Entry<ColumnKey, ColumnValue> entry : cells.entrySet()) {
            final ColumnKey key = entry.getKey();
            if (key.equals(oldKey)) {
                renamed.put(newKey, entry.getValue());
            } else if (!key.equals(newKey)) {
                renamed.put(key, entry.getValue());
            }
        }
        cells.clear();
        cells.putAll(renamed);
        return this;
    }

    /**
     * @param key The column to delete
     * @return The value that was stored under {@code key}.
     * @throws NoSuchElementException if the row has no such column
     */
    public ColumnValue remove(final ColumnKey key) {
        final ColumnValue value = cells.remove(key);
        if (value == null) {
            throw new NoSuchElementException(String.format("Column '%s' not found in row", key));
        }
        return value;
    }

    /**
     * @return The keys, in column order. The view is read-only.
     */
    public Set<ColumnKey> keys() {
        return Collections.unmodifiableSet(cells.keySet());
    }

    /**
     * @return A snapshot of the values, in column order.
     */
    public List<ColumnValue> values() {
        return new ArrayList<>(cells.values());
    }

    /**
     * @return The entries, in column order. The view is read-only.
     */
    public Set<Map.Entry<ColumnKey, ColumnValue>> entries() {
        return Collections.unmodifiableMap(cells).entrySet();
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Row)) {
            return false;
        }
        // Column order is part of a row's identity.
        return new ArrayList<>(cells.entrySet()).equals(new ArrayList<>(((Row) o).cells.entrySet()));
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}

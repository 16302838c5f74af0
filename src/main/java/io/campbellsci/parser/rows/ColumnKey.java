package io.campbellsci.parser.rows;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Identifies a column within a {@link Row}: either a textual header name or a zero-based positional index. A name and
 * an index never compare equal, even when the name spells the index ({@code "0"} is not {@code 0}).
 */
public final class ColumnKey {
    /** The two flavors of column key. */
    public enum Kind {
        NAME, INDEX
    }

    private final Kind kind;
    private final String name;
    private final int index;

    private ColumnKey(final Kind kind, final String name, final int index) {
        this.kind = kind;
        this.name = name;
        this.index = index;
    }

    /**
     * @param name The column header
     * @return A key for the named column.
     */
    public static ColumnKey name(@NotNull final String name) {
        return new ColumnKey(Kind.NAME, Objects.requireNonNull(name, "name"), -1);
    }

    /**
     * @param index The zero-based column position
     * @return A key for the column at {@code index}.
     */
    public static ColumnKey index(final int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Column index must be nonnegative, got " + index);
        }
        return new ColumnKey(Kind.INDEX, null, index);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isName() {
        return kind == Kind.NAME;
    }

    public boolean isIndex() {
        return kind == Kind.INDEX;
    }

    /**
     * @return The header name.
     * @throws IllegalStateException if this is an index key
     */
    public String name() {
        if (kind != Kind.NAME) {
            throw new IllegalStateException("Column key " + this + " is an index, not a name");
        }
        return name;
    }

    /**
     * @return The column position.
     * @throws IllegalStateException if this is a name key
     */
    public int index() {
        if (kind != Kind.INDEX) {
            throw new IllegalStateException("Column key '" + this + "' is a name, not an index");
        }
        return index;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnKey)) {
            return false;
        }
        final ColumnKey other = (ColumnKey) o;
        return kind == other.kind && index == other.index && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return kind == Kind.NAME ? name.hashCode() : Integer.hashCode(index);
    }

    /**
     * @return The name, or the decimal index. This is the form used for exported headers.
     */
    @Override
    public String toString() {
        return kind == Kind.NAME ? name : Integer.toString(index);
    }
}

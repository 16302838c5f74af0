package io.campbellsci.parser;

import io.campbellsci.parser.annotations.BuildableStyle;
import io.campbellsci.parser.rows.ColumnKey;
import org.immutables.value.Value.Default;
import org.immutables.value.Value.Immutable;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Options for a time conversion. Names the columns holding the time values and where the resulting timestamp goes.
 */
@Immutable
@BuildableStyle
public abstract class ConversionSpecs {
    /**
     * The Builder for the ConversionSpecs class.
     */
    public interface Builder {
        /**
         * Copy all the parameters from {@code specs} into {@code this} builder.
         *
         * @param specs The source object
         * @return self after copying over all the properties.
         */
        Builder from(ConversionSpecs specs);

        /**
         * Add a time column. The time values are taken in the order the columns appear in the row, not in the order
         * given here. The first column given determines where the timestamp is stored, unless
         * {@link #replaceTimeColumn} is set.
         *
         * @param element The time column
         * @return self after modifying the timeColumns property.
         */
        Builder addTimeColumns(ColumnKey element);

        /**
         * Add several time columns. See {@link #addTimeColumns(ColumnKey)}.
         *
         * @param elements The time columns
         * @return self after modifying the timeColumns property.
         */
        Builder addTimeColumns(ColumnKey... elements);

        /**
         * The key under which the timestamp is stored. If unset, the key of the column it replaces is kept.
         *
         * @param timeParsedColumn The output column key
         * @return self after modifying the timeParsedColumn property.
         */
        Builder timeParsedColumn(@Nullable ColumnKey timeParsedColumn);

        /**
         * The column whose position receives the timestamp. If unset, the first time column is used.
         *
         * @param replaceTimeColumn The column to replace
         * @return self after modifying the replaceTimeColumn property.
         */
        Builder replaceTimeColumn(@Nullable ColumnKey replaceTimeColumn);

        /**
         * Whether to shift the timestamp to UTC.
         *
         * @param toUtc The flag
         * @return self after modifying the toUtc property.
         */
        Builder toUtc(boolean toUtc);

        /**
         * Whether a time string that does not match its format yields the UNIX epoch instead of failing.
         *
         * @param ignoreParsingError The flag
         * @return self after modifying the ignoreParsingError property.
         */
        Builder ignoreParsingError(boolean ignoreParsingError);

        /**
         * Build the ConversionSpecs object.
         *
         * @return the ConversionSpecs object.
         */
        ConversionSpecs build();
    }

    /**
     * Creates a builder for {@link ConversionSpecs}.
     *
     * @return the builder
     */
    public static Builder builder() {
        return ImmutableConversionSpecs.builder();
    }

    /**
     * Convert the given time columns, storing the timestamp under the first of them.
     *
     * @param timeColumns The time columns
     * @return The ConversionSpecs.
     */
    public static ConversionSpecs of(final ColumnKey... timeColumns) {
        return builder().addTimeColumns(timeColumns).build();
    }

    /**
     * See {@link Builder#addTimeColumns(ColumnKey)}. An empty list is accepted here and rejected by the conversion.
     *
     * @return The time columns.
     */
    public abstract List<ColumnKey> timeColumns();

    /**
     * See {@link Builder#timeParsedColumn}.
     *
     * @return The output column key, or null.
     */
    @Nullable
    public abstract ColumnKey timeParsedColumn();

    /**
     * See {@link Builder#replaceTimeColumn}.
     *
     * @return The column to replace, or null.
     */
    @Nullable
    public abstract ColumnKey replaceTimeColumn();

    /**
     * See {@link Builder#toUtc}.
     *
     * @return Whether to shift to UTC.
     */
    @Default
    public boolean toUtc() {
        return false;
    }

    /**
     * See {@link Builder#ignoreParsingError}.
     *
     * @return Whether to substitute the epoch for unparseable values.
     */
    @Default
    public boolean ignoreParsingError() {
        return false;
    }
}

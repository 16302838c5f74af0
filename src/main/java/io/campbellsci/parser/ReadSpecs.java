package io.campbellsci.parser;

import io.campbellsci.parser.annotations.BuildableStyle;
import io.campbellsci.parser.util.Renderer;
import org.immutables.value.Value.Check;
import org.immutables.value.Value.Default;
import org.immutables.value.Value.Immutable;

import java.util.ArrayList;
import java.util.List;

/**
 * Options for reading datalogger files.
 */
@Immutable
@BuildableStyle
public abstract class ReadSpecs {
    /** Value of {@link #headerRow()} meaning the file has no header line. */
    public static final int NO_HEADER_ROW = -1;

    /**
     * The Builder for the ReadSpecs class.
     */
    public interface Builder {
        /**
         * Copy all the parameters from {@code specs} into {@code this} builder.
         *
         * @param specs The source object
         * @return self after copying over all the properties.
         */
        Builder from(ReadSpecs specs);

        /**
         * Column names to key the rows with. Cannot be combined with {@link #headerRow}. If neither is set, rows are
         * keyed by zero-based column index.
         *
         * @param elements The column names
         * @return self after modifying the header property.
         */
        Builder header(Iterable<String> elements);

        /**
         * The zero-based line holding the column names. Lines before it are skipped; data starts on the next line.
         *
         * @param headerRow The header line, or {@link #NO_HEADER_ROW}
         * @return self after modifying the headerRow property.
         */
        Builder headerRow(int headerRow);

        /**
         * The first zero-based line to keep. Line numbers count every line of the file, header included.
         *
         * @param firstLineNum The first line
         * @return self after modifying the firstLineNum property.
         */
        Builder firstLineNum(long firstLineNum);

        /**
         * The last zero-based line to keep, inclusive.
         *
         * @param lastLineNum The last line
         * @return self after modifying the lastLineNum property.
         */
        Builder lastLineNum(long lastLineNum);

        /**
         * Whether to add the leading zero that some loggers drop from fractional values ({@code .5} becomes
         * {@code 0.5}, {@code -.5} becomes {@code -0.5}).
         *
         * @param fixFloats The flag
         * @return self after modifying the fixFloats property.
         */
        Builder fixFloats(boolean fixFloats);

        /**
         * The field delimiter character. Must be 7-bit ASCII.
         *
         * @param delimiter The delimiter character
         * @return self after modifying the delimiter property.
         */
        Builder delimiter(char delimiter);

        /**
         * The quote character. Must be 7-bit ASCII.
         *
         * @param quote The quote character
         * @return self after modifying the quote property.
         */
        Builder quote(char quote);

        /**
         * Build the ReadSpecs object.
         *
         * @return the ReadSpecs object.
         */
        ReadSpecs build();
    }

    /**
     * Creates a builder for {@link ReadSpecs}.
     *
     * @return the builder
     */
    public static Builder builder() {
        return ImmutableReadSpecs.builder();
    }

    /**
     * Table data: every line kept, index-keyed, values as written.
     *
     * @return The ReadSpecs for the specified format.
     */
    public static ReadSpecs table() {
        return builder().build();
    }

    /**
     * Mixed-array data: every line kept, index-keyed, fractional values repaired. Equivalent to
     * {@code builder().fixFloats(true).build()}.
     *
     * @return The ReadSpecs for the specified format.
     */
    public static ReadSpecs mixedArray() {
        return builder().fixFloats(true).build();
    }

    /**
     * Validates the {@link ReadSpecs}.
     */
    @Check
    void check() {
        // Report all the problems at once.
        final List<String> problems = new ArrayList<>();
        check7BitAscii("quote", quote(), problems);
        check7BitAscii("delimiter", delimiter(), problems);
        checkNonnegative("firstLineNum", firstLineNum(), problems);
        checkNonnegative("lastLineNum", lastLineNum(), problems);
        if (headerRow() < NO_HEADER_ROW) {
            problems.add(String.format("headerRow is set to %d, but is required to be nonnegative or %d",
                    headerRow(), NO_HEADER_ROW));
        }
        if (lastLineNum() < firstLineNum()) {
            problems.add(String.format("lastLineNum (%d) is less than firstLineNum (%d)",
                    lastLineNum(), firstLineNum()));
        }
        if (!header().isEmpty() && headerRow() != NO_HEADER_ROW) {
            problems.add("header and headerRow cannot both be set");
        }
        if (quote() == delimiter()) {
            problems.add("quote and delimiter cannot be the same character");
        }
        if (problems.isEmpty()) {
            return;
        }
        final String message = "ReadSpecs failed validation for the following reasons: " + Renderer.renderList(problems);
        throw new RuntimeException(message);
    }

    /**
     * See {@link Builder#header}.
     *
     * @return The column names.
     */
    public abstract List<String> header();

    /**
     * See {@link Builder#headerRow}.
     *
     * @return The header line, or {@link #NO_HEADER_ROW}.
     */
    @Default
    public int headerRow() {
        return NO_HEADER_ROW;
    }

    /**
     * See {@link Builder#firstLineNum}.
     *
     * @return The first line to keep.
     */
    @Default
    public long firstLineNum() {
        return 0;
    }

    /**
     * See {@link Builder#lastLineNum}.
     *
     * @return The last line to keep.
     */
    @Default
    public long lastLineNum() {
        return Long.MAX_VALUE;
    }

    /**
     * See {@link Builder#fixFloats}.
     *
     * @return Whether to repair fractional values.
     */
    @Default
    public boolean fixFloats() {
        return false;
    }

    /**
     * See {@link Builder#delimiter}.
     *
     * @return The field delimiter character.
     */
    @Default
    public char delimiter() {
        return ',';
    }

    /**
     * See {@link Builder#quote}.
     *
     * @return The quote character.
     */
    @Default
    public char quote() {
        return '"';
    }

    private static void check7BitAscii(String what, char c, List<String> problems) {
        if (c > 0x7f) {
            final String message = String.format("%s is set to '%c' but is required to be 7-bit ASCII",
                    what, c);
            problems.add(message);
        }
    }

    private static void checkNonnegative(String what, long value, List<String> problems) {
        if (value < 0) {
            final String message = String.format("%s is set to %d, but is required to be nonnegative",
                    what, value);
            problems.add(message);
        }
    }
}

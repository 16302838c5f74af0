package io.campbellsci.parser;

import io.campbellsci.parser.annotations.BuildableStyle;
import org.immutables.value.Value.Default;
import org.immutables.value.Value.Immutable;

/**
 * Options for exporting rows to a delimited file.
 */
@Immutable
@BuildableStyle
public abstract class ExportSpecs {
    /**
     * The Builder for the ExportSpecs class.
     */
    public interface Builder {
        /**
         * Copy all the parameters from {@code specs} into {@code this} builder.
         *
         * @param specs The source object
         * @return self after copying over all the properties.
         */
        Builder from(ExportSpecs specs);

        /**
         * Whether to write the column keys as a header line. The header is only written when the target file is
         * missing or blank, so appending to an existing export does not repeat it.
         *
         * @param exportHeader The flag
         * @return self after modifying the exportHeader property.
         */
        Builder exportHeader(boolean exportHeader);

        /**
         * Whether to append to the target file. If false the file is truncated first.
         *
         * @param append The flag
         * @return self after modifying the append property.
         */
        Builder append(boolean append);

        /**
         * Whether timestamps are written with their UTC offset ({@code +HHMM}).
         *
         * @param includeTimeZone The flag
         * @return self after modifying the includeTimeZone property.
         */
        Builder includeTimeZone(boolean includeTimeZone);

        /**
         * The field delimiter.
         *
         * @param delimiter The delimiter
         * @return self after modifying the delimiter property.
         */
        Builder delimiter(String delimiter);

        /**
         * Build the ExportSpecs object.
         *
         * @return the ExportSpecs object.
         */
        ExportSpecs build();
    }

    /**
     * Creates a builder for {@link ExportSpecs}.
     *
     * @return the builder
     */
    public static Builder builder() {
        return ImmutableExportSpecs.builder();
    }

    /**
     * Append without a header, timestamps without offset.
     *
     * @return The default ExportSpecs.
     */
    public static ExportSpecs defaults() {
        return builder().build();
    }

    @Default
    public boolean exportHeader() {
        return false;
    }

    @Default
    public boolean append() {
        return true;
    }

    @Default
    public boolean includeTimeZone() {
        return false;
    }

    @Default
    public String delimiter() {
        return ",";
    }
}

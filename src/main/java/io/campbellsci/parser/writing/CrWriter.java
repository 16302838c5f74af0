package io.campbellsci.parser.writing;

import io.campbellsci.parser.ExportSpecs;
import io.campbellsci.parser.rows.ColumnKey;
import io.campbellsci.parser.rows.ColumnValue;
import io.campbellsci.parser.rows.DataSet;
import io.campbellsci.parser.rows.Row;
import io.campbellsci.parser.util.CrParserException;
import io.campbellsci.parser.util.Renderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.format.DateTimeFormatter;

/**
 * Writes {@link DataSet}s as delimited text, one line per row. Values are written verbatim, without quoting; timestamps
 * are written as {@code yyyy-MM-dd HH:mm:ss}, optionally followed by their offset ({@code +0100}).
 */
public class CrWriter {
    private static final Logger LOG = LoggerFactory.getLogger(CrWriter.class);

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");
    public static final DateTimeFormatter TIMESTAMP_WITH_OFFSET_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ssxx");

    /**
     * Export {@code data} to {@code path}, creating parent directories as needed. The header, if requested, is taken
     * from the keys of the first row and is skipped when the file already has content.
     *
     * @param data The rows to write
     * @param path The output file
     * @param specs The export options
     * @throws CrParserException If the file cannot be written
     */
    public static void exportToCsv(final DataSet data, final Path path, final ExportSpecs specs)
            throws CrParserException {
        try {
            final Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            boolean writeHeader = specs.exportHeader() && (!specs.append() || isBlank(path));
            final OpenOption[] options = specs.append()
                    ? new OpenOption[] {StandardOpenOption.CREATE, StandardOpenOption.APPEND}
                    : new OpenOption[] {StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                            StandardOpenOption.WRITE};
            try (final Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8, options)) {
                for (final Row row : data) {
                    if (writeHeader) {
                        writer.write(Renderer.renderList(row.keys(), specs.delimiter(), ColumnKey::toString));
                        writer.write('\n');
                        writeHeader = false;
                    }
                    writer.write(Renderer.renderList(row.values(), specs.delimiter(),
                            value -> toText(value, specs.includeTimeZone())));
                    writer.write('\n');
                }
            }
            LOG.debug("Exported {} rows to {}", data.size(), path);
        } catch (IOException e) {
            throw new CrParserException("Caught exception writing " + path, e);
        }
    }

    /**
     * @param value The value
     * @param includeTimeZone Whether a timestamp gets its offset
     * @return The exported text of {@code value}.
     */
    public static String toText(final ColumnValue value, final boolean includeTimeZone) {
        if (value.isRaw()) {
            return value.asRaw();
        }
        return (includeTimeZone ? TIMESTAMP_WITH_OFFSET_FORMAT : TIMESTAMP_FORMAT).format(value.asTimestamp());
    }

    private static boolean isBlank(final Path path) throws IOException {
        if (!Files.exists(path)) {
            return true;
        }
        try (final BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.trim().isEmpty()) {
                    return false;
                }
            }
        }
        return true;
    }

    private CrWriter() {}
}

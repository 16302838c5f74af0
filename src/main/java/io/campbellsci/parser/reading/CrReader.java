package io.campbellsci.parser.reading;

import io.campbellsci.parser.ConversionSpecs;
import io.campbellsci.parser.ReadSpecs;
import io.campbellsci.parser.conversion.TimeConverter;
import io.campbellsci.parser.reading.cells.CellGrabber;
import io.campbellsci.parser.reading.cells.DelimitedCellGrabber;
import io.campbellsci.parser.rows.DataSet;
import io.campbellsci.parser.rows.Row;
import io.campbellsci.parser.util.CrParserException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads datalogger output files into {@link DataSet}s.
 *
 * <p>
 * Two layouts are supported. <em>Table data</em> has the same columns on every line and may have a header line.
 * <em>Mixed-array data</em>, written by CR10-family loggers, interleaves several record types ("arrays") whose first
 * column is the array id; its rows have varying lengths and are keyed by column index.
 *
 * <p>
 * Line numbers in {@link ReadSpecs} are zero-based and count every line of the file, header included.
 */
public class CrReader {
    private static final Logger LOG = LoggerFactory.getLogger(CrReader.class);

    /**
     * Read table data. Rows are keyed by {@link ReadSpecs#header()}, by the names on line
     * {@link ReadSpecs#headerRow()}, or by column index if neither is set. When a row and the header differ in length,
     * the surplus of the longer one is dropped.
     *
     * @param path The input file, UTF-8 encoded
     * @param specs The read options
     * @return The rows in file order.
     * @throws CrParserException If the file cannot be read or is malformed
     */
    public static DataSet readTableData(final Path path, final ReadSpecs specs) throws CrParserException {
        try (final Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            final DataSet data = readTableData(reader, specs);
            LOG.debug("Read {} rows of table data from {}", data.size(), path);
            return data;
        } catch (IOException e) {
            throw new CrParserException("Caught exception reading " + path, e);
        }
    }

    /**
     * Read table data, then convert its time columns.
     *
     * @param path The input file, UTF-8 encoded
     * @param specs The read options
     * @param timeConverter The converter for the logger that wrote the file
     * @param conversionSpecs The time columns to convert
     * @return The converted rows in file order.
     * @throws CrParserException If the file cannot be read, is malformed, or a row cannot be converted
     */
    public static DataSet readTableData(final Path path, final ReadSpecs specs, final TimeConverter timeConverter,
            final ConversionSpecs conversionSpecs) throws CrParserException {
        return timeConverter.convert(readTableData(path, specs), conversionSpecs);
    }

    /**
     * See {@link #readTableData(Path, ReadSpecs)}.
     *
     * @param reader The input
     * @param specs The read options
     * @return The rows in input order.
     * @throws CrParserException If the input cannot be read or is malformed
     */
    public static DataSet readTableData(final Reader reader, final ReadSpecs specs) throws CrParserException {
        final CellGrabber grabber = new DelimitedCellGrabber(reader, specs.quote(), specs.delimiter());
        final StringBuilder scratch = new StringBuilder();
        long lineNum = 0;

        List<String> header = specs.header();
        if (specs.headerRow() != ReadSpecs.NO_HEADER_ROW) {
            List<String> headerCells = null;
            while (lineNum <= specs.headerRow()) {
                headerCells = ReaderUtil.grabRow(grabber, scratch);
                if (headerCells == null) {
                    throw new CrParserException(String.format(
                            "Header row %d not found: input has only %d lines", specs.headerRow(), lineNum));
                }
                ++lineNum;
            }
            header = headerCells;
        }

        final DataSet data = new DataSet();
        List<String> cells;
        while ((cells = ReaderUtil.grabRow(grabber, scratch)) != null) {
            final long currentLine = lineNum++;
            if (currentLine < specs.firstLineNum()) {
                continue;
            }
            if (currentLine > specs.lastLineNum()) {
                break;
            }
            cells = fixFloats(cells, specs);
            data.add(header.isEmpty() ? Row.ofIndexed(cells) : Row.ofNamed(header, cells));
        }
        return data;
    }

    /**
     * Read mixed-array data. Rows are keyed by column index; {@link ReadSpecs#header()} and
     * {@link ReadSpecs#headerRow()} do not apply.
     *
     * @param path The input file, UTF-8 encoded
     * @param specs The read options, typically {@link ReadSpecs#mixedArray()}
     * @return The rows in file order.
     * @throws CrParserException If the file cannot be read or is malformed
     */
    public static DataSet readMixedArrayData(final Path path, final ReadSpecs specs) throws CrParserException {
        try (final Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            final DataSet data = readMixedArrayData(reader, specs);
            LOG.debug("Read {} rows of mixed-array data from {}", data.size(), path);
            return data;
        } catch (IOException e) {
            throw new CrParserException("Caught exception reading " + path, e);
        }
    }

    /**
     * See {@link #readMixedArrayData(Path, ReadSpecs)}.
     *
     * @param reader The input
     * @param specs The read options
     * @return The rows in input order.
     * @throws CrParserException If the input cannot be read or is malformed
     */
    public static DataSet readMixedArrayData(final Reader reader, final ReadSpecs specs) throws CrParserException {
        final ReadSpecs indexed = ReadSpecs.builder()
                .from(specs)
                .header(new ArrayList<>())
                .headerRow(ReadSpecs.NO_HEADER_ROW)
                .build();
        return readTableData(reader, indexed);
    }

    private static List<String> fixFloats(final List<String> cells, final ReadSpecs specs) {
        if (!specs.fixFloats()) {
            return cells;
        }
        final List<String> fixed = new ArrayList<>(cells.size());
        for (final String cell : cells) {
            fixed.add(ReaderUtil.fixFloat(cell));
        }
        return fixed;
    }

    private CrReader() {}
}

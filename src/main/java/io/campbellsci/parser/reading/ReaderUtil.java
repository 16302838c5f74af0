package io.campbellsci.parser.reading;

import io.campbellsci.parser.reading.cells.CellGrabber;
import io.campbellsci.parser.util.CrParserException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ReaderUtil {
    /**
     * Add the leading zero that older CR-type loggers drop from fractional values: {@code .5} becomes {@code 0.5} and
     * {@code -.5} becomes {@code -0.5}. Other values are returned unchanged.
     *
     * @param value The raw value
     * @return The repaired value.
     */
    public static String fixFloat(final String value) {
        if (value.startsWith(".")) {
            return "0" + value;
        }
        if (value.startsWith("-.")) {
            return "-0" + value.substring(1);
        }
        return value;
    }

    /**
     * Grab the cells of the next line.
     *
     * @param grabber The source of cells
     * @param scratch A reusable buffer
     * @return The cells, an empty list for a blank line, or null at the end of the input.
     * @throws CrParserException If the input is malformed or cannot be read
     */
    @Nullable
    public static List<String> grabRow(final CellGrabber grabber, final StringBuilder scratch)
            throws CrParserException {
        if (!grabber.hasMore()) {
            return null;
        }
        final List<String> cells = new ArrayList<>();
        CellGrabber.CellEnd end;
        do {
            end = grabber.grabNext(scratch);
            cells.add(scratch.toString());
        } while (end == CellGrabber.CellEnd.FIELD);
        if (cells.size() == 1 && cells.get(0).isEmpty()) {
            return Collections.emptyList();
        }
        return cells;
    }

    private ReaderUtil() {}
}

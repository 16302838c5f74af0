package io.campbellsci.parser.reading.cells;

import io.campbellsci.parser.util.CrParserException;

/**
 * This class is used to traverse over text from a Reader, understanding both field and line delimiters, as well as the
 * CSV quoting convention, and breaking the text into cells for use by the calling code.
 */
public interface CellGrabber {
    /** What terminated the cell just grabbed. */
    enum CellEnd {
        /** A field delimiter; more cells follow in the same row. */
        FIELD,
        /** A line delimiter (LF, CR or CRLF). */
        ROW,
        /** The end of the input. */
        INPUT
    }

    /**
     * Try to grab the next cell from the input, being aware of field delimiters, line delimiters and quoting.
     *
     * @param dest Receives the cell's text, with quoting removed. Cleared first.
     * @return What terminated the cell.
     * @throws CrParserException If the cell is malformed or the input cannot be read
     */
    CellEnd grabNext(StringBuilder dest) throws CrParserException;

    /**
     * @return true if there is unread input.
     * @throws CrParserException If the input cannot be read
     */
    boolean hasMore() throws CrParserException;

    /**
     * Returns the "physical" row number, that is the row number of the input file. This differs from the "logical" row
     * number when, due to quotation marks, a single CSV row spans multiple lines of input.
     *
     * @return the "physical" row number
     */
    int physicalRowNum();
}

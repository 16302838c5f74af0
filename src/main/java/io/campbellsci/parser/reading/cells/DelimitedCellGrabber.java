package io.campbellsci.parser.reading.cells;

import io.campbellsci.parser.util.CrParserException;

import java.io.IOException;
import java.io.Reader;

/**
 * Splits character input into cells. A cell that starts with the quote character runs until the matching closing
 * quote, may contain delimiters and line breaks, and represents a literal quote by a doubled one. Anything between a
 * closing quote and the next delimiter is kept as part of the cell.
 */
public final class DelimitedCellGrabber implements CellGrabber {
    /** Size of chunks to read from the {@link Reader}. */
    public static final int BUFFER_SIZE = 65536;
    /** The input. */
    private final Reader reader;
    /** The configured quote character (typically '"'). */
    private final char quoteChar;
    /** The configured field delimiter (typically ','). */
    private final char fieldDelimiter;
    /** The current chunk we have read from the input. */
    private final char[] buffer;
    /** Size of the last chunk read. */
    private int size;
    /** Current offset in the chunk. */
    private int offset;
    /** Zero-based line number of the input, for error messages. */
    private int physicalRowNum;

    /**
     * Constructor.
     *
     * @param reader The input.
     * @param quoteChar The configured quote char. Typically "
     * @param fieldDelimiter The configured field delimiter. Typically ,
     */
    public DelimitedCellGrabber(final Reader reader, final char quoteChar, final char fieldDelimiter) {
        this.reader = reader;
        this.quoteChar = quoteChar;
        this.fieldDelimiter = fieldDelimiter;
        this.buffer = new char[BUFFER_SIZE];
        this.size = 0;
        this.offset = 0;
        this.physicalRowNum = 0;
    }

    @Override
    public CellEnd grabNext(final StringBuilder dest) throws CrParserException {
        dest.setLength(0);
        if (tryEnsureMore() && buffer[offset] == quoteChar) {
            ++offset;
            processQuotedMode(dest);
        }
        return finishField(dest);
    }

    @Override
    public boolean hasMore() throws CrParserException {
        return tryEnsureMore();
    }

    @Override
    public int physicalRowNum() {
        return physicalRowNum;
    }

    /**
     * Consume characters up to and including the closing quote, turning each doubled quote into a single one.
     */
    private void processQuotedMode(final StringBuilder dest) throws CrParserException {
        boolean prevCharWasCarriageReturn = false;
        outer: while (true) {
            if (!tryEnsureMore()) {
                throw new CrParserException(
                        String.format("Cell starting before line %d did not have closing quote character",
                                physicalRowNum));
            }

            // Advance through buffer while the characters are not special.
            final int start = offset;
            char ch = buffer[offset];
            while (ch != quoteChar && ch != '\n' && ch != '\r') {
                ++offset;
                if (offset == size) {
                    dest.append(buffer, start, offset - start);
                    continue outer;
                }
                ch = buffer[offset];
            }
            dest.append(buffer, start, offset - start);
            ++offset;

            if (ch == '\r') {
                ++physicalRowNum;
                prevCharWasCarriageReturn = true;
                dest.append(ch);
                continue;
            }
            if (ch == '\n') {
                if (!prevCharWasCarriageReturn) {
                    ++physicalRowNum;
                }
                prevCharWasCarriageReturn = false;
                dest.append(ch);
                continue;
            }
            prevCharWasCarriageReturn = false;

            // A quote char: either the closing quote, or the first half of an escaped quote ("").
            if (tryEnsureMore() && buffer[offset] == quoteChar) {
                dest.append(quoteChar);
                ++offset;
                continue;
            }
            return;
        }
    }

    /**
     * Eat characters until the next field or line delimiter, or the end of input.
     */
    private CellEnd finishField(final StringBuilder dest) throws CrParserException {
        outer: while (true) {
            if (!tryEnsureMore()) {
                return CellEnd.INPUT;
            }

            final int start = offset;
            char ch = buffer[offset];
            while (ch != fieldDelimiter && ch != '\n' && ch != '\r') {
                ++offset;
                if (offset == size) {
                    dest.append(buffer, start, offset - start);
                    continue outer;
                }
                ch = buffer[offset];
            }
            dest.append(buffer, start, offset - start);
            ++offset;

            if (ch == fieldDelimiter) {
                return CellEnd.FIELD;
            }
            if (ch == '\r' && tryEnsureMore() && buffer[offset] == '\n') {
                ++offset;
            }
            ++physicalRowNum;
            return CellEnd.ROW;
        }
    }

    /** @return true if there are more characters. */
    private boolean tryEnsureMore() throws CrParserException {
        if (offset != size) {
            return true;
        }
        refillBuffer();
        return size != 0;
    }

    /** Get another chunk of data from the Reader. */
    private void refillBuffer() throws CrParserException {
        offset = 0;
        try {
            final int charsRead = reader.read(buffer, 0, buffer.length);
            size = Math.max(charsRead, 0);
        } catch (IOException ioe) {
            throw new CrParserException("Exception thrown while reading input", ioe);
        }
    }
}

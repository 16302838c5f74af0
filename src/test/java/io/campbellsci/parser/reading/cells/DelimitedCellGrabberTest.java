package io.campbellsci.parser.reading.cells;

import io.campbellsci.parser.reading.cells.CellGrabber.CellEnd;
import io.campbellsci.parser.util.CrParserException;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;

public class DelimitedCellGrabberTest {
    private static DelimitedCellGrabber grabber(final String input) {
        return new DelimitedCellGrabber(new StringReader(input), '"', ',');
    }

    @Test
    public void reportsCellEnds() throws CrParserException {
        final DelimitedCellGrabber grabber = grabber("a,b\r\nc");
        final StringBuilder sb = new StringBuilder();

        assertThat(grabber.grabNext(sb)).isEqualTo(CellEnd.FIELD);
        assertThat(sb.toString()).isEqualTo("a");
        assertThat(grabber.grabNext(sb)).isEqualTo(CellEnd.ROW);
        assertThat(sb.toString()).isEqualTo("b");
        assertThat(grabber.physicalRowNum()).isEqualTo(1);
        assertThat(grabber.grabNext(sb)).isEqualTo(CellEnd.INPUT);
        assertThat(sb.toString()).isEqualTo("c");
        assertThat(grabber.hasMore()).isFalse();
    }

    @Test
    public void keepsTextAfterClosingQuote() throws CrParserException {
        final DelimitedCellGrabber grabber = grabber("\"12\"34,5\n");
        final StringBuilder sb = new StringBuilder();
        assertThat(grabber.grabNext(sb)).isEqualTo(CellEnd.FIELD);
        assertThat(sb.toString()).isEqualTo("1234");
    }

    @Test
    public void cellsMaySpanBufferBoundaries() throws CrParserException {
        final StringBuilder big = new StringBuilder();
        for (int ii = 0; ii < DelimitedCellGrabber.BUFFER_SIZE + 10; ++ii) {
            big.append((char) ('a' + ii % 26));
        }
        final DelimitedCellGrabber grabber = grabber("\"" + big + "\"," + big + "\n");
        final StringBuilder sb = new StringBuilder();
        assertThat(grabber.grabNext(sb)).isEqualTo(CellEnd.FIELD);
        assertThat(sb.toString()).isEqualTo(big.toString());
        assertThat(grabber.grabNext(sb)).isEqualTo(CellEnd.ROW);
        assertThat(sb.toString()).isEqualTo(big.toString());
    }

    @Test
    public void unclosedQuote() {
        final DelimitedCellGrabber grabber = grabber("x\n\"abc");
        Assertions.assertThatThrownBy(() -> {
            grabber.grabNext(new StringBuilder());
            grabber.grabNext(new StringBuilder());
        }).isInstanceOf(CrParserException.class)
                .hasMessage("Cell starting before line 1 did not have closing quote character");
    }
}

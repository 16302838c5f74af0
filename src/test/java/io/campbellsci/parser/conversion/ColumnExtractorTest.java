package io.campbellsci.parser.conversion;

import io.campbellsci.parser.rows.ColumnKey;
import io.campbellsci.parser.rows.ColumnValue;
import io.campbellsci.parser.rows.DataSet;
import io.campbellsci.parser.rows.Row;
import io.campbellsci.parser.util.TimeColumnNotFoundException;
import io.campbellsci.parser.util.TimeColumnValueException;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collections;

import static io.campbellsci.parser.testutil.CrTestUtil.index;
import static io.campbellsci.parser.testutil.CrTestUtil.name;
import static io.campbellsci.parser.testutil.CrTestUtil.namedRow;
import static org.assertj.core.api.Assertions.assertThat;

public class ColumnExtractorTest {
    @Test
    public void projectsColumnsInRowOrder() {
        final DataSet data = DataSet.of(namedRow("Id", "100", "Year", "2016", "Month", "1", "Value", "200"));
        assertThat(ColumnExtractor.extract(data, Collections.emptyList())).isEqualTo(data);
        assertThat(ColumnExtractor.extract(data, Arrays.asList(name("Value"), name("Year"))))
                .isEqualTo(DataSet.of(namedRow("Year", "2016", "Value", "200")));
    }

    @Test
    public void keepsRowsInsideInclusiveRange() throws TimeColumnValueException {
        final DataSet data = new DataSet();
        for (int month = 1; month <= 5; ++month) {
            data.add(new Row()
                    .set(index(1), ColumnValue.timestamp(utc(month, 18 + month - 1)))
                    .set(index(2), ColumnValue.raw(Integer.toString(190 + 10 * month))));
        }

        final DataSet fromMarch = ColumnExtractor.extract(data, Collections.singletonList(index(2)),
                new TimeRange(index(1), utc(3, 20), null));
        assertThat(fromMarch.size()).isEqualTo(3);
        assertThat(fromMarch.get(0).get(index(2)).asRaw()).isEqualTo("220");

        final DataSet between = ColumnExtractor.extract(data, Collections.<ColumnKey>emptyList(),
                new TimeRange(index(1), utc(2, 19), utc(4, 21)));
        assertThat(between.size()).isEqualTo(3);
        assertThat(between.get(0).keys()).containsExactly(index(1), index(2));

        assertThat(ColumnExtractor.extract(data, Collections.emptyList(), TimeRange.of(index(1))).size())
                .isEqualTo(5);
    }

    @Test
    public void rangeRequiresConvertedTimeColumn() {
        Assertions.assertThatThrownBy(() -> ColumnExtractor.extract(DataSet.of(namedRow("Id", "1")),
                Collections.emptyList(), TimeRange.of(name("Timestamp"))))
                .isInstanceOf(TimeColumnNotFoundException.class);
        Assertions.assertThatThrownBy(() -> ColumnExtractor.extract(DataSet.of(namedRow("Timestamp", "x")),
                Collections.emptyList(), TimeRange.of(name("Timestamp"))))
                .isInstanceOf(TimeColumnValueException.class);
    }

    private static ZonedDateTime utc(final int month, final int hour) {
        return ZonedDateTime.of(2016, month, 1, hour, 30, 15, 0, ZoneOffset.UTC);
    }
}

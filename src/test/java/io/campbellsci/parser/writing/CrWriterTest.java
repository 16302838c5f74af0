package io.campbellsci.parser.writing;

import io.campbellsci.parser.ExportSpecs;
import io.campbellsci.parser.ReadSpecs;
import io.campbellsci.parser.reading.CrReader;
import io.campbellsci.parser.rows.ColumnValue;
import io.campbellsci.parser.rows.DataSet;
import io.campbellsci.parser.rows.Row;
import io.campbellsci.parser.util.CrParserException;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static io.campbellsci.parser.testutil.CrTestUtil.name;
import static io.campbellsci.parser.testutil.CrTestUtil.namedRow;
import static org.assertj.core.api.Assertions.assertThat;

public class CrWriterTest {
    private static final ZonedDateTime TIMESTAMP = ZonedDateTime.of(2016, 5, 2, 12, 34, 15, 0, ZoneOffset.UTC);

    private static DataSet labelledData() {
        return DataSet.of(new Row()
                .set(name("Label_1"), ColumnValue.raw("some_value"))
                .set(name("Label_2"), ColumnValue.timestamp(TIMESTAMP))
                .set(name("Label_3"), ColumnValue.raw("some_other_value")));
    }

    @Test
    public void exportsAndReadsBack(@TempDir final Path dir) throws CrParserException {
        final Path file = dir.resolve("out.dat");
        CrWriter.exportToCsv(labelledData(), file, ExportSpecs.builder().exportHeader(true).build());

        final DataSet readBack = CrReader.readTableData(file, ReadSpecs.builder().headerRow(0).build());
        assertThat(readBack).isEqualTo(DataSet.of(
                namedRow("Label_1", "some_value", "Label_2", "2016-05-02 12:34:15", "Label_3", "some_other_value")));
    }

    @Test
    public void appendingDoesNotRepeatHeader(@TempDir final Path dir) throws CrParserException, IOException {
        final File file = dir.resolve("out.dat").toFile();
        final ExportSpecs withHeader = ExportSpecs.builder().exportHeader(true).build();
        CrWriter.exportToCsv(labelledData(), file.toPath(), withHeader);
        CrWriter.exportToCsv(labelledData(), file.toPath(),
                ExportSpecs.builder().from(withHeader).includeTimeZone(true).build());

        assertThat(FileUtils.readLines(file, StandardCharsets.UTF_8)).containsExactly(
                "Label_1,Label_2,Label_3",
                "some_value,2016-05-02 12:34:15,some_other_value",
                "some_value,2016-05-02 12:34:15+0000,some_other_value");
    }

    @Test
    public void overwriteTruncates(@TempDir final Path dir) throws CrParserException, IOException {
        final File file = dir.resolve("out.dat").toFile();
        FileUtils.writeStringToFile(file, "old,content\nmore,content\n", StandardCharsets.UTF_8);
        CrWriter.exportToCsv(labelledData(), file.toPath(),
                ExportSpecs.builder().append(false).exportHeader(true).build());
        assertThat(FileUtils.readLines(file, StandardCharsets.UTF_8)).hasSize(2);
    }

    @Test
    public void createsParentDirectories(@TempDir final Path dir) throws CrParserException {
        final Path file = dir.resolve("a").resolve("b").resolve("out.dat");
        CrWriter.exportToCsv(labelledData(), file, ExportSpecs.defaults());
        assertThat(file).exists();
    }

    @Test
    public void rendersTimestampsWithOffset() {
        final ColumnValue value = ColumnValue.timestamp(
                ZonedDateTime.of(2016, 1, 30, 22, 30, 0, 0, ZoneId.of("Etc/GMT-1")));
        assertThat(CrWriter.toText(value, false)).isEqualTo("2016-01-30 22:30:00");
        assertThat(CrWriter.toText(value, true)).isEqualTo("2016-01-30 22:30:00+0100");
        assertThat(CrWriter.toText(ColumnValue.raw("12.5"), true)).isEqualTo("12.5");
    }
}

package io.campbellsci.parser.time;

import io.campbellsci.parser.CrSpecs;
import io.campbellsci.parser.util.CrParserException;
import io.campbellsci.parser.util.TimeParsingException;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class TimeParserTest {
    private static final List<String> SPLIT_LIBRARY = Arrays.asList("%Y", "%m", "%d", "%H", "%M", "%S");
    private static final List<String> SPLIT_VALUES = Arrays.asList("2016", "1", "1", "22", "30", "15");

    @Test
    public void noValuesParseToDefaultDateTime() throws CrParserException {
        final TimeParser parser = TimeParser.of(CrSpecs.builder().timeFormatArgsLibrary(SPLIT_LIBRARY).build());
        final ZonedDateTime parsed = parser.parse(Collections.emptyList());
        assertThat(parsed.toLocalDateTime()).isEqualTo(LocalDateTime.of(1900, 1, 1, 0, 0));
        assertThat(parsed.getZone()).isEqualTo(ZoneId.of("UTC"));
    }

    @Test
    public void noLibraryIgnoresValues() throws CrParserException {
        final TimeParser parser = TimeParser.of(CrSpecs.generic());
        assertThat(parser.parse(SPLIT_VALUES).toLocalDateTime()).isEqualTo(TimeParser.DEFAULT_DATE_TIME);
    }

    @Test
    public void localizesToConfiguredZone() throws CrParserException {
        final TimeParser parser = splitParser("Etc/GMT-1");
        assertThat(parser.parse(SPLIT_VALUES).toOffsetDateTime())
                .isEqualTo(OffsetDateTime.parse("2016-01-01T22:30:15+01:00"));
    }

    @Test
    public void convertsToUtc() throws CrParserException {
        final ZonedDateTime parsed = splitParser("Etc/GMT-1").parse(SPLIT_VALUES, false, true);
        assertThat(parsed).isEqualTo(ZonedDateTime.of(2016, 1, 1, 21, 30, 15, 0, ZoneOffset.UTC));
        assertThat(parsed.withZoneSameInstant(ZoneOffset.UTC)).isEqualTo(parsed);
    }

    @Test
    public void keepsOffsetCarriedByValue() throws CrParserException {
        final TimeParser parser = TimeParser.of(CrSpecs.builder()
                .timeZone("Europe/Stockholm")
                .timeFormatArgsLibrary(Collections.singletonList("%Y-%m-%d %H:%M:%S%z"))
                .build());
        final ZonedDateTime parsed = parser.parse(Collections.singletonList("2016-01-01 22:30:15+0000"));
        assertThat(parsed.toOffsetDateTime()).isEqualTo(OffsetDateTime.parse("2016-01-01T22:30:15Z"));
        assertThat(parser.parse(Collections.singletonList("2016-01-01 22:30:15+02:00")).toOffsetDateTime())
                .isEqualTo(OffsetDateTime.parse("2016-01-01T22:30:15+02:00"));
    }

    @Test
    public void parsingErrorCarriesValueAndFormat() {
        final TimeParser parser = TimeParser.of(CrSpecs.builder()
                .timeFormatArgsLibrary(Arrays.asList("%Y", "%m", "%d"))
                .build());
        Assertions.assertThatThrownBy(() -> parser.parse(Arrays.asList("2016", "13", "45")))
                .isInstanceOf(TimeParsingException.class)
                .hasMessage("Could not parse time string 2016,13,45 using the format %Y,%m,%d")
                .satisfies(e -> {
                    assertThat(((TimeParsingException) e).timeValue()).isEqualTo("2016,13,45");
                    assertThat(((TimeParsingException) e).timeFormat()).isEqualTo("%Y,%m,%d");
                });
    }

    @Test
    public void ignoredParsingErrorYieldsEpochInConfiguredZone() throws CrParserException {
        final TimeParser parser = splitParser("Etc/GMT-1");
        final List<String> garbage = Arrays.asList("2016", "x", "1", "22", "30", "15");

        final ZonedDateTime local = parser.parse(garbage, true, false);
        assertThat(local.toInstant()).isEqualTo(Instant.EPOCH);
        assertThat(local.getZone()).isEqualTo(ZoneId.of("Etc/GMT-1"));

        final ZonedDateTime utc = parser.parse(garbage, true, true);
        assertThat(utc).isEqualTo(Instant.EPOCH.atZone(ZoneOffset.UTC));
    }

    @Test
    public void unsupportedDirectiveIsAParsingError() throws CrParserException {
        final TimeParser parser = TimeParser.of(CrSpecs.builder()
                .timeFormatArgsLibrary(Collections.singletonList("%Q"))
                .build());
        Assertions.assertThatThrownBy(() -> parser.parse(Collections.singletonList("1")))
                .isInstanceOf(TimeParsingException.class);
        assertThat(parser.parse(Collections.singletonList("1"), true, true).toInstant()).isEqualTo(Instant.EPOCH);
    }

    @Test
    public void missingFieldsDefaultTo1900() throws CrParserException {
        final TimeParser parser = TimeParser.of(CrSpecs.builder()
                .timeFormatArgsLibrary(Arrays.asList("%j", "%H%M"))
                .build());
        assertThat(parser.parse(Arrays.asList("32", "1200")).toLocalDateTime())
                .isEqualTo(LocalDateTime.of(1900, 2, 1, 12, 0));
    }

    @Test
    public void ambiguousTimeTakesStandardOffset() throws CrParserException {
        final TimeParser parser = TimeParser.of(CrSpecs.builder()
                .device(DeviceProfile.CR1000)
                .timeZone("Europe/Stockholm")
                .build());
        // Clocks went back from 03:00 CEST to 02:00 CET, so 02:30 happened twice.
        assertThat(parser.parse(Collections.singletonList("2016-10-30 02:30:00")).getOffset())
                .isEqualTo(ZoneOffset.ofHours(1));
        // Clocks went forward from 02:00 CET to 03:00 CEST, so 02:30 never happened.
        assertThat(parser.parse(Collections.singletonList("2016-03-27 02:30:00")).toInstant())
                .isEqualTo(Instant.parse("2016-03-27T01:30:00Z"));
    }

    @Test
    public void sharedParserIsStable() throws CrParserException {
        final TimeParser parser = splitParser("UTC");
        final ZonedDateTime first = parser.parse(SPLIT_VALUES);
        assertThat(parser.parse(SPLIT_VALUES)).isEqualTo(first);
    }

    private static TimeParser splitParser(final String timeZone) {
        return TimeParser.of(CrSpecs.builder().timeZone(timeZone).timeFormatArgsLibrary(SPLIT_LIBRARY).build());
    }
}

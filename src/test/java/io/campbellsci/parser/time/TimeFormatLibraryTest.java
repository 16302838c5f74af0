package io.campbellsci.parser.time;

import io.campbellsci.parser.util.CrParserException;
import io.campbellsci.parser.util.InvalidCompactTimeException;
import io.campbellsci.parser.util.UnsupportedTimeFormatException;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

public class TimeFormatLibraryTest {
    private static final TimeFormatLibrary CR10_LIBRARY = TimeFormatLibrary.of(Arrays.asList("%y", "%j", "%H%M"));
    private static final TokenExpander CR10_EXPANDER = new HourMinuteExpander("CR10");

    @Test
    public void pairsTokensWithValues() throws CrParserException {
        final TimeFormatLibrary library = TimeFormatLibrary.of(Arrays.asList("%Y", "%m", "%d"));
        assertThat(library.resolve(Arrays.asList("2016", "1", "30"), TokenExpander.PASS_THROUGH))
                .isEqualTo(new ParsedTimeInfo("%Y,%m,%d", "2016,1,30"));
    }

    @Test
    public void stopsAtTheShorterSide() throws CrParserException {
        final TimeFormatLibrary library = TimeFormatLibrary.of(Arrays.asList("%Y", "%j"));
        assertThat(library.resolve(Arrays.asList("2016", "30", "2230"), TokenExpander.PASS_THROUGH))
                .isEqualTo(new ParsedTimeInfo("%Y,%j", "2016,30"));
        assertThat(library.resolve(Collections.singletonList("2016"), TokenExpander.PASS_THROUGH))
                .isEqualTo(new ParsedTimeInfo("%Y", "2016"));
    }

    @Test
    public void emptyInputsResolveToEmpty() throws CrParserException {
        assertThat(CR10_LIBRARY.resolve(Collections.emptyList(), CR10_EXPANDER).isEmpty()).isTrue();
        assertThat(TimeFormatLibrary.of(Collections.emptyList())
                .resolve(Arrays.asList("2016", "30"), TokenExpander.PASS_THROUGH).isEmpty()).isTrue();
    }

    @Test
    public void expandsCompactHourMinute() throws CrParserException {
        assertThat(CR10_LIBRARY.resolve(Arrays.asList("16", "30", "945"), CR10_EXPANDER))
                .isEqualTo(new ParsedTimeInfo("%y,%j,%H%M", "16,30,0945"));
        assertThat(CR10_LIBRARY.resolve(Arrays.asList("16", "30"), CR10_EXPANDER))
                .isEqualTo(new ParsedTimeInfo("%y,%j", "16,30"));
    }

    @Test
    public void expandsLegacyHourMinuteToken() throws CrParserException {
        final TimeFormatLibrary library = TimeFormatLibrary.of(Arrays.asList("%Y", "%j", "Hour/Minute"));
        assertThat(library.resolve(Arrays.asList("2016", "30", "5"), CR10_EXPANDER))
                .isEqualTo(new ParsedTimeInfo("%Y,%j,%H:%M", "2016,30,00:05"));
    }

    @Test
    public void hourMinuteDevicesRejectSurplusValues() {
        Assertions.assertThatThrownBy(
                () -> CR10_LIBRARY.resolve(Arrays.asList("16", "30", "2230", "15"), CR10_EXPANDER))
                .isInstanceOf(UnsupportedTimeFormatException.class)
                .hasMessage("CR10 only supports 3 time values ([%y, %j, %H%M]), got 4 time values");
    }

    @Test
    public void badCompactValueFails() {
        Assertions.assertThatThrownBy(
                () -> CR10_LIBRARY.resolve(Arrays.asList("16", "30", "22300"), CR10_EXPANDER))
                .isInstanceOf(InvalidCompactTimeException.class);
    }
}

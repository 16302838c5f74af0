package io.campbellsci.parser.time;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;

/**
 * Translates strftime-style formats ({@code %Y-%m-%d %H:%M:%S}, {@code %y,%j,%H%M}, ...) into
 * {@link DateTimeFormatter}s.
 *
 * <p>
 * Numeric fields accept values without their leading zeros, except when the field is immediately followed by another
 * numeric directive: then it is read at its full width so that run-together fields like {@code %H%M} can be split.
 * Fields the format does not mention are left unset; {@link TimeParser} supplies the defaults.
 */
public class StrftimeFormats {
    /** Two-digit years 69-99 map to 19xx, 00-68 to 20xx. */
    private static final int TWO_DIGIT_YEAR_BASE = 1969;

    /**
     * @param format The strftime-style format
     * @return A strict formatter for {@code format}.
     * @throws IllegalArgumentException If the format uses a directive that is not supported
     */
    public static DateTimeFormatter compile(final String format) {
        final DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder().parseCaseInsensitive();
        final int length = format.length();
        int ii = 0;
        while (ii < length) {
            final char ch = format.charAt(ii);
            if (ch != '%') {
                builder.appendLiteral(ch);
                ++ii;
                continue;
            }
            if (ii + 1 == length) {
                throw new IllegalArgumentException(
                        String.format("Format '%s' ends with an incomplete directive", format));
            }
            final char directive = format.charAt(ii + 1);
            final boolean fullWidth = numericDirectiveAt(format, ii + 2);
            appendDirective(builder, format, directive, fullWidth);
            ii += 2;
        }
        return builder.toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }

    private static void appendDirective(final DateTimeFormatterBuilder builder, final String format,
            final char directive, final boolean fullWidth) {
        switch (directive) {
            case 'Y':
                builder.appendValue(ChronoField.YEAR, 4);
                return;
            case 'y':
                builder.appendValueReduced(ChronoField.YEAR, 2, 2, TWO_DIGIT_YEAR_BASE);
                return;
            case 'm':
                appendNumber(builder, ChronoField.MONTH_OF_YEAR, 2, fullWidth);
                return;
            case 'd':
                appendNumber(builder, ChronoField.DAY_OF_MONTH, 2, fullWidth);
                return;
            case 'j':
                appendNumber(builder, ChronoField.DAY_OF_YEAR, 3, fullWidth);
                return;
            case 'H':
                appendNumber(builder, ChronoField.HOUR_OF_DAY, 2, fullWidth);
                return;
            case 'I':
                appendNumber(builder, ChronoField.CLOCK_HOUR_OF_AMPM, 2, fullWidth);
                return;
            case 'M':
                appendNumber(builder, ChronoField.MINUTE_OF_HOUR, 2, fullWidth);
                return;
            case 'S':
                appendNumber(builder, ChronoField.SECOND_OF_MINUTE, 2, fullWidth);
                return;
            case 'f':
                builder.appendFraction(ChronoField.NANO_OF_SECOND, fullWidth ? 6 : 1, 6, false);
                return;
            case 'p':
                builder.appendText(ChronoField.AMPM_OF_DAY);
                return;
            case 'b':
            case 'h':
                builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.SHORT);
                return;
            case 'B':
                builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.FULL);
                return;
            case 'a':
                builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.SHORT);
                return;
            case 'A':
                builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.FULL);
                return;
            case 'z':
                // +HH:MM, +HHMM or Z
                builder.optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
                        .optionalStart().appendOffset("+HHMM", "Z").optionalEnd();
                return;
            case '%':
                builder.appendLiteral('%');
                return;
            default:
                throw new IllegalArgumentException(
                        String.format("Format '%s' uses unsupported directive '%%%c'", format, directive));
        }
    }

    private static void appendNumber(final DateTimeFormatterBuilder builder, final ChronoField field,
            final int maxWidth, final boolean fullWidth) {
        if (fullWidth) {
            builder.appendValue(field, maxWidth);
        } else {
            builder.appendValue(field, 1, maxWidth, SignStyle.NOT_NEGATIVE);
        }
    }

    private static boolean numericDirectiveAt(final String format, final int index) {
        if (index + 1 >= format.length() || format.charAt(index) != '%') {
            return false;
        }
        return "YymdjHIMSf".indexOf(format.charAt(index + 1)) >= 0;
    }

    private StrftimeFormats() {}
}

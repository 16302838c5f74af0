package io.campbellsci.parser.time;

import io.campbellsci.parser.CrSpecs;
import io.campbellsci.parser.util.CrParserException;
import io.campbellsci.parser.util.TimeParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Turns the raw time values of one row into a zone-aware timestamp.
 *
 * <p>
 * The values are paired with the time format library (see {@link TimeFormatLibrary#resolve}), parsed with the combined
 * strftime-style format, and localized to the configured zone. A value that already carries an offset ({@code %z})
 * keeps it. Optionally the result is shifted to UTC.
 *
 * <p>
 * Instances are immutable apart from an internal formatter cache and may be shared between threads.
 */
public final class TimeParser {
    private static final Logger LOG = LoggerFactory.getLogger(TimeParser.class);

    /** What an empty format applied to an empty value parses to. Also the source of defaults for missing fields. */
    public static final LocalDateTime DEFAULT_DATE_TIME = LocalDateTime.of(1900, 1, 1, 0, 0);

    private final ZoneId zoneId;
    private final TimeFormatLibrary library;
    private final TokenExpander expander;
    private final ConcurrentMap<String, DateTimeFormatter> formatters = new ConcurrentHashMap<>();

    public TimeParser(final ZoneId zoneId, final TimeFormatLibrary library, final TokenExpander expander) {
        this.zoneId = zoneId;
        this.library = library;
        this.expander = expander;
    }

    /**
     * @param specs The device configuration
     * @return A parser for the device, zone and library in {@code specs}.
     */
    public static TimeParser of(final CrSpecs specs) {
        return new TimeParser(specs.zoneId(), TimeFormatLibrary.of(specs.timeFormatArgsLibrary()),
                specs.device().tokenExpander());
    }

    public ZoneId zoneId() {
        return zoneId;
    }

    public TimeFormatLibrary library() {
        return library;
    }

    /**
     * @param timeValues The raw time values of one row, in column order
     * @return The combined format and value the values resolve to.
     * @throws CrParserException If the device rejects the values
     */
    public ParsedTimeInfo resolve(final List<String> timeValues) throws CrParserException {
        return library.resolve(timeValues, expander);
    }

    /**
     * Parse without the epoch fallback and without shifting to UTC.
     *
     * @param timeValues The raw time values of one row, in column order
     * @return The timestamp, in the configured zone or in the offset carried by the value.
     * @throws CrParserException If the values cannot be resolved or parsed
     */
    public ZonedDateTime parse(final List<String> timeValues) throws CrParserException {
        return parse(timeValues, false, false);
    }

    /**
     * @param timeValues The raw time values of one row, in column order
     * @param ignoreParsingError If true, a value that does not match its format yields the UNIX epoch in the
     *        configured zone instead of failing. Device-level errors (too many values, a bad Hour/Minute value) are
     *        still raised.
     * @param toUtc If true, the result is shifted to UTC. This also applies to the epoch fallback.
     * @return The timestamp.
     * @throws CrParserException If the values cannot be resolved, or cannot be parsed and
     *         {@code ignoreParsingError} is false
     */
    public ZonedDateTime parse(final List<String> timeValues, final boolean ignoreParsingError, final boolean toUtc)
            throws CrParserException {
        final ParsedTimeInfo info = resolve(timeValues);
        ZonedDateTime parsed;
        try {
            parsed = parseAndLocalize(info);
        } catch (TimeParsingException e) {
            if (!ignoreParsingError) {
                throw e;
            }
            LOG.warn("{}; substituting the UNIX epoch", e.getMessage());
            parsed = Instant.EPOCH.atZone(zoneId);
        }
        return toUtc ? parsed.withZoneSameInstant(ZoneOffset.UTC) : parsed;
    }

    private ZonedDateTime parseAndLocalize(final ParsedTimeInfo info) throws TimeParsingException {
        if (info.isEmpty()) {
            return localize(DEFAULT_DATE_TIME);
        }
        try {
            final TemporalAccessor fields = formatterFor(info.timeFormat()).parse(info.timeValue());
            final LocalDateTime local = LocalDateTime.of(toLocalDate(fields), toLocalTime(fields));
            final ZoneOffset offset = fields.query(TemporalQueries.offset());
            if (offset != null) {
                LOG.debug("Time string {} carries offset {}; not localizing to {}", info.timeValue(), offset, zoneId);
                return ZonedDateTime.of(local, offset);
            }
            return localize(local);
        } catch (DateTimeException | IllegalArgumentException e) {
            throw new TimeParsingException(info.timeValue(), info.timeFormat(), e);
        }
    }

    /**
     * Attach the configured zone to a wall-clock time. Ambiguous times (clocks set back) take the later offset, i.e.
     * standard time; times in a gap (clocks set forward) are moved forward by the length of the gap.
     */
    private ZonedDateTime localize(final LocalDateTime local) {
        return ZonedDateTime.ofLocal(local, zoneId, null).withLaterOffsetAtOverlap();
    }

    private DateTimeFormatter formatterFor(final String format) {
        return formatters.computeIfAbsent(format, StrftimeFormats::compile);
    }

    private static LocalDate toLocalDate(final TemporalAccessor fields) {
        final LocalDate date = fields.query(TemporalQueries.localDate());
        if (date != null) {
            return date;
        }
        final int year = getOrDefault(fields, ChronoField.YEAR, DEFAULT_DATE_TIME.getYear());
        if (fields.isSupported(ChronoField.DAY_OF_YEAR)) {
            return LocalDate.ofYearDay(year, fields.get(ChronoField.DAY_OF_YEAR));
        }
        return LocalDate.of(year,
                getOrDefault(fields, ChronoField.MONTH_OF_YEAR, DEFAULT_DATE_TIME.getMonthValue()),
                getOrDefault(fields, ChronoField.DAY_OF_MONTH, DEFAULT_DATE_TIME.getDayOfMonth()));
    }

    private static LocalTime toLocalTime(final TemporalAccessor fields) {
        final LocalTime time = fields.query(TemporalQueries.localTime());
        if (time != null) {
            return time;
        }
        int hour = getOrDefault(fields, ChronoField.HOUR_OF_DAY, -1);
        if (hour < 0) {
            // the resolver turns %I into HOUR_OF_AMPM; without %p it reads as a morning hour
            hour = getOrDefault(fields, ChronoField.HOUR_OF_AMPM, 0)
                    + 12 * getOrDefault(fields, ChronoField.AMPM_OF_DAY, 0);
        }
        return LocalTime.of(hour,
                getOrDefault(fields, ChronoField.MINUTE_OF_HOUR, 0),
                getOrDefault(fields, ChronoField.SECOND_OF_MINUTE, 0),
                getOrDefault(fields, ChronoField.NANO_OF_SECOND, 0));
    }

    private static int getOrDefault(final TemporalAccessor fields, final ChronoField field, final int defaultValue) {
        return fields.isSupported(field) ? fields.get(field) : defaultValue;
    }
}

package io.campbellsci.parser;

import io.campbellsci.parser.annotations.BuildableStyle;
import io.campbellsci.parser.time.DeviceProfile;
import io.campbellsci.parser.time.TimeParser;
import io.campbellsci.parser.util.UnknownTimeZoneException;
import org.immutables.value.Value.Check;
import org.immutables.value.Value.Default;
import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Lazy;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;

/**
 * Describes a datalogger model and the time zone its clock runs in. The time format library says how its time
 * columns are read. Build a {@link TimeParser} from it with {@link TimeParser#of}.
 */
@Immutable
@BuildableStyle
public abstract class CrSpecs {
    /** The zone used when none is configured. */
    public static final String DEFAULT_TIME_ZONE = "UTC";

    /**
     * The Builder for the CrSpecs class.
     */
    public interface Builder {
        /**
         * Copy all the parameters from {@code specs} into {@code this} builder.
         *
         * @param specs The source object
         * @return self after copying over all the properties.
         */
        Builder from(CrSpecs specs);

        /**
         * The datalogger model. Determines the default time format library and how custom tokens such as the
         * compact Hour/Minute column are decoded.
         *
         * @param device The model
         * @return self after modifying the device property.
         */
        Builder device(DeviceProfile device);

        /**
         * The IANA name of the zone the logger's clock runs in, e.g. {@code Europe/Stockholm} or {@code Etc/GMT-1}.
         * An unknown name makes {@link #build()} fail.
         *
         * @param timeZone The zone name
         * @return self after modifying the timeZone property.
         */
        Builder timeZone(String timeZone);

        /**
         * Override the device's default time format library. One strftime-style token per time column, in column
         * order.
         *
         * @param elements The tokens
         * @return self after modifying the timeFormatArgsLibrary property.
         */
        Builder timeFormatArgsLibrary(Iterable<String> elements);

        /**
         * Build the CrSpecs object.
         *
         * @return the CrSpecs object.
         * @throws UnknownTimeZoneException if the time zone is not a known zone
         */
        CrSpecs build();
    }

    /**
     * Creates a builder for {@link CrSpecs}.
     *
     * @return the builder
     */
    public static Builder builder() {
        return ImmutableCrSpecs.builder();
    }

    /**
     * A generic logger in UTC with no preset library.
     *
     * @return The CrSpecs for the specified device.
     */
    public static CrSpecs generic() {
        return builder().build();
    }

    /**
     * A CR10 in UTC. Equivalent to {@code builder().device(DeviceProfile.CR10).build()}.
     *
     * @return The CrSpecs for the specified device.
     */
    public static CrSpecs cr10() {
        return builder().device(DeviceProfile.CR10).build();
    }

    /**
     * A CR10X in UTC. Equivalent to {@code builder().device(DeviceProfile.CR10X).build()}.
     *
     * @return The CrSpecs for the specified device.
     */
    public static CrSpecs cr10x() {
        return builder().device(DeviceProfile.CR10X).build();
    }

    /**
     * A CR1000 in UTC. Equivalent to {@code builder().device(DeviceProfile.CR1000).build()}.
     *
     * @return The CrSpecs for the specified device.
     */
    public static CrSpecs cr1000() {
        return builder().device(DeviceProfile.CR1000).build();
    }

    /**
     * Validates the {@link CrSpecs}.
     */
    @Check
    void check() {
        zoneId();
        for (final String token : timeFormatArgsLibrary()) {
            if (token == null || token.isEmpty()) {
                throw new IllegalArgumentException(
                        "CrSpecs failed validation: timeFormatArgsLibrary contains an empty token");
            }
        }
    }

    /**
     * See {@link Builder#device}.
     *
     * @return The datalogger model.
     */
    @Default
    public DeviceProfile device() {
        return DeviceProfile.GENERIC;
    }

    /**
     * See {@link Builder#timeZone}.
     *
     * @return The zone name.
     */
    @Default
    public String timeZone() {
        return DEFAULT_TIME_ZONE;
    }

    /**
     * See {@link Builder#timeFormatArgsLibrary}.
     *
     * @return The time format tokens.
     */
    @Default
    public List<String> timeFormatArgsLibrary() {
        return device().defaultTimeFormatArgsLibrary();
    }

    /**
     * @return The zone named by {@link #timeZone()}.
     * @throws UnknownTimeZoneException if the name is not a known zone
     */
    @Lazy
    public ZoneId zoneId() {
        try {
            return ZoneId.of(timeZone());
        } catch (DateTimeException e) {
            throw new UnknownTimeZoneException(timeZone(), e);
        }
    }
}

package io.campbellsci.parser.time;

import io.campbellsci.parser.util.InvalidCompactTimeException;

/**
 * Decodes the compact Hour/Minute column written by CR10-family loggers, where leading zeros are dropped: {@code 0}
 * is midnight, {@code 30} is 00:30, {@code 945} is 09:45 and {@code 2355} is 23:55.
 */
public class HourMinute {
    /**
     * Left-pad the compact value to exactly four characters. Only the length is examined; digits are validated later
     * by the time parser.
     *
     * @param value The compact Hour/Minute value, 1 to 4 characters long
     * @return The value as HHMM.
     * @throws InvalidCompactTimeException If {@code value} is empty or longer than four characters
     */
    public static String toHhmm(final String value) throws InvalidCompactTimeException {
        switch (value.length()) {
            case 1:
                return "000" + value;
            case 2:
                return "00" + value;
            case 3:
                return "0" + value;
            case 4:
                return value;
            default:
                throw new InvalidCompactTimeException(value);
        }
    }

    /**
     * @param value The compact Hour/Minute value, 1 to 4 characters long
     * @return The value as HH:MM.
     * @throws InvalidCompactTimeException If {@code value} is empty or longer than four characters
     */
    public static String toHhColonMm(final String value) throws InvalidCompactTimeException {
        final String hhmm = toHhmm(value);
        return hhmm.substring(0, 2) + ':' + hhmm.substring(2);
    }

    private HourMinute() {}
}

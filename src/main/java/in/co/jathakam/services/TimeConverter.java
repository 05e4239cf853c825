package in.co.jathakam.services;

import in.co.jathakam.pojos.BirthMoment;
import in.co.jathakam.pojos.ErrorKind;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Converts local civil time at the place of birth into a Julian Day (UT).
 *
 * <p>The UTC offset is a plain number of hours; no timezone database is consulted and leap
 * seconds are ignored. The Gregorian calendar is assumed for every date.</p>
 *
 * <pre>
 *   if month &lt;= 2: year -= 1, month += 12
 *   a  = floor(year / 100)
 *   b  = 2 - a + floor(a / 4)
 *   JD = floor(365.25 (year + 4716)) + floor(30.6001 (month + 1)) + day + b - 1524.5 + dayFraction
 * </pre>
 */
public final class TimeConverter {

    private static final long NANOS_PER_HOUR = 3_600_000_000_000L;

    private TimeConverter() {}

    /**
     * Parse a birth date ({@code yyyy-MM-dd}) and time ({@code HH:mm}, {@code HH:mm:ss} or with
     * fractional seconds) into a {@link BirthMoment}.
     *
     * @throws ChartComputationException with {@link ErrorKind#INVALID_INPUT} when either string is
     *                                   missing, malformed or names an impossible date/time, or the
     *                                   offset is not a usable number of hours
     */
    public static BirthMoment parse(String date, String time, double utcOffsetHours) throws ChartComputationException {
        if (date == null || date.isBlank() || time == null || time.isBlank()) {
            throw new ChartComputationException(ErrorKind.INVALID_INPUT, "Birth date and time are required");
        }
        LocalDate localDate;
        LocalTime localTime;
        try {
            localDate = LocalDate.parse(date.trim(), DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            throw new ChartComputationException(ErrorKind.INVALID_INPUT, "Invalid birth date: " + date, e);
        }
        try {
            localTime = LocalTime.parse(time.trim(), DateTimeFormatter.ISO_LOCAL_TIME);
        } catch (DateTimeParseException e) {
            throw new ChartComputationException(ErrorKind.INVALID_INPUT, "Invalid birth time: " + time, e);
        }
        validateOffset(utcOffsetHours);
        return new BirthMoment(localDate, localTime, utcOffsetHours);
    }

    /**
     * Julian Day (UT) of a birth moment.
     *
     * @throws ChartComputationException with {@link ErrorKind#INVALID_INPUT} when the offset is
     *                                   unusable or shifting by it leaves the supported date range
     */
    public static double toJulianDay(BirthMoment moment) throws ChartComputationException {
        validateOffset(moment.getUtcOffsetHours());
        LocalDateTime utc;
        try {
            utc = toUtc(moment);
        } catch (DateTimeException e) {
            throw new ChartComputationException(ErrorKind.INVALID_INPUT,
                    "Birth moment out of supported range: " + moment.toLocalDateTime(), e);
        }
        return julianDay(utc);
    }

    /**
     * Shift the local birth time to UTC by subtracting the offset.
     */
    public static LocalDateTime toUtc(BirthMoment moment) {
        long offsetNanos = Math.round(moment.getUtcOffsetHours() * NANOS_PER_HOUR);
        return moment.toLocalDateTime().minusNanos(offsetNanos);
    }

    /**
     * Julian Day of a UTC calendar instant, including sub-second precision.
     */
    public static double julianDay(LocalDateTime utc) {
        int year = utc.getYear();
        int month = utc.getMonthValue();
        if (month <= 2) {
            year -= 1;
            month += 12;
        }
        double a = Math.floor(year / 100.0);
        double b = 2 - a + Math.floor(a / 4.0);
        double jd = Math.floor(365.25 * (year + 4716)) + Math.floor(30.6001 * (month + 1))
                + utc.getDayOfMonth() + b - 1524.5;

        double seconds = utc.getSecond() + utc.getNano() / 1_000_000_000.0;
        jd += (utc.getHour() + utc.getMinute() / 60.0 + seconds / 3600.0) / 24.0;
        return jd;
    }

    private static void validateOffset(double utcOffsetHours) throws ChartComputationException {
        if (!Double.isFinite(utcOffsetHours) || Math.abs(utcOffsetHours) > ChartServiceConfig.MAX_UTC_OFFSET_HOURS) {
            throw new ChartComputationException(ErrorKind.INVALID_INPUT, "Invalid UTC offset: " + utcOffsetHours);
        }
    }
}

package in.co.jathakam.services;

import in.co.jathakam.pojos.BirthMoment;
import in.co.jathakam.pojos.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TimeConverter}.
 *
 * Naming convention: test_<scenario>_<expectedBehaviour>
 */
public class TimeConverterTest {

    private static final double DELTA = 1e-9;

    // =========================================================================
    // julianDay()
    // =========================================================================

    @Test
    public void test_j2000Noon_isExactEpoch() {
        assertEquals(2451545.0, TimeConverter.julianDay(LocalDateTime.of(2000, 1, 1, 12, 0)));
    }

    @Test
    public void test_midnight_endsInHalfDay() {
        assertEquals(2451544.5, TimeConverter.julianDay(LocalDateTime.of(2000, 1, 1, 0, 0)));
    }

    @Test
    public void test_marchDate_noYearShift() {
        // 1987-04-10 00:00 UT is JD 2446895.5
        assertEquals(2446895.5, TimeConverter.julianDay(LocalDateTime.of(1987, 4, 10, 0, 0)), DELTA);
    }

    @Test
    public void test_januaryDate_treatedAsMonth13OfPreviousYear() {
        // 1988-01-27 00:00 UT is JD 2447187.5
        assertEquals(2447187.5, TimeConverter.julianDay(LocalDateTime.of(1988, 1, 27, 0, 0)), DELTA);
    }

    @Test
    public void test_leapDay_isOneDayAfterFeb28() {
        double feb28 = TimeConverter.julianDay(LocalDateTime.of(2024, 2, 28, 6, 0));
        double feb29 = TimeConverter.julianDay(LocalDateTime.of(2024, 2, 29, 6, 0));
        assertEquals(1.0, feb29 - feb28, DELTA);
    }

    @Test
    public void test_subSecondTime_contributesToFraction() {
        double whole = TimeConverter.julianDay(LocalDateTime.of(2000, 1, 1, 12, 0, 0));
        double half = TimeConverter.julianDay(LocalDateTime.of(2000, 1, 1, 12, 0, 0, 500_000_000));
        assertEquals(0.5 / 86400.0, half - whole, 1e-10);
    }

    // =========================================================================
    // toJulianDay() / toUtc()
    // =========================================================================

    @Test
    public void test_positiveOffset_isSubtracted() throws Exception {
        BirthMoment moment = new BirthMoment(LocalDate.of(2000, 1, 1), LocalTime.of(17, 30), 5.5);
        assertEquals(LocalDateTime.of(2000, 1, 1, 12, 0), TimeConverter.toUtc(moment));
        assertEquals(2451545.0, TimeConverter.toJulianDay(moment));
    }

    @Test
    public void test_offsetCrossingMidnight_movesToPreviousDay() {
        BirthMoment moment = new BirthMoment(LocalDate.of(2003, 3, 1), LocalTime.of(2, 0), 5.5);
        assertEquals(LocalDateTime.of(2003, 2, 28, 20, 30), TimeConverter.toUtc(moment));
    }

    @Test
    public void test_negativeOffset_isAdded() {
        BirthMoment moment = new BirthMoment(LocalDate.of(2000, 1, 1), LocalTime.of(7, 0), -5.0);
        assertEquals(LocalDateTime.of(2000, 1, 1, 12, 0), TimeConverter.toUtc(moment));
    }

    @Test
    public void test_shiftPastLastSupportedYear_isInvalidInput() throws Exception {
        BirthMoment moment = TimeConverter.parse("+999999999-12-31", "23:00", -5.0);
        ChartComputationException e = assertThrows(ChartComputationException.class,
                () -> TimeConverter.toJulianDay(moment));
        assertEquals(ErrorKind.INVALID_INPUT, e.getErrorKind());
    }

    // =========================================================================
    // parse()
    // =========================================================================

    @Test
    public void test_parseHoursAndMinutes_succeeds() throws Exception {
        BirthMoment moment = TimeConverter.parse("2003-02-13", "07:00", 5.5);
        assertEquals(LocalDate.of(2003, 2, 13), moment.getDate());
        assertEquals(LocalTime.of(7, 0), moment.getTime());
        assertEquals(5.5, moment.getUtcOffsetHours());
    }

    @Test
    public void test_parseFractionalSeconds_keepsNanos() throws Exception {
        BirthMoment moment = TimeConverter.parse("2003-02-13", "07:00:30.250", 0.0);
        assertEquals(LocalTime.of(7, 0, 30, 250_000_000), moment.getTime());
    }

    @ParameterizedTest
    @ValueSource(strings = {"2023-02-30", "2023-13-01", "2023-2-3", "13/02/2003", "", "  "})
    public void test_invalidDate_isInvalidInput(String date) {
        ChartComputationException e = assertThrows(ChartComputationException.class,
                () -> TimeConverter.parse(date, "07:00", 5.5));
        assertEquals(ErrorKind.INVALID_INPUT, e.getErrorKind());
    }

    @ParameterizedTest
    @ValueSource(strings = {"25:00", "07:60", "7am", "07-00"})
    public void test_invalidTime_isInvalidInput(String time) {
        ChartComputationException e = assertThrows(ChartComputationException.class,
                () -> TimeConverter.parse("2003-02-13", time, 5.5));
        assertEquals(ErrorKind.INVALID_INPUT, e.getErrorKind());
    }

    @Test
    public void test_missingDate_isInvalidInput() {
        ChartComputationException e = assertThrows(ChartComputationException.class,
                () -> TimeConverter.parse(null, "07:00", 5.5));
        assertEquals(ErrorKind.INVALID_INPUT, e.getErrorKind());
    }

    @Test
    public void test_offsetOutOfRange_isInvalidInput() {
        assertEquals(ErrorKind.INVALID_INPUT, assertThrows(ChartComputationException.class,
                () -> TimeConverter.parse("2003-02-13", "07:00", 19.0)).getErrorKind());
        assertEquals(ErrorKind.INVALID_INPUT, assertThrows(ChartComputationException.class,
                () -> TimeConverter.parse("2003-02-13", "07:00", Double.NaN)).getErrorKind());
    }
}

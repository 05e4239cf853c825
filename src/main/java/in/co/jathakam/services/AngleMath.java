package in.co.jathakam.services;

/**
 * Angle and time helpers shared by the position solvers.
 */
public final class AngleMath {

    /** Julian Day of the J2000.0 epoch (2000-01-01 12:00 TT, treated as UT here). */
    public static final double J2000 = 2451545.0;

    /** Days in a Julian century. */
    public static final double DAYS_PER_CENTURY = 36525.0;

    private AngleMath() {}

    /**
     * Modulo defined as floor division, where the sign follows the divisor.
     * Unlike {@code %}, negative dividends land in [0, divisor).
     */
    public static double modulo(double dividend, double divisor) {
        return dividend - divisor * Math.floor(dividend / divisor);
    }

    /**
     * Reduce an angle to [0, 360).
     */
    public static double normalize(double degrees) {
        double reduced = modulo(degrees, 360.0);
        // -1e-17 reduces to 360.0 in floating point
        return reduced >= 360.0 ? 0.0 : reduced;
    }

    /** Julian centuries elapsed since J2000.0. */
    public static double julianCenturies(double julianDay) {
        return (julianDay - J2000) / DAYS_PER_CENTURY;
    }

    public static double sinDeg(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }
}

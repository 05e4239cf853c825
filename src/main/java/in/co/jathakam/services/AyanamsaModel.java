package in.co.jathakam.services;

/**
 * Polynomial approximation of the Lahiri ayanamsa:
 * {@code 23.85 + 0.013972 T + 0.000013 T²} degrees, T in Julian centuries since J2000.0.
 *
 * <p>Every solver subtracts the value from this one model so that all bodies and the ascendant
 * share a single sidereal frame.</p>
 */
public class AyanamsaModel {

    private static final double AT_EPOCH = 23.85;
    private static final double LINEAR = 0.013972;
    private static final double QUADRATIC = 0.000013;

    public double ayanamsa(double julianDay) {
        double t = AngleMath.julianCenturies(julianDay);
        return AT_EPOCH + (LINEAR * t) + (QUADRATIC * t * t);
    }

    /** Convert a tropical longitude to the sidereal frame, reduced to [0, 360). */
    public double toSidereal(double tropicalLongitude, double julianDay) {
        return AngleMath.normalize(tropicalLongitude - ayanamsa(julianDay));
    }
}

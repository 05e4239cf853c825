package in.co.jathakam.services;

import static in.co.jathakam.services.AngleMath.sinDeg;

/**
 * Apparent geocentric longitude of the Sun from its mean longitude, mean anomaly and a
 * three-term equation of center, corrected for nutation and shifted into the sidereal frame.
 */
public class SolarPositionSolver {

    private final AyanamsaModel ayanamsaModel;

    public SolarPositionSolver(AyanamsaModel ayanamsaModel) {
        this.ayanamsaModel = ayanamsaModel;
    }

    /**
     * Sidereal longitude of the Sun in [0, 360).
     */
    public double siderealLongitude(double julianDay) {
        return ayanamsaModel.toSidereal(apparentLongitude(julianDay), julianDay);
    }

    /**
     * Tropical apparent longitude, not reduced modulo 360.
     */
    double apparentLongitude(double julianDay) {
        double t = AngleMath.julianCenturies(julianDay);
        double meanLongitude = 280.46646 + 36000.76983 * t + 0.0003032 * t * t;
        double meanAnomaly = 357.52911 + 35999.05029 * t - 0.0001537 * t * t;

        double equationOfCenter = (1.914602 - 0.004817 * t - 0.000014 * t * t) * sinDeg(meanAnomaly);
        equationOfCenter += (0.019993 - 0.000101 * t) * sinDeg(2 * meanAnomaly);
        equationOfCenter += 0.000289 * sinDeg(3 * meanAnomaly);

        double trueLongitude = meanLongitude + equationOfCenter;
        double omega = 125.04 - 1934.136 * t;
        return trueLongitude - 0.00569 - 0.00478 * sinDeg(omega);
    }
}

package in.co.jathakam.services;

import static in.co.jathakam.services.AngleMath.sinDeg;

/**
 * Geocentric longitude of the Moon from its mean longitude plus the ten largest periodic
 * terms of the lunar theory, shifted into the sidereal frame.
 */
public class LunarPositionSolver {

    /**
     * Periodic terms: amplitude in degrees and integer multipliers of D, M, M', F.
     * Summed in this order.
     */
    private static final double[][] PERIODIC_TERMS = {
            //  amplitude    D   M   M'  F
            {  6.288774,     0,  0,  1,  0 },
            {  1.274027,     2,  0, -1,  0 },
            {  0.658314,     2,  0,  0,  0 },
            {  0.213618,     0,  0,  2,  0 },
            { -0.185116,     0,  1,  0,  0 },
            { -0.114332,     0,  0,  0,  2 },
            {  0.058793,     2,  0, -2,  0 },
            {  0.057066,     2, -1, -1,  0 },
            {  0.053322,     2,  0,  1,  0 },
            {  0.045758,     2, -1,  0,  0 },
    };

    private final AyanamsaModel ayanamsaModel;

    public LunarPositionSolver(AyanamsaModel ayanamsaModel) {
        this.ayanamsaModel = ayanamsaModel;
    }

    /**
     * Sidereal longitude of the Moon in [0, 360).
     */
    public double siderealLongitude(double julianDay) {
        return ayanamsaModel.toSidereal(tropicalLongitude(julianDay), julianDay);
    }

    double tropicalLongitude(double julianDay) {
        double t = AngleMath.julianCenturies(julianDay);
        double meanLongitude = 218.3164477 + 481267.88123421 * t - 0.0015786 * t * t;
        double elongation = 297.8501921 + 445267.1114034 * t - 0.0018819 * t * t;           // D
        double solarAnomaly = 357.5291092 + 35999.0502909 * t - 0.0001536 * t * t;          // M
        double lunarAnomaly = 134.9633964 + 477198.8675055 * t + 0.0087414 * t * t;         // M'
        double argumentOfLatitude = 93.2720950 + 483202.0175233 * t - 0.0036539 * t * t;    // F

        double longitude = meanLongitude;
        for (double[] term : PERIODIC_TERMS) {
            double argument = term[1] * elongation + term[2] * solarAnomaly
                    + term[3] * lunarAnomaly + term[4] * argumentOfLatitude;
            longitude += term[0] * sinDeg(argument);
        }
        return longitude;
    }
}

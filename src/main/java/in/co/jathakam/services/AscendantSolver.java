package in.co.jathakam.services;

import in.co.jathakam.pojos.ErrorKind;
import in.co.jathakam.pojos.Location;

import java.util.Locale;

/**
 * The ecliptic degree rising on the eastern horizon, from local sidereal time, the mean
 * obliquity of the ecliptic and the observer's latitude.
 *
 * <pre>
 *   GMST = 280.46061837 + 360.98564736629 (JD - 2451545) + 0.000387933 T² - T³ / 38710000
 *   LST  = GMST + longitude
 *   ε    = 23.4393 - 0.0130042 T - 0.0000164 T² + 0.0000504 T³
 *   asc  = atan2(-cos LST, sin LST cos ε + tan φ sin ε)
 * </pre>
 */
public class AscendantSolver {

    private final AyanamsaModel ayanamsaModel;

    public AscendantSolver(AyanamsaModel ayanamsaModel) {
        this.ayanamsaModel = ayanamsaModel;
    }

    /**
     * Sidereal ascendant in [0, 360).
     *
     * @throws ChartComputationException {@link ErrorKind#NUMERIC_DOMAIN_ERROR} at the poles, where
     *                                   tan φ is undefined, or if the result is not finite
     */
    public double siderealAscendant(double julianDay, Location location) throws ChartComputationException {
        return ayanamsaModel.toSidereal(tropicalAscendant(julianDay, location), julianDay);
    }

    /**
     * Tropical ascendant in [0, 360).
     */
    public double tropicalAscendant(double julianDay, Location location) throws ChartComputationException {
        double latitude = location.getLatitude();
        if (Math.abs(latitude) >= 90.0) {
            throw new ChartComputationException(ErrorKind.NUMERIC_DOMAIN_ERROR,
                    String.format(Locale.ENGLISH, "Ascendant is undefined at latitude %.4f", latitude));
        }

        double lst = localSiderealTime(julianDay, location.getLongitude());
        double lstRad = Math.toRadians(lst);
        double obliquityRad = Math.toRadians(meanObliquity(julianDay));
        double latRad = Math.toRadians(latitude);

        double y = -Math.cos(lstRad);
        double x = Math.sin(lstRad) * Math.cos(obliquityRad) + Math.tan(latRad) * Math.sin(obliquityRad);
        double ascendant = Math.toDegrees(Math.atan2(y, x));
        if (!Double.isFinite(ascendant)) {
            throw new ChartComputationException(ErrorKind.NUMERIC_DOMAIN_ERROR,
                    "Ascendant computation produced a non-finite value for JD " + julianDay);
        }
        if (ascendant < 0) {
            ascendant += 360;
        }
        return AngleMath.normalize(ascendant);
    }

    /** Greenwich mean sidereal time, in degrees [0, 360). */
    public static double greenwichMeanSiderealTime(double julianDay) {
        double t = AngleMath.julianCenturies(julianDay);
        double gmst = 280.46061837 + 360.98564736629 * (julianDay - AngleMath.J2000)
                + 0.000387933 * t * t - t * t * t / 38710000.0;
        return AngleMath.normalize(gmst);
    }

    /** Local sidereal time for an east-positive longitude, in degrees [0, 360). */
    public static double localSiderealTime(double julianDay, double longitude) {
        return AngleMath.normalize(greenwichMeanSiderealTime(julianDay) + longitude);
    }

    /** Mean obliquity of the ecliptic, in degrees. */
    public static double meanObliquity(double julianDay) {
        double t = AngleMath.julianCenturies(julianDay);
        return 23.4393 - 0.0130042 * t - 0.0000164 * t * t + 0.0000504 * t * t * t;
    }
}

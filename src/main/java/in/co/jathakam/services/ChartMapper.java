package in.co.jathakam.services;

import in.co.jathakam.pojos.BodyPlacement;
import in.co.jathakam.pojos.CelestialBody;
import in.co.jathakam.pojos.Nakshatra;
import in.co.jathakam.pojos.NakshatraPosition;
import in.co.jathakam.pojos.ZodiacSign;

/**
 * Maps a continuous sidereal longitude onto the discrete coordinates of a chart.
 *
 * <h2>Rules</h2>
 * <pre>
 *   sign        = floor(lon / 30) mod 12
 *   house       = floor(((lon - asc + 360) mod 360) / 30) + 1                  (equal houses)
 *   nakshatra   = floor(lon / 13°20′) mod 27,  pada = floor((lon mod 13°20′) / 3°20′) + 1
 *   navamsa     = (sign + offset[sign mod 3] + floor(degreeInSign / 3°20′)) mod 12,  offset = {0, 8, 4}
 * </pre>
 * Navamsa houses are counted from the navamsa ascendant: the ascendant's own navamsa sign taken
 * at 0° of that sign.
 *
 * <p>Boundaries use floor semantics: a longitude exactly on a division starts the next division.
 * Inputs are normalized first, so {@code lon} and {@code lon + 360k} map identically.</p>
 *
 * <p>All methods are static.</p>
 */
public final class ChartMapper {

    /** Navamsa counting offset for movable, fixed and dual signs (sign index mod 3). */
    private static final int[] NAVAMSA_OFFSETS = {0, 8, 4};

    private static final int PADAS_IN_ZODIAC = 27 * 4;

    private ChartMapper() {}

    // -------------------------------------------------------------------------
    // Rasi
    // -------------------------------------------------------------------------

    public static int signIndex(double longitude) {
        return Math.min((int) Math.floor(AngleMath.normalize(longitude) / 30.0), 11);
    }

    public static ZodiacSign signOf(double longitude) {
        return ZodiacSign.fromIndex(signIndex(longitude));
    }

    /** Degrees past the start of the sign, in [0, 30). */
    public static double degreeInSign(double longitude) {
        double normalized = AngleMath.normalize(longitude);
        return Math.max(0.0, normalized - 30.0 * signIndex(normalized));
    }

    /**
     * Equal house of {@code longitude} counted from {@code ascendant}, 1..12.
     * The ascendant degree itself opens house 1.
     */
    public static int house(double longitude, double ascendant) {
        double fromAscendant = AngleMath.modulo(longitude - ascendant + 360.0, 360.0);
        int house = (int) Math.floor(fromAscendant / 30.0) + 1;
        return house > 12 ? house - 12 : house;
    }

    // -------------------------------------------------------------------------
    // Nakshatra
    // -------------------------------------------------------------------------

    public static NakshatraPosition nakshatraOf(double longitude) {
        int quarter = Math.min((int) Math.floor(AngleMath.normalize(longitude) * PADAS_IN_ZODIAC / 360.0),
                PADAS_IN_ZODIAC - 1);
        return new NakshatraPosition(Nakshatra.fromIndex(quarter / 4), quarter % 4 + 1);
    }

    // -------------------------------------------------------------------------
    // Navamsa
    // -------------------------------------------------------------------------

    public static int navamsaSignIndex(double longitude) {
        int sign = signIndex(longitude);
        int segment = Math.min((int) Math.floor(degreeInSign(longitude) * 9.0 / 30.0), 8);
        return (sign + NAVAMSA_OFFSETS[sign % 3] + segment) % 12;
    }

    public static ZodiacSign navamsaSignOf(double longitude) {
        return ZodiacSign.fromIndex(navamsaSignIndex(longitude));
    }

    /**
     * Navamsa ascendant: 0° of the sign the ascendant occupies in the navamsa chart.
     * Computed once per chart so body navamsa houses never depend on their own navamsa sign.
     */
    public static double navamsaAscendant(double ascendant) {
        return navamsaSignIndex(ascendant) * 30.0;
    }

    public static int navamsaHouse(double longitude, double navamsaAscendant) {
        return house(navamsaSignIndex(longitude) * 30.0, navamsaAscendant);
    }

    // -------------------------------------------------------------------------
    // Placement
    // -------------------------------------------------------------------------

    /**
     * Build the full placement of a body from its sidereal longitude.
     *
     * @param ascendant        sidereal ascendant of the chart
     * @param navamsaAscendant value of {@link #navamsaAscendant(double)} for that ascendant
     */
    public static BodyPlacement place(CelestialBody body, double longitude, double ascendant, double navamsaAscendant) {
        double normalized = AngleMath.normalize(longitude);
        return BodyPlacement.of(
                body,
                normalized,
                signOf(normalized),
                degreeInSign(normalized),
                house(normalized, ascendant),
                nakshatraOf(normalized),
                navamsaSignOf(normalized),
                navamsaHouse(normalized, navamsaAscendant));
    }
}

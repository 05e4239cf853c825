package in.co.jathakam.pojos;

import java.util.Locale;

/**
 * Immutable position of one body in a chart.
 *
 * <p>Every field except {@link #body} and {@link #longitude} is derived from the longitude and the
 * chart's ascendant; instances are built by {@code ChartMapper#place} and never modified.</p>
 */
public final class BodyPlacement {

    /** Body this placement describes. */
    public final CelestialBody body;

    /** Sidereal ecliptic longitude in [0, 360). */
    public final double longitude;

    /** Rasi the longitude falls in. */
    public final ZodiacSign sign;

    /** Degrees past the start of {@link #sign}, in [0, 30). */
    public final double degreeInSign;

    /** Equal house counted from the ascendant, 1..12. */
    public final int house;

    /** Lunar mansion and pada. */
    public final NakshatraPosition nakshatra;

    /** Sign occupied in the ninth-harmonic (navamsa) chart. */
    public final ZodiacSign navamsaSign;

    /** House in the navamsa chart, counted from the navamsa ascendant, 1..12. */
    public final int navamsaHouse;

    private BodyPlacement(CelestialBody body, double longitude, ZodiacSign sign, double degreeInSign, int house,
                          NakshatraPosition nakshatra, ZodiacSign navamsaSign, int navamsaHouse) {
        this.body = body;
        this.longitude = longitude;
        this.sign = sign;
        this.degreeInSign = degreeInSign;
        this.house = house;
        this.nakshatra = nakshatra;
        this.navamsaSign = navamsaSign;
        this.navamsaHouse = navamsaHouse;
    }

    public static BodyPlacement of(CelestialBody body, double longitude, ZodiacSign sign, double degreeInSign,
                                   int house, NakshatraPosition nakshatra, ZodiacSign navamsaSign, int navamsaHouse) {
        return new BodyPlacement(body, longitude, sign, degreeInSign, house, nakshatra, navamsaSign, navamsaHouse);
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH,
                "BodyPlacement{%s lon=%.6f sign=%s house=%d nakshatra=%s navamsa=%s/%d}",
                body, longitude, sign, house, nakshatra, navamsaSign, navamsaHouse);
    }
}

package in.co.jathakam.pojos;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A fully computed rasi + navamsa chart for one birth moment and location.
 * Placements iterate in {@link CelestialBody} declaration order.
 */
public final class ChartResult {

    private final double ascendant;
    private final ZodiacSign ascendantSign;
    private final NakshatraPosition ascendantNakshatra;
    private final double navamsaAscendant;
    private final Map<CelestialBody, BodyPlacement> placements;
    private final double julianDay;
    private final double ayanamsa;
    private final BirthMoment birthMoment;
    private final Location location;
    private final String placeName;

    public ChartResult(double ascendant, ZodiacSign ascendantSign, NakshatraPosition ascendantNakshatra,
                       double navamsaAscendant, Map<CelestialBody, BodyPlacement> placements,
                       double julianDay, double ayanamsa, BirthMoment birthMoment, Location location,
                       String placeName) {
        if (placements.size() != CelestialBody.values().length) {
            throw new IllegalArgumentException("Chart needs a placement for every body, got " + placements.keySet());
        }
        this.ascendant = ascendant;
        this.ascendantSign = Objects.requireNonNull(ascendantSign, "ascendantSign");
        this.ascendantNakshatra = Objects.requireNonNull(ascendantNakshatra, "ascendantNakshatra");
        this.navamsaAscendant = navamsaAscendant;
        this.placements = Collections.unmodifiableMap(new EnumMap<>(placements));
        this.julianDay = julianDay;
        this.ayanamsa = ayanamsa;
        this.birthMoment = Objects.requireNonNull(birthMoment, "birthMoment");
        this.location = Objects.requireNonNull(location, "location");
        this.placeName = placeName;
    }

    /** Sidereal ascendant longitude in [0, 360). */
    public double getAscendant() {
        return ascendant;
    }

    public ZodiacSign getAscendantSign() {
        return ascendantSign;
    }

    public NakshatraPosition getAscendantNakshatra() {
        return ascendantNakshatra;
    }

    /** Start (degree 0) of the sign the ascendant occupies in the navamsa chart. */
    public double getNavamsaAscendant() {
        return navamsaAscendant;
    }

    public ZodiacSign getNavamsaAscendantSign() {
        return ZodiacSign.fromIndex((int) Math.floor(navamsaAscendant / 30.0));
    }

    public Map<CelestialBody, BodyPlacement> getPlacements() {
        return placements;
    }

    public BodyPlacement getPlacement(CelestialBody body) {
        return placements.get(body);
    }

    public double getJulianDay() {
        return julianDay;
    }

    public double getAyanamsa() {
        return ayanamsa;
    }

    public BirthMoment getBirthMoment() {
        return birthMoment;
    }

    public Location getLocation() {
        return location;
    }

    /** Name the location was resolved from, or null when coordinates were given directly. */
    public String getPlaceName() {
        return placeName;
    }
}

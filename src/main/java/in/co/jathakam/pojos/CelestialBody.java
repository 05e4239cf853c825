package in.co.jathakam.pojos;

/**
 * The nine grahas placed in a chart, declared in chart order.
 * {@link #values()} is the order placements are computed and reported in.
 */
public enum CelestialBody {
    SUN("Sun", "சூரியன்"),
    MOON("Moon", "சந்திரன்"),
    MERCURY("Mercury", "புதன்"),
    VENUS("Venus", "சுக்ரன்"),
    MARS("Mars", "செவ்வாய்"),
    JUPITER("Jupiter", "குரு"),
    SATURN("Saturn", "சனி"),
    RAHU("Rahu", "ராகு"),
    KETU("Ketu", "கேது");

    private final String displayName;
    private final String tamilName;

    CelestialBody(String displayName, String tamilName) {
        this.displayName = displayName;
        this.tamilName = tamilName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getTamilName() {
        return tamilName;
    }

    /** True for the five planets solved from Keplerian elements. */
    public boolean isKeplerian() {
        return this == MERCURY || this == VENUS || this == MARS || this == JUPITER || this == SATURN;
    }
}

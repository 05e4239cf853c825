package in.co.jathakam.pojos;

/**
 * The twelve 30° rasis, in zodiacal order starting at Aries.
 */
public enum ZodiacSign {
    ARIES("Aries", "மேஷம்"),
    TAURUS("Taurus", "ரிஷபம்"),
    GEMINI("Gemini", "மிதுனம்"),
    CANCER("Cancer", "கடகம்"),
    LEO("Leo", "சிம்மம்"),
    VIRGO("Virgo", "கன்னி"),
    LIBRA("Libra", "துலாம்"),
    SCORPIO("Scorpio", "விருச்சிகம்"),
    SAGITTARIUS("Sagittarius", "தனுசு"),
    CAPRICORN("Capricorn", "மகரம்"),
    AQUARIUS("Aquarius", "கும்பம்"),
    PISCES("Pisces", "மீனம்");

    private static final ZodiacSign[] ORDERED = values();

    private final String displayName;
    private final String tamilName;

    ZodiacSign(String displayName, String tamilName) {
        this.displayName = displayName;
        this.tamilName = tamilName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getTamilName() {
        return tamilName;
    }

    /**
     * Sign at the given position of the zodiac. The index is reduced modulo 12,
     * so negative and overflowing indexes wrap around.
     */
    public static ZodiacSign fromIndex(int index) {
        return ORDERED[Math.floorMod(index, ORDERED.length)];
    }
}

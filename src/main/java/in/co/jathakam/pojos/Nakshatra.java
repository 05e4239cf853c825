package in.co.jathakam.pojos;

/**
 * The 27 lunar mansions, each spanning 13°20′ of the sidereal zodiac from 0° Aries.
 */
public enum Nakshatra {
    ASHWINI("அஸ்வினி"),
    BHARANI("பரணி"),
    KRITTIKA("கிருத்திகை"),
    ROHINI("ரோகிணி"),
    MRIGASHIRA("மிருகசீரிடம்"),
    ARDRA("ஆருத்ரா"),
    PUNARVASU("புனர்வசு"),
    PUSHYA("புஷ்யம்"),
    ASHLESHA("ஆஸ்லேஷா"),
    MAGHA("மகம்"),
    PURVA_PHALGUNI("பூர்வபல்குனி"),
    UTTARA_PHALGUNI("உத்திரபல்குனி"),
    HASTA("ஹஸ்தம்"),
    CHITRA("சித்திரை"),
    SWATI("சுவாதி"),
    VISHAKHA("விசாகம்"),
    ANURADHA("அனுஷம்"),
    JYESHTHA("ஜெய்ஷ்டா"),
    MULA("மூலம்"),
    PURVA_ASHADHA("பூராஷாடா"),
    UTTARA_ASHADHA("உத்திராஷாடா"),
    SHRAVANA("திருவோணம்"),
    DHANISHTA("அவிட்டம்"),
    SHATABHISHA("சதயம்"),
    PURVA_BHADRAPADA("பூரட்டாதி"),
    UTTARA_BHADRAPADA("உத்திரட்டாதி"),
    REVATI("ரேவதி");

    private static final Nakshatra[] ORDERED = values();

    private final String tamilName;

    Nakshatra(String tamilName) {
        this.tamilName = tamilName;
    }

    public String getTamilName() {
        return tamilName;
    }

    /** 1-based position, as nakshatras are conventionally numbered. */
    public int getNumber() {
        return ordinal() + 1;
    }

    public static Nakshatra fromIndex(int index) {
        return ORDERED[Math.floorMod(index, ORDERED.length)];
    }
}

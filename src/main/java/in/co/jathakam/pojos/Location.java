package in.co.jathakam.pojos;

import java.util.Locale;

/**
 * Geographic position of a birth place in decimal degrees.
 * North latitudes and east longitudes are positive.
 */
public final class Location {

    private final double latitude;
    private final double longitude;

    public Location(double latitude, double longitude) {
        if (!isValid(latitude, longitude)) {
            throw new IllegalArgumentException(String.format(Locale.ENGLISH,
                    "Coordinates out of range: latitude=%s, longitude=%s", latitude, longitude));
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public static boolean isValid(double latitude, double longitude) {
        return Double.isFinite(latitude) && Double.isFinite(longitude)
                && latitude >= -90.0 && latitude <= 90.0
                && longitude >= -180.0 && longitude <= 180.0;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Location)) return false;
        Location that = (Location) o;
        return Double.compare(latitude, that.latitude) == 0 && Double.compare(longitude, that.longitude) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(latitude) + Double.hashCode(longitude);
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "%.4f, %.4f", latitude, longitude);
    }
}

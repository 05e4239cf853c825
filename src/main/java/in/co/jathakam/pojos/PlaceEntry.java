package in.co.jathakam.pojos;

/**
 * One row of the bundled location directory (cities.json).
 */
public class PlaceEntry {
    private String name;
    private double latitude;
    private double longitude;
    private double utcOffset; // hours, fractional allowed

    public PlaceEntry() {
    }

    public PlaceEntry(String name, double latitude, double longitude, double utcOffset) {
        this.name = name;
        this.latitude = latitude;
        this.longitude = longitude;
        this.utcOffset = utcOffset;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public double getLatitude() {
        return latitude;
    }

    public void setLatitude(double latitude) {
        this.latitude = latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public void setLongitude(double longitude) {
        this.longitude = longitude;
    }

    public double getUtcOffset() {
        return utcOffset;
    }

    public void setUtcOffset(double utcOffset) {
        this.utcOffset = utcOffset;
    }
}

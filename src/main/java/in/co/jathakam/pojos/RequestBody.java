package in.co.jathakam.pojos;

public class RequestBody {
    private String function;

    // Birth chart fields
    private String birthDate;   // yyyy-MM-dd
    private String birthTime;   // HH:mm, HH:mm:ss or HH:mm:ss.SSS
    private String birthPlace;  // Resolved through the location directory
    private Double latitude;    // Explicit coordinates take precedence over birthPlace
    private Double longitude;
    private Double utcOffset;   // Hours east of UTC, e.g. 5.5

    public RequestBody() {
    }

    public String getFunction() {
        return function;
    }

    public void setFunction(String function) {
        this.function = function;
    }

    public String getBirthDate() {
        return birthDate;
    }

    public void setBirthDate(String birthDate) {
        this.birthDate = birthDate;
    }

    public String getBirthTime() {
        return birthTime;
    }

    public void setBirthTime(String birthTime) {
        this.birthTime = birthTime;
    }

    public String getBirthPlace() {
        return birthPlace;
    }

    public void setBirthPlace(String birthPlace) {
        this.birthPlace = birthPlace;
    }

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }

    public Double getUtcOffset() {
        return utcOffset;
    }

    public void setUtcOffset(Double utcOffset) {
        this.utcOffset = utcOffset;
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null && utcOffset != null;
    }
}

package in.co.jathakam.services;

/**
 * Configuration class for the chart engine and its Lambda surface.
 * Contains constants for action names, resources and numeric tuning.
 */
public class ChartServiceConfig {

    // Supported actions
    public static final String ACTION_GET_BIRTH_CHART = "get_birth_chart";
    public static final String ACTION_GET_CHART_LOCATIONS = "get_chart_locations";

    // Bundled location directory
    public static final String CITIES_RESOURCE = "/cities.json";

    // Sidereal frame
    public static final String AYANAMSHA = "lahiri";

    // Kepler equation solver
    public static final int KEPLER_MAX_ITERATIONS = 10;
    public static final double KEPLER_TOLERANCE_RADIANS = 1e-8;

    // Widest UTC offset accepted, in hours (matches java.time.ZoneOffset bounds)
    public static final double MAX_UTC_OFFSET_HOURS = 18.0;

    private ChartServiceConfig() {}
}

package in.co.jathakam.services;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import in.co.jathakam.pojos.BirthMoment;
import in.co.jathakam.pojos.BodyPlacement;
import in.co.jathakam.pojos.ChartOutcome;
import in.co.jathakam.pojos.ChartResult;
import in.co.jathakam.pojos.ErrorKind;
import in.co.jathakam.pojos.Location;
import in.co.jathakam.pojos.NakshatraPosition;
import in.co.jathakam.pojos.RequestBody;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request-level facade over {@link ChartOrchestrator}. Validates the request body, picks explicit
 * coordinates or a directory place, and renders the outcome as JSON.
 */
public class ChartService {

    private final ChartOrchestrator orchestrator;
    private final LocationDirectory locationDirectory;
    private final Gson gson;

    public ChartService() {
        this(new StaticLocationDirectory());
    }

    public ChartService(LocationDirectory locationDirectory) {
        this(new ChartOrchestrator(locationDirectory), locationDirectory);
    }

    public ChartService(ChartOrchestrator orchestrator, LocationDirectory locationDirectory) {
        this.orchestrator = orchestrator;
        this.locationDirectory = locationDirectory;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    /**
     * Birth chart for the body's date, time and place. Explicit latitude, longitude and UTC offset
     * take precedence over {@code birthPlace}.
     */
    public String getBirthChart(RequestBody requestBody) {
        if (requestBody == null || requestBody.getBirthDate() == null || requestBody.getBirthTime() == null) {
            return errorJson(ErrorKind.INVALID_INPUT, "Missing required birth date or time");
        }

        ChartOutcome outcome;
        if (requestBody.hasCoordinates()) {
            LoggingService.setPlace(requestBody.getLatitude() + "," + requestBody.getLongitude());
            outcome = orchestrator.compute(requestBody.getBirthDate(), requestBody.getBirthTime(),
                    requestBody.getUtcOffset(), requestBody.getLatitude(), requestBody.getLongitude());
        } else if (requestBody.getBirthPlace() != null) {
            LoggingService.setPlace(requestBody.getBirthPlace());
            outcome = orchestrator.compute(requestBody.getBirthDate(), requestBody.getBirthTime(),
                    requestBody.getBirthPlace());
        } else {
            return errorJson(ErrorKind.INVALID_INPUT,
                    "Either birthPlace or latitude, longitude and utcOffset are required");
        }

        if (!outcome.isSuccess()) {
            return errorJson(outcome.getErrorKind(), outcome.getErrorMessage());
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("chart", toJsonMap(outcome.getChart()));
        return gson.toJson(response);
    }

    public String getChartLocations() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("locations", locationDirectory.names());
        return gson.toJson(response);
    }

    // ============= Rendering =============

    Map<String, Object> toJsonMap(ChartResult chart) {
        BirthMoment moment = chart.getBirthMoment();
        Location location = chart.getLocation();

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("birthDate", moment.getDate().toString());
        map.put("birthTime", moment.getTime().toString());
        map.put("utcOffset", moment.getUtcOffsetHours());
        if (chart.getPlaceName() != null) {
            map.put("birthPlace", chart.getPlaceName());
        }
        map.put("latitude", location.getLatitude());
        map.put("longitude", location.getLongitude());
        map.put("julianDay", chart.getJulianDay());
        map.put("ayanamshaSystem", ChartServiceConfig.AYANAMSHA);
        map.put("ayanamsha", chart.getAyanamsa());

        Map<String, Object> ascendant = new LinkedHashMap<>();
        ascendant.put("longitude", chart.getAscendant());
        ascendant.put("sign", chart.getAscendantSign().getDisplayName());
        ascendant.put("signTamil", chart.getAscendantSign().getTamilName());
        ascendant.put("degreeInSign", ChartMapper.degreeInSign(chart.getAscendant()));
        putNakshatra(ascendant, chart.getAscendantNakshatra());
        ascendant.put("navamsaLongitude", chart.getNavamsaAscendant());
        ascendant.put("navamsaSign", chart.getNavamsaAscendantSign().getDisplayName());
        map.put("ascendant", ascendant);

        List<Map<String, Object>> planets = new ArrayList<>();
        for (BodyPlacement placement : chart.getPlacements().values()) {
            Map<String, Object> planet = new LinkedHashMap<>();
            planet.put("name", placement.body.getDisplayName());
            planet.put("nameTamil", placement.body.getTamilName());
            planet.put("longitude", placement.longitude);
            planet.put("sign", placement.sign.getDisplayName());
            planet.put("signTamil", placement.sign.getTamilName());
            planet.put("degreeInSign", placement.degreeInSign);
            planet.put("house", placement.house);
            putNakshatra(planet, placement.nakshatra);
            planet.put("navamsaSign", placement.navamsaSign.getDisplayName());
            planet.put("navamsaHouse", placement.navamsaHouse);
            planets.add(planet);
        }
        map.put("planets", planets);
        return map;
    }

    private static void putNakshatra(Map<String, Object> target, NakshatraPosition position) {
        target.put("nakshatra", position.getNakshatra().name());
        target.put("nakshatraNumber", position.getNakshatra().getNumber());
        target.put("nakshatraTamil", position.getNakshatra().getTamilName());
        target.put("pada", position.getPada());
    }

    private String errorJson(ErrorKind kind, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", false);
        response.put("errorCode", kind.name());
        response.put("errorMessage", message);
        return gson.toJson(response);
    }
}

package in.co.jathakam.services;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import in.co.jathakam.pojos.RequestBody;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ChartServiceTest {

    private final ChartService chartService = new ChartService();

    private static RequestBody birthRequest(String place) {
        RequestBody body = new RequestBody();
        body.setFunction(ChartServiceConfig.ACTION_GET_BIRTH_CHART);
        body.setBirthDate("2003-02-13");
        body.setBirthTime("07:00");
        body.setBirthPlace(place);
        return body;
    }

    private static JsonObject parse(String json) {
        return JsonParser.parseString(json).getAsJsonObject();
    }

    @Test
    public void testBirthChartByPlaceName() {
        JsonObject response = parse(chartService.getBirthChart(birthRequest("Chennai")));

        assertTrue(response.get("success").getAsBoolean());
        JsonObject chart = response.getAsJsonObject("chart");
        assertEquals("Chennai", chart.get("birthPlace").getAsString());
        assertEquals("2003-02-13", chart.get("birthDate").getAsString());
        assertEquals("07:00", chart.get("birthTime").getAsString());
        assertEquals(5.5, chart.get("utcOffset").getAsDouble());
        assertEquals("lahiri", chart.get("ayanamshaSystem").getAsString());

        JsonObject ascendant = chart.getAsJsonObject("ascendant");
        assertEquals("Leo", ascendant.get("sign").getAsString());
        assertEquals("Gemini", ascendant.get("navamsaSign").getAsString());

        JsonArray planets = chart.getAsJsonArray("planets");
        assertEquals(9, planets.size());
        assertEquals("Sun", planets.get(0).getAsJsonObject().get("name").getAsString());
        assertEquals("Ketu", planets.get(8).getAsJsonObject().get("name").getAsString());

        JsonObject moon = planets.get(1).getAsJsonObject();
        assertEquals("Gemini", moon.get("sign").getAsString());
        assertEquals("ARDRA", moon.get("nakshatra").getAsString());
        assertEquals(2, moon.get("pada").getAsInt());
        assertEquals(11, moon.get("house").getAsInt());
    }

    @Test
    public void testExplicitCoordinatesWinOverPlaceName() {
        RequestBody body = birthRequest("London");
        body.setLatitude(13.0827);
        body.setLongitude(80.2707);
        body.setUtcOffset(5.5);

        JsonObject chart = parse(chartService.getBirthChart(body)).getAsJsonObject("chart");

        assertNull(chart.get("birthPlace"));
        assertEquals(13.0827, chart.get("latitude").getAsDouble());
        assertEquals("Leo", chart.getAsJsonObject("ascendant").get("sign").getAsString());
    }

    @Test
    public void testUnknownPlaceIsLocationUnresolved() {
        JsonObject response = parse(chartService.getBirthChart(birthRequest("Atlantis")));

        assertFalse(response.get("success").getAsBoolean());
        assertEquals("LOCATION_UNRESOLVED", response.get("errorCode").getAsString());
        assertNull(response.get("chart"));
    }

    @Test
    public void testMissingDateIsInvalidInput() {
        RequestBody body = birthRequest("Chennai");
        body.setBirthDate(null);

        JsonObject response = parse(chartService.getBirthChart(body));

        assertEquals("INVALID_INPUT", response.get("errorCode").getAsString());
    }

    @Test
    public void testNoPlaceAndNoCoordinatesIsInvalidInput() {
        RequestBody body = birthRequest(null);
        body.setLatitude(13.0);

        JsonObject response = parse(chartService.getBirthChart(body));

        assertEquals("INVALID_INPUT", response.get("errorCode").getAsString());
    }

    @Test
    public void testPoleIsNumericDomainError() {
        RequestBody body = birthRequest(null);
        body.setLatitude(-90.0);
        body.setLongitude(0.0);
        body.setUtcOffset(0.0);

        JsonObject response = parse(chartService.getBirthChart(body));

        assertEquals("NUMERIC_DOMAIN_ERROR", response.get("errorCode").getAsString());
    }

    @Test
    public void testChartLocationsListsDirectory() {
        JsonObject response = parse(chartService.getChartLocations());

        assertTrue(response.get("success").getAsBoolean());
        JsonArray locations = response.getAsJsonArray("locations");
        assertEquals(8, locations.size());
        assertEquals("Chennai", locations.get(0).getAsString());
    }
}

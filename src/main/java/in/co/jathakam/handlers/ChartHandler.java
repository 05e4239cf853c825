package in.co.jathakam.handlers;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import in.co.jathakam.pojos.ErrorKind;
import in.co.jathakam.pojos.RequestBody;
import in.co.jathakam.services.ChartService;
import in.co.jathakam.services.ChartServiceConfig;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Handler for birth chart operations.
 */
public class ChartHandler {

    private static final Set<String> ACTIONS = Set.of(
            ChartServiceConfig.ACTION_GET_BIRTH_CHART,
            ChartServiceConfig.ACTION_GET_CHART_LOCATIONS);

    private final ChartService chartService;
    private final Gson gson;

    public ChartHandler(ChartService chartService) {
        this.chartService = chartService;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    public static boolean handles(String function) {
        return function != null && ACTIONS.contains(function);
    }

    public String handleRequest(String action, RequestBody requestBody) {
        return switch (action) {
            case ChartServiceConfig.ACTION_GET_BIRTH_CHART -> chartService.getBirthChart(requestBody);
            case ChartServiceConfig.ACTION_GET_CHART_LOCATIONS -> chartService.getChartLocations();
            default -> unknownAction(action);
        };
    }

    private String unknownAction(String action) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", false);
        response.put("errorCode", ErrorKind.INVALID_INPUT.name());
        response.put("errorMessage", "Unknown action: " + action);
        return gson.toJson(response);
    }
}

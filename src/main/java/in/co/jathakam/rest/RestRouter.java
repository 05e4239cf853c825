package in.co.jathakam.rest;

import in.co.jathakam.handlers.ChartHandler;
import in.co.jathakam.pojos.RequestBody;
import in.co.jathakam.services.ChartServiceConfig;
import in.co.jathakam.services.LoggingService;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps HTTP method + path to chart handler actions.
 */
public class RestRouter {

    private static final String PREFIX = "/api/v1/";

    private final List<Route> routes = new ArrayList<>();
    private final ChartHandler chartHandler;

    public RestRouter(ChartHandler chartHandler) {
        this.chartHandler = chartHandler;
        registerRoutes();
    }

    /**
     * Attempt to route a request. Returns null if no route matches.
     */
    public ApiResponse route(String method, String path, String queryString, RequestBody body) {
        if (body == null) {
            body = new RequestBody();
        }
        Map<String, String> queryParams = parseQueryString(queryString);
        String normalizedPath = stripTrailingSlash(path);

        for (Route route : routes) {
            if (!route.method.equalsIgnoreCase(method) || !route.path.equals(normalizedPath)) {
                continue;
            }

            LoggingService.setFunction(route.functionName);
            try {
                ApiResponse response = route.handler.handle(body, queryParams);
                if (response == null) {
                    return ApiResponse.errorMessage("No response from handler");
                }
                return response;
            } catch (RuntimeException e) {
                LoggingService.error("rest_handler_exception", e);
                return ApiResponse.errorMessage(e.getMessage() != null ? e.getMessage() : "Internal server error");
            }
        }

        return null; // No matching route
    }

    public static boolean isRestPath(String path) {
        return path != null && path.startsWith(PREFIX);
    }

    // ============= Route Registration =============

    private void registerRoutes() {
        post("/api/v1/charts", ChartServiceConfig.ACTION_GET_BIRTH_CHART, (body, queryParams) -> {
            String result = chartHandler.handleRequest(ChartServiceConfig.ACTION_GET_BIRTH_CHART, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        // Query parameters fill in whatever the body leaves out
        get("/api/v1/charts", ChartServiceConfig.ACTION_GET_BIRTH_CHART, (body, queryParams) -> {
            applyQueryParams(body, queryParams);
            String result = chartHandler.handleRequest(ChartServiceConfig.ACTION_GET_BIRTH_CHART, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        get("/api/v1/locations", ChartServiceConfig.ACTION_GET_CHART_LOCATIONS, (body, queryParams) -> {
            String result = chartHandler.handleRequest(ChartServiceConfig.ACTION_GET_CHART_LOCATIONS, body);
            return ResponseConverter.fromHandlerResponse(result);
        });
    }

    private void get(String path, String functionName, RouteHandler handler) {
        routes.add(new Route("GET", path, functionName, handler));
    }

    private void post(String path, String functionName, RouteHandler handler) {
        routes.add(new Route("POST", path, functionName, handler));
    }

    static void applyQueryParams(RequestBody body, Map<String, String> queryParams) {
        if (body.getBirthDate() == null) {
            body.setBirthDate(queryParams.get("birthDate"));
        }
        if (body.getBirthTime() == null) {
            body.setBirthTime(queryParams.get("birthTime"));
        }
        if (body.getBirthPlace() == null) {
            body.setBirthPlace(queryParams.get("birthPlace"));
        }
        if (body.getLatitude() == null) {
            body.setLatitude(parseDouble(queryParams.get("latitude")));
        }
        if (body.getLongitude() == null) {
            body.setLongitude(parseDouble(queryParams.get("longitude")));
        }
        if (body.getUtcOffset() == null) {
            body.setUtcOffset(parseDouble(queryParams.get("utcOffset")));
        }
    }

    /** Null for a missing value; a non-numeric value also yields null so the chart service reports it. */
    private static Double parseDouble(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            LoggingService.warn("rest_query_param_not_numeric", LoggingService.data("value", value));
            return null;
        }
    }

    static Map<String, String> parseQueryString(String queryString) {
        Map<String, String> params = new HashMap<>();
        if (queryString == null || queryString.isEmpty()) return params;
        for (String pair : queryString.split("&")) {
            String[] kv = pair.split("=", 2);
            if (kv.length == 2) {
                params.put(kv[0], URLDecoder.decode(kv[1], StandardCharsets.UTF_8));
            } else if (kv.length == 1) {
                params.put(kv[0], "");
            }
        }
        return params;
    }

    private static String stripTrailingSlash(String path) {
        if (path != null && path.length() > 1 && path.endsWith("/")) {
            return path.substring(0, path.length() - 1);
        }
        return path;
    }

    // ============= Route Model =============

    @FunctionalInterface
    interface RouteHandler {
        ApiResponse handle(RequestBody body, Map<String, String> queryParams);
    }

    static class Route {
        final String method;
        final String path;
        final String functionName;
        final RouteHandler handler;

        Route(String method, String path, String functionName, RouteHandler handler) {
            this.method = method;
            this.path = path;
            this.functionName = functionName;
            this.handler = handler;
        }
    }
}

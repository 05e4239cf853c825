package in.co.jathakam.rest;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP response for the REST surface, returned to Lambda Function URLs as a
 * {@code statusCode/headers/body} map.
 */
public class ApiResponse {

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    private final int statusCode;
    private final Map<String, String> headers;
    private final String body;

    ApiResponse(int statusCode, String body) {
        this.statusCode = statusCode;
        this.body = body;
        this.headers = new HashMap<>();
        this.headers.put("Content-Type", "application/json");
    }

    /**
     * A Function URL handler returning this map gets its own status code instead of a wrapped 200.
     */
    public Map<String, Object> toLambdaResponse() {
        Map<String, Object> response = new HashMap<>();
        response.put("statusCode", statusCode);
        response.put("headers", headers);
        response.put("body", body);
        return response;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    // --- Factory Methods ---

    public static ApiResponse ok(String jsonBody) {
        return new ApiResponse(200, jsonBody);
    }

    public static ApiResponse badRequest(String jsonBody) {
        return new ApiResponse(400, jsonBody);
    }

    public static ApiResponse badRequestMessage(String errorCode, String message) {
        return new ApiResponse(400, messageJson(errorCode, message));
    }

    public static ApiResponse notFound(String jsonBody) {
        return new ApiResponse(404, jsonBody);
    }

    public static ApiResponse notFoundMessage(String message) {
        return new ApiResponse(404, messageJson(null, message));
    }

    public static ApiResponse unprocessable(String jsonBody) {
        return new ApiResponse(422, jsonBody);
    }

    public static ApiResponse errorMessage(String message) {
        return new ApiResponse(500, messageJson(null, message));
    }

    private static String messageJson(String errorCode, String message) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("success", false);
        if (errorCode != null) {
            json.put("errorCode", errorCode);
        }
        json.put("errorMessage", message);
        return gson.toJson(json);
    }
}
